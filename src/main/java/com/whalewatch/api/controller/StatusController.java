package com.whalewatch.api.controller;

import com.whalewatch.engine.AlertRuleEngine;
import com.whalewatch.engine.EngineStats;
import com.whalewatch.pool.ConnectionPoolManager;
import com.whalewatch.pool.PoolStatus;
import com.whalewatch.status.MonitorStatusService;
import com.whalewatch.status.SystemStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only monitor status.
 *
 * <ul>
 *   <li>GET /api/status -- uptime, pool, engine and queue summary</li>
 *   <li>GET /api/status/pool -- per-slot connection state</li>
 *   <li>GET /api/status/engine -- rule engine counters and window totals</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/status")
public class StatusController {

    private final MonitorStatusService monitorStatusService;
    private final ConnectionPoolManager connectionPoolManager;
    private final AlertRuleEngine alertRuleEngine;

    public StatusController(
            MonitorStatusService monitorStatusService,
            ConnectionPoolManager connectionPoolManager,
            AlertRuleEngine alertRuleEngine) {
        this.monitorStatusService = monitorStatusService;
        this.connectionPoolManager = connectionPoolManager;
        this.alertRuleEngine = alertRuleEngine;
    }

    @GetMapping
    public ResponseEntity<SystemStatus> status() {
        return ResponseEntity.ok(monitorStatusService.getSystemStatus());
    }

    @GetMapping("/pool")
    public ResponseEntity<PoolStatus> pool() {
        return ResponseEntity.ok(connectionPoolManager.getStatus());
    }

    @GetMapping("/engine")
    public ResponseEntity<EngineStats> engine() {
        return ResponseEntity.ok(alertRuleEngine.getStats());
    }
}
