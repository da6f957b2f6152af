package com.whalewatch.unit.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.whalewatch.api.controller.StatusController;
import com.whalewatch.config.ApiResponseAdvice;
import com.whalewatch.domain.enums.ConnectionState;
import com.whalewatch.engine.AlertRuleEngine;
import com.whalewatch.engine.EngineStats;
import com.whalewatch.exception.ErrorCode;
import com.whalewatch.exception.GlobalExceptionHandler;
import com.whalewatch.exception.TransportException;
import com.whalewatch.pool.ConnectionPoolManager;
import com.whalewatch.pool.PoolStatus;
import com.whalewatch.status.MonitorStatusService;
import com.whalewatch.status.SystemStatus;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for StatusController. Bodies come back wrapped in the success envelope.
 */
class StatusControllerTest {

    private MockMvc mockMvc;

    @Mock
    private MonitorStatusService monitorStatusService;

    @Mock
    private ConnectionPoolManager connectionPoolManager;

    @Mock
    private AlertRuleEngine alertRuleEngine;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        StatusController controller = new StatusController(monitorStatusService, connectionPoolManager, alertRuleEngine);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private PoolStatus poolStatus() {
        return PoolStatus.builder()
                .running(true)
                .strategy("websocket")
                .totalEntities(3)
                .subscribedEntities(3)
                .successRate(1.0)
                .slots(List.of(PoolStatus.SlotStatus.builder()
                        .slot(0)
                        .state(ConnectionState.READY)
                        .assignedEntities(3)
                        .subscribedEntities(3)
                        .lastMessageAgeMs(1200)
                        .build()))
                .build();
    }

    @Test
    void getStatus_returnsSystemSummary() throws Exception {
        when(monitorStatusService.getSystemStatus()).thenReturn(SystemStatus.builder()
                .startedAt(1_700_000_000_000L)
                .uptimeMs(65_000L)
                .pool(poolStatus())
                .payloadsReceived(42)
                .eventsAccepted(40)
                .replaysSkipped(2)
                .queueDepth(0)
                .build());

        mockMvc.perform(get("/api/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.uptimeMs").value(65000))
                .andExpect(jsonPath("$.data.eventsAccepted").value(40))
                .andExpect(jsonPath("$.data.pool.strategy").value("websocket"));
    }

    @Test
    void getPool_returnsSlotStates() throws Exception {
        when(connectionPoolManager.getStatus()).thenReturn(poolStatus());

        mockMvc.perform(get("/api/status/pool"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.running").value(true))
                .andExpect(jsonPath("$.data.slots[0].state").value("READY"))
                .andExpect(jsonPath("$.data.slots[0].subscribedEntities").value(3));
    }

    @Test
    void getEngine_returnsCountersAndWindows() throws Exception {
        when(alertRuleEngine.getStats()).thenReturn(EngineStats.builder()
                .totalEntities(3)
                .activeEntities(2)
                .activeRules(2)
                .eventsProcessed(17)
                .singleAlerts(1)
                .windowTotals(Map.of(
                        "Whale 1", new EngineStats.WindowTotals(new BigDecimal("25000"), BigDecimal.ZERO)))
                .build());

        mockMvc.perform(get("/api/status/engine"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.eventsProcessed").value(17))
                .andExpect(jsonPath("$.data.windowTotals['Whale 1'].in").value(25000));
    }

    @Test
    void failure_mapsToErrorEnvelope() throws Exception {
        when(connectionPoolManager.getStatus()).thenThrow(TransportException.timeout("slot 0 timed out"));

        mockMvc.perform(get("/api/status/pool"))
                .andExpect(status().is(ErrorCode.TRANSPORT_TIMEOUT.getHttpStatus()))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("TRANSPORT_TIMEOUT"));
    }
}
