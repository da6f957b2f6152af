package com.whalewatch.status;

import com.whalewatch.aggregation.OrderAggregationBuffer;
import com.whalewatch.config.RedisConfig;
import com.whalewatch.engine.AlertRuleEngine;
import com.whalewatch.engine.EngineStats;
import com.whalewatch.ingest.AlertEventQueue;
import com.whalewatch.ingest.IngestionPipeline;
import com.whalewatch.pool.ConnectionPoolManager;
import com.whalewatch.pool.PoolStatus;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Heartbeat and status reporting.
 *
 * <p>Writes {@code whalewatch:status:lastUpdate} on every update tick so an external checker can
 * tell the process is alive, and logs a one-line summary on every report tick. Redis failures
 * are logged and never interrupt monitoring.
 */
@Service
public class MonitorStatusService {

    private static final Logger log = LoggerFactory.getLogger(MonitorStatusService.class);

    private final RedisTemplate<String, Object> redisTemplate;
    private final ConnectionPoolManager connectionPoolManager;
    private final AlertRuleEngine alertRuleEngine;
    private final IngestionPipeline ingestionPipeline;
    private final AlertEventQueue alertEventQueue;
    private final OrderAggregationBuffer aggregationBuffer;
    private final Clock clock;

    private final long startedAt;
    private volatile long lastHeartbeatAt;

    public MonitorStatusService(
            RedisTemplate<String, Object> redisTemplate,
            ConnectionPoolManager connectionPoolManager,
            AlertRuleEngine alertRuleEngine,
            IngestionPipeline ingestionPipeline,
            AlertEventQueue alertEventQueue,
            OrderAggregationBuffer aggregationBuffer,
            Clock clock) {
        this.redisTemplate = redisTemplate;
        this.connectionPoolManager = connectionPoolManager;
        this.alertRuleEngine = alertRuleEngine;
        this.ingestionPipeline = ingestionPipeline;
        this.alertEventQueue = alertEventQueue;
        this.aggregationBuffer = aggregationBuffer;
        this.clock = clock;
        this.startedAt = clock.millis();
    }

    /** Records the process start time. Called once by the lifecycle on startup. */
    public void recordStart() {
        try {
            redisTemplate.opsForValue().set(RedisConfig.KEY_STATUS_START_TIME, startedAt);
        } catch (DataAccessException e) {
            log.warn("Failed to record start time in Redis: {}", e.getMessage());
        }
    }

    @Scheduled(
            fixedDelayString = "${monitor.status.update-interval:30s}",
            initialDelayString = "${monitor.status.update-interval:30s}")
    public void writeHeartbeat() {
        long now = clock.millis();
        try {
            redisTemplate.opsForValue().set(RedisConfig.KEY_STATUS_LAST_UPDATE, now);
            lastHeartbeatAt = now;
        } catch (DataAccessException e) {
            log.warn("Failed to write status heartbeat: {}", e.getMessage());
        }
    }

    @Scheduled(
            fixedDelayString = "${monitor.status.report-interval:5m}",
            initialDelayString = "${monitor.status.report-interval:5m}")
    public void logReport() {
        SystemStatus status = getSystemStatus();
        PoolStatus pool = status.getPool();
        EngineStats engine = status.getEngine();
        log.info(
                "Status: uptime={}, pool running={} fallback={} subscribed={}/{} ({}%), reconnects={}, "
                        + "events={}, duplicates={}, alerts single={} cumulative={}, deliveryFailures={}, "
                        + "queue={} dropped={}",
                formatUptime(status.getUptimeMs()),
                pool.isRunning(),
                pool.isFallbackMode(),
                pool.getSubscribedEntities(),
                pool.getTotalEntities(),
                Math.round(pool.getSuccessRate() * 100),
                pool.getTotalReconnects(),
                engine.getEventsProcessed(),
                engine.getDuplicatesDropped(),
                engine.getSingleAlerts(),
                engine.getCumulativeAlerts(),
                engine.getDeliveryFailures(),
                status.getQueueDepth(),
                status.getQueueDropped());
    }

    public SystemStatus getSystemStatus() {
        return SystemStatus.builder()
                .startedAt(startedAt)
                .uptimeMs(clock.millis() - startedAt)
                .lastHeartbeatAt(lastHeartbeatAt)
                .pool(connectionPoolManager.getStatus())
                .engine(alertRuleEngine.getStats())
                .payloadsReceived(ingestionPipeline.getPayloadCount())
                .eventsAccepted(ingestionPipeline.getAcceptedCount())
                .replaysSkipped(ingestionPipeline.getReplayedCount())
                .pendingAggregations(aggregationBuffer.getPendingCount())
                .queueDepth(alertEventQueue.size())
                .queueDropped(alertEventQueue.getDroppedCount())
                .build();
    }

    static String formatUptime(long uptimeMs) {
        Duration uptime = Duration.ofMillis(Math.max(uptimeMs, 0));
        return String.format("%dh%02dm", uptime.toHours(), uptime.toMinutesPart());
    }
}
