package com.whalewatch.unit.status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.whalewatch.aggregation.OrderAggregationBuffer;
import com.whalewatch.config.RedisConfig;
import com.whalewatch.engine.AlertRuleEngine;
import com.whalewatch.engine.EngineStats;
import com.whalewatch.ingest.AlertEventQueue;
import com.whalewatch.ingest.IngestionPipeline;
import com.whalewatch.pool.ConnectionPoolManager;
import com.whalewatch.pool.PoolStatus;
import com.whalewatch.status.MonitorStatusService;
import com.whalewatch.status.SystemStatus;
import com.whalewatch.unit.support.InMemoryRedis;
import com.whalewatch.unit.support.MutableClock;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;

class MonitorStatusServiceTest {

    private static final long START = 1_700_000_000_000L;

    private InMemoryRedis redis;
    private MutableClock clock;
    private ConnectionPoolManager connectionPoolManager;
    private AlertRuleEngine alertRuleEngine;
    private IngestionPipeline ingestionPipeline;
    private AlertEventQueue alertEventQueue;
    private OrderAggregationBuffer aggregationBuffer;
    private MonitorStatusService service;

    @BeforeEach
    void setUp() {
        redis = new InMemoryRedis();
        clock = new MutableClock(START);
        connectionPoolManager = mock(ConnectionPoolManager.class);
        alertRuleEngine = mock(AlertRuleEngine.class);
        ingestionPipeline = mock(IngestionPipeline.class);
        alertEventQueue = mock(AlertEventQueue.class);
        aggregationBuffer = mock(OrderAggregationBuffer.class);

        when(connectionPoolManager.getStatus()).thenReturn(PoolStatus.builder()
                .running(true)
                .strategy("websocket")
                .totalEntities(2)
                .subscribedEntities(2)
                .successRate(1.0)
                .slots(List.of())
                .build());
        when(alertRuleEngine.getStats()).thenReturn(EngineStats.builder().eventsProcessed(9).build());

        service = new MonitorStatusService(
                redis.template(),
                connectionPoolManager,
                alertRuleEngine,
                ingestionPipeline,
                alertEventQueue,
                aggregationBuffer,
                clock);
    }

    @Test
    @DisplayName("Start time and heartbeat are written to Redis")
    void writesStatusKeys() {
        service.recordStart();
        clock.advance(Duration.ofSeconds(30));
        service.writeHeartbeat();

        assertThat(redis.values())
                .containsEntry(RedisConfig.KEY_STATUS_START_TIME, START)
                .containsEntry(RedisConfig.KEY_STATUS_LAST_UPDATE, START + 30_000);
        assertThat(service.getSystemStatus().getLastHeartbeatAt()).isEqualTo(START + 30_000);
    }

    @Test
    @DisplayName("Redis outage during heartbeat is logged, not thrown")
    void heartbeatSurvivesRedisOutage() {
        doThrow(new RedisConnectionFailureException("down"))
                .when(redis.valueOperations())
                .set(anyString(), any());

        service.writeHeartbeat();

        assertThat(service.getSystemStatus().getLastHeartbeatAt()).isZero();
    }

    @Test
    @DisplayName("System status gathers pool, engine and pipeline counters")
    void aggregatesStatus() {
        when(ingestionPipeline.getPayloadCount()).thenReturn(12L);
        when(ingestionPipeline.getAcceptedCount()).thenReturn(10L);
        when(ingestionPipeline.getReplayedCount()).thenReturn(2L);
        when(alertEventQueue.size()).thenReturn(3);
        when(alertEventQueue.getDroppedCount()).thenReturn(1L);
        when(aggregationBuffer.getPendingCount()).thenReturn(4);
        clock.advance(Duration.ofMinutes(90));

        SystemStatus status = service.getSystemStatus();

        assertThat(status.getUptimeMs()).isEqualTo(Duration.ofMinutes(90).toMillis());
        assertThat(status.getStartedAt()).isEqualTo(START);
        assertThat(status.getPayloadsReceived()).isEqualTo(12);
        assertThat(status.getEventsAccepted()).isEqualTo(10);
        assertThat(status.getReplaysSkipped()).isEqualTo(2);
        assertThat(status.getQueueDepth()).isEqualTo(3);
        assertThat(status.getQueueDropped()).isEqualTo(1);
        assertThat(status.getPendingAggregations()).isEqualTo(4);
        assertThat(status.getPool().getStrategy()).isEqualTo("websocket");
        assertThat(status.getEngine().getEventsProcessed()).isEqualTo(9);
    }

    @Test
    @DisplayName("Report logging reads a full snapshot without failing")
    void logsReport() {
        service.logReport();
    }
}
