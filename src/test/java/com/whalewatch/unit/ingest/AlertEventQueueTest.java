package com.whalewatch.unit.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import com.whalewatch.config.MonitorProperties;
import com.whalewatch.domain.enums.EventKind;
import com.whalewatch.domain.model.AggregatedEvent;
import com.whalewatch.domain.model.CanonicalEvent;
import com.whalewatch.ingest.AlertEventQueue;
import com.whalewatch.observability.MonitorMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AlertEventQueueTest {

    private SimpleMeterRegistry meterRegistry;
    private AlertEventQueue queue;

    @BeforeEach
    void setUp() {
        MonitorProperties properties = new MonitorProperties();
        properties.getQueue().setCapacity(2);
        properties.getQueue().setOfferTimeout(Duration.ofMillis(10));
        meterRegistry = new SimpleMeterRegistry();
        queue = new AlertEventQueue(properties, new MonitorMetrics(meterRegistry));
    }

    private AggregatedEvent event(String sourceId) {
        return AggregatedEvent.singleton(CanonicalEvent.builder()
                .entityId("0xwhale")
                .kind(EventKind.TRANSFER_IN)
                .amount(BigDecimal.TEN)
                .asset("HYPE")
                .sourceId(sourceId)
                .build());
    }

    @Test
    @DisplayName("Events come out in arrival order")
    void fifoOrder() throws InterruptedException {
        queue.offer(event("a"));
        queue.offer(event("b"));

        assertThat(queue.take().getSourceId()).isEqualTo("a");
        assertThat(queue.poll().getSourceId()).isEqualTo("b");
        assertThat(queue.poll()).isNull();
    }

    @Test
    @DisplayName("Overflow is dropped and counted instead of blocking")
    void overflowDropped() {
        assertThat(queue.offer(event("a"))).isTrue();
        assertThat(queue.offer(event("b"))).isTrue();
        assertThat(queue.offer(event("c"))).isFalse();

        assertThat(queue.size()).isEqualTo(2);
        assertThat(queue.getDroppedCount()).isEqualTo(1);
        assertThat(meterRegistry.get("events.dropped").tag("reason", "queue_full").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Queue depth is exposed as a gauge")
    void depthGauge() {
        queue.offer(event("a"));

        assertThat(meterRegistry.get("queue.depth").gauge().value()).isEqualTo(1.0);
    }
}
