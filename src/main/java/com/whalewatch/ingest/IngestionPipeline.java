package com.whalewatch.ingest;

import com.whalewatch.aggregation.OrderAggregationBuffer;
import com.whalewatch.dedup.DedupStore;
import com.whalewatch.domain.model.CanonicalEvent;
import com.whalewatch.observability.MonitorMetrics;
import com.whalewatch.transport.RawPayload;
import com.whalewatch.transport.RawPayloadHandler;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Entry point for payloads from every pool slot: normalize, drop already-processed source ids,
 * then hand the events to the aggregation buffer.
 *
 * <p>The dedup check here is a cheap pre-filter for fills replayed after a reconnect. The
 * authoritative claim happens in the rule engine.
 */
@Component
public class IngestionPipeline implements RawPayloadHandler {

    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private final EventNormalizer eventNormalizer;
    private final DedupStore dedupStore;
    private final OrderAggregationBuffer aggregationBuffer;
    private final MonitorMetrics monitorMetrics;

    private final AtomicLong payloadCount = new AtomicLong();
    private final AtomicLong acceptedCount = new AtomicLong();
    private final AtomicLong replayedCount = new AtomicLong();

    public IngestionPipeline(
            EventNormalizer eventNormalizer,
            DedupStore dedupStore,
            OrderAggregationBuffer aggregationBuffer,
            MonitorMetrics monitorMetrics) {
        this.eventNormalizer = eventNormalizer;
        this.dedupStore = dedupStore;
        this.aggregationBuffer = aggregationBuffer;
        this.monitorMetrics = monitorMetrics;
    }

    @Override
    public void onPayload(RawPayload payload) {
        payloadCount.incrementAndGet();
        List<CanonicalEvent> events = eventNormalizer.normalize(payload);
        for (CanonicalEvent event : events) {
            monitorMetrics.recordEventReceived();
            if (dedupStore.isProcessed(event.getSourceId())) {
                replayedCount.incrementAndGet();
                monitorMetrics.recordDropped("replayed");
                log.debug("Skipping already processed {} for {}", event.getSourceId(), event.getEntityId());
                continue;
            }
            acceptedCount.incrementAndGet();
            aggregationBuffer.accept(event);
        }
    }

    public long getPayloadCount() {
        return payloadCount.get();
    }

    public long getAcceptedCount() {
        return acceptedCount.get();
    }

    public long getReplayedCount() {
        return replayedCount.get();
    }
}
