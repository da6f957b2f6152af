package com.whalewatch.ingest;

import com.whalewatch.config.MonitorProperties;
import com.whalewatch.domain.model.AggregatedEvent;
import com.whalewatch.observability.MonitorMetrics;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bounded hand-off between the producers (every pool slot plus the aggregation timer) and the
 * single rule engine consumer.
 *
 * <p>Producers never block longer than the configured offer timeout. When the queue stays full
 * the event is dropped, logged and counted.
 */
@Component
public class AlertEventQueue {

    private static final Logger log = LoggerFactory.getLogger(AlertEventQueue.class);

    private final BlockingQueue<AggregatedEvent> queue;
    private final long offerTimeoutMs;
    private final MonitorMetrics monitorMetrics;
    private final AtomicLong droppedCount = new AtomicLong();

    public AlertEventQueue(MonitorProperties monitorProperties, MonitorMetrics monitorMetrics) {
        this.queue = new ArrayBlockingQueue<>(monitorProperties.getQueue().getCapacity());
        this.offerTimeoutMs = monitorProperties.getQueue().getOfferTimeout().toMillis();
        this.monitorMetrics = monitorMetrics;
        monitorMetrics.gauge("queue.depth", queue, BlockingQueue::size);
    }

    /** @return false if the event was dropped because the queue stayed full */
    public boolean offer(AggregatedEvent event) {
        try {
            if (queue.offer(event, offerTimeoutMs, TimeUnit.MILLISECONDS)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        droppedCount.incrementAndGet();
        monitorMetrics.recordDropped("queue_full");
        log.error("Alert queue full ({}), dropping event {}", queue.size(), event.getSourceId());
        return false;
    }

    public AggregatedEvent take() throws InterruptedException {
        return queue.take();
    }

    public AggregatedEvent poll() {
        return queue.poll();
    }

    public int size() {
        return queue.size();
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }
}
