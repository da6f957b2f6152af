package com.whalewatch.aggregation;

import com.whalewatch.config.MonitorProperties;
import com.whalewatch.domain.model.AggregatedEvent;
import com.whalewatch.domain.model.CanonicalEvent;
import com.whalewatch.ingest.AlertEventQueue;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Collapses bursts of partial fills of one order into a single {@link AggregatedEvent}.
 *
 * <p>Fills are keyed by (entityId, orderId). The first fill opens a pending record and arms a
 * quiescence timer; each further fill for the key appends, recomputes the size-weighted average
 * price and re-arms the timer. When the timer fires and the record has been idle for at least the
 * quiescence period, one aggregated event is emitted downstream and the record is discarded.
 * Events without an order id are emitted immediately as singletons.
 *
 * <p>Per-key mutations run inside {@link ConcurrentHashMap#compute}, so fills of one order are
 * serialized while unrelated orders proceed in parallel.
 *
 * <p>On {@link #shutdown()} pending records are dropped, not flushed: at most one quiescence
 * period of activity is lost and is not replayed after restart.
 */
@Component
public class OrderAggregationBuffer {

    private static final Logger log = LoggerFactory.getLogger(OrderAggregationBuffer.class);

    private final long quiescenceMs;
    private final Consumer<AggregatedEvent> downstream;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    private final ConcurrentHashMap<String, PendingOrder> pendingOrders = new ConcurrentHashMap<>();
    private volatile boolean accepting = true;

    @Autowired
    public OrderAggregationBuffer(MonitorProperties monitorProperties, AlertEventQueue alertEventQueue, Clock clock) {
        this(
                monitorProperties.getAggregation().getQuiescence(),
                alertEventQueue::offer,
                clock,
                Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread thread = new Thread(r, "order-aggregation");
                    thread.setDaemon(true);
                    return thread;
                }));
    }

    public OrderAggregationBuffer(
            Duration quiescence,
            Consumer<AggregatedEvent> downstream,
            Clock clock,
            ScheduledExecutorService scheduler) {
        this.quiescenceMs = quiescence.toMillis();
        this.downstream = downstream;
        this.clock = clock;
        this.scheduler = scheduler;
    }

    /**
     * Accepts one canonical event. Singletons are emitted on the calling thread; fills with an
     * order id are held until their order goes quiet.
     */
    public void accept(CanonicalEvent event) {
        if (!accepting) {
            log.debug("Buffer stopped, dropping {}", event.getSourceId());
            return;
        }

        if (!event.hasOrderId()) {
            downstream.accept(AggregatedEvent.singleton(event));
            return;
        }

        String key = buildKey(event.getEntityId(), event.getOrderId());
        pendingOrders.compute(key, (k, pending) -> {
            if (pending == null) {
                pending = new PendingOrder();
            } else if (pending.contains(event)) {
                log.debug("Fill {} of order {} already pending, ignoring redelivery", event.fillIdentity(), k);
                return pending;
            } else if (pending.timer != null) {
                pending.timer.cancel(false);
            }
            pending.add(event, clock.millis());
            pending.timer = arm(k, quiescenceMs);
            return pending;
        });
    }

    /**
     * Timer callback. Emits the record if it has been idle long enough, otherwise re-arms for
     * the remaining quiescence time.
     */
    void onTimer(String key) {
        AggregatedEvent[] ready = new AggregatedEvent[1];
        pendingOrders.computeIfPresent(key, (k, pending) -> {
            long idle = clock.millis() - pending.lastUpdate;
            if (idle < quiescenceMs) {
                pending.timer = arm(k, quiescenceMs - idle);
                return pending;
            }
            ready[0] = pending.toAggregated();
            return null;
        });

        if (ready[0] != null) {
            AggregatedEvent aggregated = ready[0];
            if (aggregated.getConstituentCount() > 1) {
                log.info(
                        "Aggregated {} fills of order {} for {}: size={}, avgPrice={}",
                        aggregated.getConstituentCount(),
                        aggregated.getOrderId(),
                        aggregated.getEntityId(),
                        aggregated.getAmount(),
                        aggregated.getWeightedAvgPrice());
            }
            downstream.accept(aggregated);
        }
    }

    /**
     * Stops accepting events, cancels every quiescence timer and drops pending records.
     *
     * @return number of pending orders dropped
     */
    public int shutdown() {
        accepting = false;
        int dropped = 0;
        for (String key : new ArrayList<>(pendingOrders.keySet())) {
            PendingOrder pending = pendingOrders.remove(key);
            if (pending != null) {
                if (pending.timer != null) {
                    pending.timer.cancel(false);
                }
                dropped++;
            }
        }
        scheduler.shutdownNow();
        if (dropped > 0) {
            log.warn("Dropped {} pending order aggregations on shutdown", dropped);
        }
        return dropped;
    }

    public int getPendingCount() {
        return pendingOrders.size();
    }

    private ScheduledFuture<?> arm(String key, long delayMs) {
        return scheduler.schedule(() -> onTimerSafely(key), delayMs, TimeUnit.MILLISECONDS);
    }

    private void onTimerSafely(String key) {
        try {
            onTimer(key);
        } catch (Exception e) {
            log.error("Aggregation timer failed for {}", key, e);
        }
    }

    private static String buildKey(String entityId, String orderId) {
        return entityId + ":" + orderId;
    }

    /** Mutated only inside the owning map's compute functions. */
    private static final class PendingOrder {
        private final List<CanonicalEvent> fills = new ArrayList<>();
        private final Set<String> fillIdentities = new HashSet<>();
        private BigDecimal totalSize = BigDecimal.ZERO;
        private BigDecimal priceTimesSize = BigDecimal.ZERO;
        private boolean priced = true;
        private long lastUpdate;
        private ScheduledFuture<?> timer;

        boolean contains(CanonicalEvent fill) {
            return fillIdentities.contains(fill.fillIdentity());
        }

        void add(CanonicalEvent fill, long now) {
            fills.add(fill);
            fillIdentities.add(fill.fillIdentity());
            totalSize = totalSize.add(fill.getAmount());
            if (fill.getPrice() == null) {
                priced = false;
            } else {
                priceTimesSize = priceTimesSize.add(fill.getPrice().multiply(fill.getAmount()));
            }
            lastUpdate = now;
        }

        BigDecimal weightedAvgPrice() {
            if (!priced || totalSize.signum() == 0) {
                return null;
            }
            return priceTimesSize.divide(totalSize, MathContext.DECIMAL64);
        }

        AggregatedEvent toAggregated() {
            CanonicalEvent first = fills.get(0);
            CanonicalEvent last = fills.get(fills.size() - 1);
            BigDecimal avgPrice = weightedAvgPrice();
            CanonicalEvent merged = first.toBuilder()
                    .amount(totalSize)
                    .price(avgPrice)
                    .observedAt(last.getObservedAt())
                    .build();
            List<String> sourceIds = new ArrayList<>(fills.size());
            for (CanonicalEvent fill : fills) {
                sourceIds.add(fill.getSourceId());
            }
            return new AggregatedEvent(merged, fills.size(), avgPrice, sourceIds);
        }
    }
}
