package com.whalewatch.engine;

import com.whalewatch.dedup.DedupStore;
import com.whalewatch.delivery.DeliverySink;
import com.whalewatch.domain.enums.Direction;
import com.whalewatch.domain.enums.RuleType;
import com.whalewatch.domain.model.AggregatedEvent;
import com.whalewatch.domain.model.Alert;
import com.whalewatch.domain.model.AlertRule;
import com.whalewatch.domain.model.WatchedEntity;
import com.whalewatch.observability.MonitorMetrics;
import com.whalewatch.window.SlidingWindowAggregator;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Evaluates threshold rules for each aggregated event and hands at most one alert per event to
 * the {@link DeliverySink}.
 *
 * <p>Evaluation order is fixed:
 * <ol>
 *   <li>resolve the watched entity; unknown or inactive entities are dropped</li>
 *   <li>claim the source id in the {@link DedupStore}; already-claimed events are dropped</li>
 *   <li>add the amount to the sliding window for the event's direction</li>
 *   <li>cumulative rule: if the live window total reaches the threshold, emit a cumulative alert
 *       and stop</li>
 *   <li>single rule: if the event amount reaches the threshold, emit a single-event alert</li>
 * </ol>
 *
 * <p>Events that occurred before the live window started skip the cumulative rule entirely; only
 * the single rule can fire for them.
 *
 * <p>Called from the single {@code AlertQueueProcessor} thread. Counters are atomic so
 * {@link #getStats()} can be read from any thread.
 */
@Service
public class AlertRuleEngine {

    private static final Logger log = LoggerFactory.getLogger(AlertRuleEngine.class);

    private final MonitorRegistry monitorRegistry;
    private final DedupStore dedupStore;
    private final SlidingWindowAggregator windowAggregator;
    private final DeliverySink deliverySink;
    private final MonitorMetrics monitorMetrics;

    private final AtomicLong eventsProcessed = new AtomicLong();
    private final AtomicLong duplicatesDropped = new AtomicLong();
    private final AtomicLong unknownEntityDropped = new AtomicLong();
    private final AtomicLong singleAlerts = new AtomicLong();
    private final AtomicLong cumulativeAlerts = new AtomicLong();
    private final AtomicLong deliveryFailures = new AtomicLong();

    public AlertRuleEngine(
            MonitorRegistry monitorRegistry,
            DedupStore dedupStore,
            SlidingWindowAggregator windowAggregator,
            DeliverySink deliverySink,
            MonitorMetrics monitorMetrics) {
        this.monitorRegistry = monitorRegistry;
        this.dedupStore = dedupStore;
        this.windowAggregator = windowAggregator;
        this.deliverySink = deliverySink;
        this.monitorMetrics = monitorMetrics;

        log.info(
                "Alert rule engine ready: {} entities ({} active), {} enabled rules",
                monitorRegistry.getEntities().size(),
                monitorRegistry.getActiveEntities().size(),
                monitorRegistry.getActiveRuleCount());
    }

    /**
     * Runs the rule pipeline for one event.
     *
     * @return the alert handed to the sink, or empty if the event was dropped or breached nothing
     */
    public Optional<Alert> process(AggregatedEvent event) {
        return monitorMetrics.engineLatency().record(() -> evaluate(event));
    }

    private Optional<Alert> evaluate(AggregatedEvent event) {
        Optional<WatchedEntity> resolved = monitorRegistry.find(event.getEntityId());
        if (resolved.isEmpty() || !resolved.get().isActive()) {
            log.warn("Event {} for unknown or inactive entity {}", event.getSourceId(), event.getEntityId());
            unknownEntityDropped.incrementAndGet();
            monitorMetrics.recordDropped("unknown_entity");
            return Optional.empty();
        }
        WatchedEntity entity = resolved.get();

        if (!dedupStore.claim(event.getSourceId())) {
            log.debug("Duplicate event {} for {}, skipping", event.getSourceId(), entity.getLabel());
            duplicatesDropped.incrementAndGet();
            monitorMetrics.recordDropped("duplicate");
            return Optional.empty();
        }
        markConstituents(event);
        eventsProcessed.incrementAndGet();

        Direction direction = event.getDirection();
        windowAggregator.update(
                entity.getId(), direction, event.getAmount(), event.getSourceId(), event.getOccurredAt());

        Optional<AlertRule> cumulativeRule = monitorRegistry.enabledRule(RuleType.CUMULATIVE);
        if (cumulativeRule.isPresent() && windowAggregator.isInCurrentWindow(event.getOccurredAt())) {
            BigDecimal cumulative = windowAggregator.read(entity.getId(), direction);
            BigDecimal threshold = entity.cumulativeThresholdOr(cumulativeRule.get().threshold());
            if (cumulative.compareTo(threshold) >= 0) {
                Alert alert = buildAlert(event, entity, RuleType.CUMULATIVE, threshold, cumulative);
                cumulativeAlerts.incrementAndGet();
                emit(alert);
                return Optional.of(alert);
            }
        }

        Optional<AlertRule> singleRule = monitorRegistry.enabledRule(RuleType.SINGLE);
        if (singleRule.isPresent()) {
            BigDecimal threshold = entity.singleThresholdOr(singleRule.get().threshold());
            if (event.getAmount().compareTo(threshold) >= 0) {
                Alert alert = buildAlert(event, entity, RuleType.SINGLE, threshold, null);
                singleAlerts.incrementAndGet();
                emit(alert);
                return Optional.of(alert);
            }
        }

        return Optional.empty();
    }

    private void markConstituents(AggregatedEvent event) {
        List<String> constituents = event.getConstituentSourceIds();
        for (String sourceId : constituents) {
            if (!sourceId.equals(event.getSourceId())) {
                dedupStore.markProcessed(sourceId);
            }
        }
    }

    private Alert buildAlert(
            AggregatedEvent event,
            WatchedEntity entity,
            RuleType ruleType,
            BigDecimal threshold,
            BigDecimal cumulativeAmount) {
        return Alert.builder()
                .entityId(entity.getId())
                .entityLabel(entity.getLabel())
                .ruleType(ruleType)
                .kind(event.getKind())
                .direction(event.getDirection())
                .asset(event.getAsset())
                .triggeringAmount(event.getAmount())
                .cumulativeAmount(cumulativeAmount)
                .threshold(threshold)
                .sourceId(event.getSourceId())
                .orderId(event.getOrderId())
                .constituentCount(event.getConstituentCount())
                .weightedAvgPrice(event.getWeightedAvgPrice())
                .occurredAt(event.getOccurredAt())
                .build();
    }

    private void emit(Alert alert) {
        log.info(
                "Alert {} for {}: amount={}, cumulative={}, threshold={}, source={}",
                alert.getAlertType(),
                alert.getEntityLabel(),
                alert.getTriggeringAmount(),
                alert.getCumulativeAmount(),
                alert.getThreshold(),
                alert.getSourceId());
        monitorMetrics.recordAlert(alert.getRuleType());

        boolean delivered;
        try {
            delivered = deliverySink.send(alert);
        } catch (RuntimeException e) {
            log.error("Delivery sink threw for alert {}", alert.getSourceId(), e);
            delivered = false;
        }
        if (!delivered) {
            deliveryFailures.incrementAndGet();
            monitorMetrics.recordDeliveryFailure();
            log.warn("Alert {} for {} was not delivered", alert.getAlertType(), alert.getEntityLabel());
        }
    }

    public EngineStats getStats() {
        Map<String, EngineStats.WindowTotals> totals = new LinkedHashMap<>();
        for (WatchedEntity entity : monitorRegistry.getEntities()) {
            totals.put(
                    entity.getLabel(),
                    new EngineStats.WindowTotals(
                            windowAggregator.read(entity.getId(), Direction.IN),
                            windowAggregator.read(entity.getId(), Direction.OUT)));
        }

        return EngineStats.builder()
                .totalEntities(monitorRegistry.getEntities().size())
                .activeEntities(monitorRegistry.getActiveEntities().size())
                .activeRules(monitorRegistry.getActiveRuleCount())
                .eventsProcessed(eventsProcessed.get())
                .duplicatesDropped(duplicatesDropped.get())
                .unknownEntityDropped(unknownEntityDropped.get())
                .singleAlerts(singleAlerts.get())
                .cumulativeAlerts(cumulativeAlerts.get())
                .deliveryFailures(deliveryFailures.get())
                .windowTotals(totals)
                .build();
    }
}
