package com.whalewatch.observability;

import com.whalewatch.domain.enums.RuleType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.function.ToDoubleFunction;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the ingestion pipeline.
 *
 * <ul>
 *   <li><b>events.received</b> (counter): canonical events produced by the normalizer</li>
 *   <li><b>events.dropped</b> (counter, tag {@code reason}): events discarded before alerting</li>
 *   <li><b>alerts.emitted</b> (counter, tag {@code rule}): alerts handed to the sink</li>
 *   <li><b>delivery.failures</b> (counter): sink reported failure</li>
 *   <li><b>pool.reconnects</b> (counter): completed slot reconnect cycles</li>
 *   <li><b>engine.latency</b> (timer): rule evaluation time per event</li>
 * </ul>
 *
 * <p>Gauges ({@code queue.depth}, {@code pool.slots.ready}) are registered by their owners
 * through {@link #gauge} to avoid a dependency cycle.
 */
@Service
public class MonitorMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter eventsReceived;
    private final Counter deliveryFailures;
    private final Counter poolReconnects;
    private final Timer engineLatency;

    public MonitorMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.eventsReceived = Counter.builder("events.received")
                .description("Canonical events produced by the normalizer")
                .register(meterRegistry);

        this.deliveryFailures = Counter.builder("delivery.failures")
                .description("Alerts the delivery sink failed to deliver")
                .register(meterRegistry);

        this.poolReconnects = Counter.builder("pool.reconnects")
                .description("Completed connection slot reconnect cycles")
                .register(meterRegistry);

        this.engineLatency = Timer.builder("engine.latency")
                .description("Rule evaluation time per aggregated event")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(5))
                .register(meterRegistry);
    }

    public void recordEventReceived() {
        eventsReceived.increment();
    }

    public void recordDropped(String reason) {
        Counter.builder("events.dropped")
                .description("Events discarded before rule evaluation")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordAlert(RuleType ruleType) {
        Counter.builder("alerts.emitted")
                .description("Alerts handed to the delivery sink")
                .tag("rule", ruleType.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }

    public void recordDeliveryFailure() {
        deliveryFailures.increment();
    }

    public void recordReconnect() {
        poolReconnects.increment();
    }

    public Timer engineLatency() {
        return engineLatency;
    }

    public <T> void gauge(String name, T stateObject, ToDoubleFunction<T> valueFunction) {
        meterRegistry.gauge(name, stateObject, valueFunction);
    }
}
