package com.whalewatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whalewatch.delivery.DeliverySink;
import com.whalewatch.delivery.LoggingDeliverySink;
import com.whalewatch.delivery.WebhookDeliverySink;
import com.whalewatch.engine.MonitorRegistry;
import com.whalewatch.transport.TransportFactory;
import com.whalewatch.transport.polling.PollingTransportFactory;
import com.whalewatch.transport.websocket.WebSocketTransportFactory;
import java.time.Clock;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the monitor's pluggable pieces from {@link MonitorProperties}: the watched-entity
 * registry, the delivery sink and the transport strategy.
 */
@Configuration
@EnableConfigurationProperties(MonitorProperties.class)
public class MonitorConfig {

    private static final Logger log = LoggerFactory.getLogger(MonitorConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MonitorRegistry monitorRegistry(MonitorProperties monitorProperties) {
        MonitorRegistry registry = MonitorRegistry.fromProperties(monitorProperties);
        log.info(
                "Loaded {} watched entities ({} active), {} enabled rules",
                registry.getEntities().size(),
                registry.getActiveEntities().size(),
                registry.getActiveRuleCount());
        return registry;
    }

    @Bean
    public DeliverySink deliverySink(MonitorProperties monitorProperties) {
        MonitorProperties.Delivery delivery = monitorProperties.getDelivery();
        if (delivery.getWebhookUrl() == null || delivery.getWebhookUrl().isBlank()) {
            log.info("No webhook configured, alerts will be logged only");
            return new LoggingDeliverySink();
        }
        log.info("Delivering alerts to webhook {}", delivery.getWebhookUrl());
        return new WebhookDeliverySink(delivery);
    }

    @Bean
    public TransportFactory transportFactory(MonitorProperties monitorProperties, ObjectMapper objectMapper, Clock clock) {
        MonitorProperties.Transport transport = monitorProperties.getTransport();
        String strategy = transport.getStrategy() == null ? "" : transport.getStrategy().toLowerCase(Locale.ROOT);
        return switch (strategy) {
            case "websocket" -> new WebSocketTransportFactory(transport, objectMapper);
            case "polling" -> new PollingTransportFactory(transport, objectMapper, clock);
            default -> throw new IllegalStateException(
                    "Unknown monitor.transport.strategy '" + transport.getStrategy() + "' (expected websocket or polling)");
        };
    }
}
