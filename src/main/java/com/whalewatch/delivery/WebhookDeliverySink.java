package com.whalewatch.delivery;

import com.whalewatch.config.MonitorProperties;
import com.whalewatch.domain.model.Alert;
import com.whalewatch.exception.DeliveryException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * POSTs alerts as JSON to a webhook.
 *
 * <p>Each attempt is bounded by the configured connect/read timeout. Failed attempts are retried
 * up to {@code maxAttempts} times with a linearly growing delay; after the last failure the alert
 * is reported undelivered.
 */
public class WebhookDeliverySink implements DeliverySink {

    private static final Logger log = LoggerFactory.getLogger(WebhookDeliverySink.class);

    private final String webhookUrl;
    private final int maxAttempts;
    private final long retryDelayMs;
    private final RestTemplate restTemplate;

    public WebhookDeliverySink(MonitorProperties.Delivery delivery) {
        this(delivery, buildRestTemplate(delivery));
    }

    public WebhookDeliverySink(MonitorProperties.Delivery delivery, RestTemplate restTemplate) {
        this.webhookUrl = delivery.getWebhookUrl();
        this.maxAttempts = delivery.getMaxAttempts();
        this.retryDelayMs = delivery.getRetryDelay().toMillis();
        this.restTemplate = restTemplate;
    }

    @Override
    public boolean send(Alert alert) {
        Map<String, Object> payload = toPayload(alert);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                post(payload);
                log.info("Webhook delivered {} for {} (attempt {})", alert.getAlertType(), alert.getEntityLabel(), attempt);
                return true;
            } catch (DeliveryException e) {
                log.warn("Webhook attempt {}/{} failed for {}: {}", attempt, maxAttempts, alert.getSourceId(), e.getMessage());
            }

            if (attempt < maxAttempts && !pause(retryDelayMs * attempt)) {
                break;
            }
        }
        log.error("Webhook delivery gave up for {} {}", alert.getAlertType(), alert.getSourceId());
        return false;
    }

    private void post(Map<String, Object> payload) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.USER_AGENT, "whalewatch/1.0");
        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(webhookUrl, new HttpEntity<>(payload, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new DeliveryException("Webhook returned " + response.getStatusCode(), null);
            }
        } catch (RestClientException e) {
            throw new DeliveryException(e.getMessage(), e);
        }
    }

    static Map<String, Object> toPayload(Alert alert) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", alert.getCreatedAt());
        payload.put("alertType", alert.getAlertType());
        payload.put("address", alert.getEntityId());
        payload.put("addressLabel", alert.getEntityLabel());
        payload.put("direction", alert.getDirection().name());
        payload.put("asset", alert.getAsset());
        payload.put("amount", alert.getTriggeringAmount().toPlainString());
        if (alert.getCumulativeAmount() != null) {
            payload.put("cumulativeAmount", alert.getCumulativeAmount().toPlainString());
        }
        payload.put("threshold", alert.getThreshold().toPlainString());
        payload.put("txHash", alert.getSourceId());
        payload.put("occurredAt", alert.getOccurredAt());
        if (alert.getOrderId() != null) {
            payload.put("orderId", alert.getOrderId());
            payload.put("fillCount", alert.getConstituentCount());
        }
        if (alert.getWeightedAvgPrice() != null) {
            payload.put("avgPrice", alert.getWeightedAvgPrice().toPlainString());
        }
        return payload;
    }

    private static boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static RestTemplate buildRestTemplate(MonitorProperties.Delivery delivery) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) delivery.getTimeout().toMillis());
        requestFactory.setReadTimeout((int) delivery.getTimeout().toMillis());
        return new RestTemplate(requestFactory);
    }
}
