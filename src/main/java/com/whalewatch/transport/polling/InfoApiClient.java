package com.whalewatch.transport.polling;

import com.fasterxml.jackson.databind.JsonNode;
import com.whalewatch.exception.TransportException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Thin client for the provider's JSON info endpoint. Every request is a POST of a
 * {@code {"type": ...}} body.
 *
 * <p>HTTP 401/403 map to authorization-class {@link TransportException}s, I/O failures and read
 * timeouts to {@link com.whalewatch.exception.ErrorCode#TRANSPORT_TIMEOUT}.
 */
public class InfoApiClient {

    private final RestTemplate restTemplate;
    private final String infoUrl;

    public InfoApiClient(RestTemplate restTemplate, String infoUrl) {
        this.restTemplate = restTemplate;
        this.infoUrl = infoUrl;
    }

    /** Cheap request used to prove the endpoint is reachable. */
    public void probe() {
        post(Map.of("type", "allMids"));
    }

    /** Fills of {@code user} with time in {@code [startTime, endTime]}, oldest first. */
    public JsonNode userFillsByTime(String user, long startTime, long endTime) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", "userFillsByTime");
        body.put("user", user);
        body.put("startTime", startTime);
        body.put("endTime", endTime);
        return post(body);
    }

    /** Non-funding ledger updates (transfers, deposits, withdrawals) of {@code user} in {@code [startTime, endTime]}. */
    public JsonNode userNonFundingLedgerUpdates(String user, long startTime, long endTime) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", "userNonFundingLedgerUpdates");
        body.put("user", user);
        body.put("startTime", startTime);
        body.put("endTime", endTime);
        return post(body);
    }

    private JsonNode post(Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            return restTemplate.postForObject(infoUrl, new HttpEntity<>(body, headers), JsonNode.class);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value()) {
                throw TransportException.unauthorized("Info endpoint rejected request: " + status);
            }
            throw new TransportException("Info endpoint returned " + status + " for " + body.get("type"), e);
        } catch (ResourceAccessException e) {
            throw TransportException.timeout("Info endpoint unreachable: " + e.getMessage());
        } catch (RestClientException e) {
            throw new TransportException("Info request failed: " + e.getMessage(), e);
        }
    }
}
