package com.whalewatch.unit.transport.polling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.whalewatch.exception.ErrorCode;
import com.whalewatch.exception.TransportException;
import com.whalewatch.transport.polling.InfoApiClient;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

class InfoApiClientTest {

    private static final String URL = "https://example.test/info";

    private RestTemplate restTemplate;
    private InfoApiClient client;

    @BeforeEach
    void setUp() {
        restTemplate = mock(RestTemplate.class);
        client = new InfoApiClient(restTemplate, URL);
    }

    @Test
    @DisplayName("Fill query posts the userFillsByTime body")
    @SuppressWarnings("unchecked")
    void postsFillQuery() {
        client.userFillsByTime("0xwhale", 10L, 20L);

        ArgumentCaptor<HttpEntity<Map<String, Object>>> captor = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate).postForObject(eq(URL), captor.capture(), eq(JsonNode.class));
        assertThat(captor.getValue().getBody())
                .containsEntry("type", "userFillsByTime")
                .containsEntry("user", "0xwhale")
                .containsEntry("startTime", 10L)
                .containsEntry("endTime", 20L);
    }

    @Test
    @DisplayName("Ledger query posts the userNonFundingLedgerUpdates body")
    @SuppressWarnings("unchecked")
    void postsLedgerQuery() {
        client.userNonFundingLedgerUpdates("0xwhale", 10L, 20L);

        ArgumentCaptor<HttpEntity<Map<String, Object>>> captor = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate).postForObject(eq(URL), captor.capture(), eq(JsonNode.class));
        assertThat(captor.getValue().getBody())
                .containsEntry("type", "userNonFundingLedgerUpdates")
                .containsEntry("user", "0xwhale")
                .containsEntry("startTime", 10L)
                .containsEntry("endTime", 20L);
    }

    @Test
    @DisplayName("403 maps to an authorization failure")
    void forbiddenIsAuthorization() {
        when(restTemplate.postForObject(eq(URL), any(), eq(JsonNode.class)))
                .thenThrow(HttpClientErrorException.create(HttpStatus.FORBIDDEN, "Forbidden", HttpHeaders.EMPTY, null, null));

        assertThatThrownBy(() -> client.probe())
                .isInstanceOfSatisfying(TransportException.class, e -> assertThat(e.isAuthorization()).isTrue());
    }

    @Test
    @DisplayName("I/O failure maps to a timeout")
    void ioFailureIsTimeout() {
        when(restTemplate.postForObject(eq(URL), any(), eq(JsonNode.class)))
                .thenThrow(new ResourceAccessException("Read timed out"));

        assertThatThrownBy(() -> client.probe())
                .isInstanceOfSatisfying(
                        TransportException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.TRANSPORT_TIMEOUT));
    }

    @Test
    @DisplayName("Server error is a plain transport failure")
    void serverError() {
        when(restTemplate.postForObject(eq(URL), any(), eq(JsonNode.class)))
                .thenThrow(HttpServerErrorException.create(
                        HttpStatus.BAD_GATEWAY, "Bad Gateway", HttpHeaders.EMPTY, null, null));

        assertThatThrownBy(() -> client.probe())
                .isInstanceOfSatisfying(TransportException.class, e -> assertThat(e.isAuthorization()).isFalse());
    }
}
