package com.whalewatch.unit.transport.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whalewatch.exception.TransportException;
import com.whalewatch.transport.RawPayload;
import com.whalewatch.transport.RawPayloadHandler;
import com.whalewatch.transport.SubscriptionHandle;
import com.whalewatch.transport.TransportListener;
import com.whalewatch.transport.TransportSettings;
import com.whalewatch.transport.websocket.WebSocketStreamTransport;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

/**
 * Unit tests for WebSocketStreamTransport against a mocked session that answers subscribe frames
 * the way the provider does.
 */
class WebSocketStreamTransportTest {

    private static final URI WS_URI = URI.create("wss://example.test/ws");
    private static final List<String> CHANNELS = List.of("userFills", "userNonFundingLedgerUpdates");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private WebSocketClient webSocketClient;
    private WebSocketSession session;
    private TransportListener listener;
    private List<JsonNode> sentFrames;
    private String subscribeReply;
    private WebSocketStreamTransport transport;

    @BeforeEach
    void setUp() throws Exception {
        webSocketClient = mock(WebSocketClient.class);
        session = mock(WebSocketSession.class);
        listener = mock(TransportListener.class);
        sentFrames = new CopyOnWriteArrayList<>();
        subscribeReply = "ack";

        when(session.isOpen()).thenReturn(true);
        when(webSocketClient.execute(any(), any(WebSocketHttpHeaders.class), eq(WS_URI)))
                .thenReturn(CompletableFuture.completedFuture(session));

        doAnswer(invocation -> {
                    TextMessage message = invocation.getArgument(0);
                    JsonNode frame = objectMapper.readTree(message.getPayload());
                    sentFrames.add(frame);
                    if ("subscribe".equals(frame.path("method").asText())) {
                        answerSubscribe(frame);
                    }
                    return null;
                })
                .when(session)
                .sendMessage(any());

        transport = new WebSocketStreamTransport(
                1,
                WS_URI,
                CHANNELS,
                new TransportSettings(Duration.ofSeconds(1), Duration.ofMillis(200)),
                listener,
                webSocketClient,
                objectMapper,
                mock(ScheduledExecutorService.class),
                Duration.ofSeconds(50));
    }

    private void answerSubscribe(JsonNode frame) throws Exception {
        switch (subscribeReply) {
            case "ack" -> inbound("{\"channel\":\"subscriptionResponse\",\"data\":{\"method\":\"subscribe\","
                    + "\"subscription\":" + frame.path("subscription") + "}}");
            case "unauthorized" -> inbound("{\"channel\":\"error\",\"data\":\"User unauthorized\"}");
            default -> {
                // silence: the subscription is never acknowledged
            }
        }
    }

    private void inbound(String json) throws Exception {
        transport.handleMessage(session, new TextMessage(json));
    }

    @Nested
    @DisplayName("Connect")
    class Connect {

        @Test
        @DisplayName("Successful handshake opens the transport")
        void opens() {
            transport.connect(Duration.ofSeconds(1));

            assertThat(transport.isOpen()).isTrue();
        }

        @Test
        @DisplayName("Handshake rejected with 401 is an authorization failure")
        void handshakeUnauthorized() {
            when(webSocketClient.execute(any(), any(WebSocketHttpHeaders.class), eq(WS_URI)))
                    .thenReturn(CompletableFuture.failedFuture(
                            new IllegalStateException("Invalid handshake response [401]")));

            assertThatThrownBy(() -> transport.connect(Duration.ofSeconds(1)))
                    .isInstanceOfSatisfying(
                            TransportException.class, e -> assertThat(e.isAuthorization()).isTrue());
        }

        @Test
        @DisplayName("Handshake that never completes times out")
        void handshakeTimeout() {
            when(webSocketClient.execute(any(), any(WebSocketHttpHeaders.class), eq(WS_URI)))
                    .thenReturn(new CompletableFuture<>());

            assertThatThrownBy(() -> transport.connect(Duration.ofMillis(50)))
                    .isInstanceOfSatisfying(
                            TransportException.class, e -> assertThat(e.isAuthorization()).isFalse());
        }
    }

    @Nested
    @DisplayName("Subscribe")
    class Subscribe {

        @BeforeEach
        void connect() {
            transport.connect(Duration.ofSeconds(1));
        }

        @Test
        @DisplayName("Sends one subscribe frame per channel and returns once all are acknowledged")
        void subscribesEveryChannel() {
            SubscriptionHandle handle = transport.subscribe("0xWhale", mock(RawPayloadHandler.class));

            assertThat(handle.entityId()).isEqualTo("0xWhale");
            assertThat(handle.channels()).containsExactlyElementsOf(CHANNELS);
            assertThat(sentFrames)
                    .extracting(frame -> frame.path("subscription").path("type").asText())
                    .containsExactlyElementsOf(CHANNELS);
            assertThat(sentFrames)
                    .allMatch(frame -> "0xWhale".equals(frame.path("subscription").path("user").asText()));
        }

        @Test
        @DisplayName("Unacknowledged subscription times out")
        void unacknowledgedTimesOut() {
            subscribeReply = "silent";

            assertThatThrownBy(() -> transport.subscribe("0xwhale", mock(RawPayloadHandler.class)))
                    .isInstanceOfSatisfying(
                            TransportException.class, e -> assertThat(e.isAuthorization()).isFalse());
        }

        @Test
        @DisplayName("Unauthorized error frame fails the subscription as an authorization failure")
        void unauthorizedFrame() {
            subscribeReply = "unauthorized";

            assertThatThrownBy(() -> transport.subscribe("0xwhale", mock(RawPayloadHandler.class)))
                    .isInstanceOfSatisfying(
                            TransportException.class, e -> assertThat(e.isAuthorization()).isTrue());
            verify(listener, atLeastOnce()).onError(any(TransportException.class));
        }

        @Test
        @DisplayName("Unsubscribe sends one frame per channel")
        void unsubscribe() {
            SubscriptionHandle handle = transport.subscribe("0xwhale", mock(RawPayloadHandler.class));
            sentFrames.clear();

            transport.unsubscribe(handle);

            assertThat(sentFrames).hasSize(2).allMatch(frame -> "unsubscribe".equals(frame.path("method").asText()));
        }
    }

    @Nested
    @DisplayName("Inbound Frames")
    class InboundFrames {

        private RawPayloadHandler handler;

        @BeforeEach
        void subscribe() {
            transport.connect(Duration.ofSeconds(1));
            handler = mock(RawPayloadHandler.class);
            transport.subscribe("0xwhale", handler);
        }

        @Test
        @DisplayName("Channel data is routed to the subscriber named by its user field")
        void routesByUser() throws Exception {
            inbound("{\"channel\":\"userFills\",\"data\":{\"user\":\"0xWHALE\",\"fills\":[]}}");

            ArgumentCaptor<RawPayload> captor = ArgumentCaptor.forClass(RawPayload.class);
            verify(handler).onPayload(captor.capture());
            assertThat(captor.getValue().channel()).isEqualTo("userFills");
            assertThat(captor.getValue().subscribedEntityId()).isEqualTo("0xwhale");
            assertThat(captor.getValue().data().has("fills")).isTrue();
        }

        @Test
        @DisplayName("Data for an unsubscribed user is ignored")
        void unknownUserIgnored() throws Exception {
            inbound("{\"channel\":\"userFills\",\"data\":{\"user\":\"0xstranger\",\"fills\":[]}}");

            verify(handler, never()).onPayload(any());
        }

        @Test
        @DisplayName("Pong counts as activity")
        void pongIsActivity() throws Exception {
            clearInvocations(listener);

            inbound("{\"channel\":\"pong\"}");

            verify(listener).onActivity();
            verify(handler, never()).onPayload(any());
        }
    }

    @Nested
    @DisplayName("Close")
    class Close {

        @BeforeEach
        void connect() {
            transport.connect(Duration.ofSeconds(1));
        }

        @Test
        @DisplayName("Local close shuts the session without reporting an error")
        void localClose() throws Exception {
            transport.close();
            transport.afterConnectionClosed(session, CloseStatus.NORMAL);

            verify(session).close(CloseStatus.NORMAL);
            assertThat(transport.isOpen()).isFalse();
            verify(listener, never()).onError(any());
        }

        @Test
        @DisplayName("Peer close is reported to the listener")
        void peerClose() throws Exception {
            transport.afterConnectionClosed(session, CloseStatus.GOING_AWAY);

            verify(listener).onError(any(TransportException.class));
        }
    }
}
