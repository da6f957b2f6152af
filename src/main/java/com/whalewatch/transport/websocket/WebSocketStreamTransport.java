package com.whalewatch.transport.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whalewatch.exception.TransportException;
import com.whalewatch.transport.RawPayload;
import com.whalewatch.transport.RawPayloadHandler;
import com.whalewatch.transport.StreamTransport;
import com.whalewatch.transport.SubscriptionHandle;
import com.whalewatch.transport.TransportListener;
import com.whalewatch.transport.TransportSettings;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Persistent stream transport over a single WebSocket.
 *
 * <p>Subscriptions are sent as {@code {"method":"subscribe","subscription":{"type":..,"user":..}}},
 * one per configured channel, and a subscribe call returns only after the server has acknowledged
 * each of them with a {@code subscriptionResponse}. Inbound channel data is routed to the handler
 * registered for the {@code user} it carries. A periodic {@code ping} keeps idle sockets open;
 * the server's {@code pong} counts as activity.
 *
 * <p>Outbound frames go through a {@link ConcurrentWebSocketSessionDecorator} because subscribe,
 * unsubscribe and ping may be sent from different threads.
 */
public class WebSocketStreamTransport extends TextWebSocketHandler implements StreamTransport {

    private static final Logger log = LoggerFactory.getLogger(WebSocketStreamTransport.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT = 512 * 1024;

    private final int slot;
    private final URI uri;
    private final List<String> channels;
    private final TransportSettings settings;
    private final TransportListener listener;
    private final WebSocketClient webSocketClient;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService pingScheduler;
    private final Duration pingInterval;

    private final Map<String, RawPayloadHandler> handlersByEntity = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> pendingAcks = new ConcurrentHashMap<>();

    private volatile WebSocketSession session;
    private volatile ScheduledFuture<?> pingTask;

    public WebSocketStreamTransport(
            int slot,
            URI uri,
            List<String> channels,
            TransportSettings settings,
            TransportListener listener,
            WebSocketClient webSocketClient,
            ObjectMapper objectMapper,
            ScheduledExecutorService pingScheduler,
            Duration pingInterval) {
        this.slot = slot;
        this.uri = uri;
        this.channels = List.copyOf(channels);
        this.settings = settings;
        this.listener = listener;
        this.webSocketClient = webSocketClient;
        this.objectMapper = objectMapper;
        this.pingScheduler = pingScheduler;
        this.pingInterval = pingInterval;
    }

    @Override
    public void connect(Duration timeout) {
        closeQuietly();
        CompletableFuture<WebSocketSession> handshake =
                webSocketClient.execute(this, new WebSocketHttpHeaders(), uri);
        try {
            WebSocketSession raw = handshake.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            session = new ConcurrentWebSocketSessionDecorator(raw, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
        } catch (TimeoutException e) {
            handshake.cancel(true);
            throw TransportException.timeout("Slot " + slot + " connect timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (isAuthorizationFailure(cause.getMessage())) {
                throw TransportException.unauthorized("Slot " + slot + " handshake rejected: " + cause.getMessage());
            }
            throw new TransportException("Slot " + slot + " connect failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Slot " + slot + " connect interrupted", e);
        }

        long pingMs = pingInterval.toMillis();
        pingTask = pingScheduler.scheduleAtFixedRate(this::sendPing, pingMs, pingMs, TimeUnit.MILLISECONDS);
        log.info("Slot {} WebSocket connected to {}", slot, uri);
    }

    @Override
    public SubscriptionHandle subscribe(String entityId, RawPayloadHandler onEvent) {
        String user = entityId.toLowerCase(Locale.ROOT);
        handlersByEntity.put(user, onEvent);

        List<CompletableFuture<Void>> acks = new ArrayList<>();
        for (String channel : channels) {
            CompletableFuture<Void> ack = new CompletableFuture<>();
            pendingAcks.put(ackKey(channel, user), ack);
            acks.add(ack);
            send(requestFrame("subscribe", channel, entityId));
        }

        try {
            CompletableFuture.allOf(acks.toArray(new CompletableFuture[0]))
                    .get(settings.subscribeTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandonSubscription(user);
            throw TransportException.timeout("Slot " + slot + " subscribe " + entityId + " not acknowledged within "
                    + settings.subscribeTimeout().toMillis() + "ms");
        } catch (ExecutionException e) {
            abandonSubscription(user);
            if (e.getCause() instanceof TransportException transportException) {
                throw transportException;
            }
            throw new TransportException("Slot " + slot + " subscribe " + entityId + " failed", e.getCause());
        } catch (InterruptedException e) {
            abandonSubscription(user);
            Thread.currentThread().interrupt();
            throw new TransportException("Slot " + slot + " subscribe interrupted", e);
        }

        return new SubscriptionHandle(entityId, channels);
    }

    @Override
    public void unsubscribe(SubscriptionHandle handle) {
        handlersByEntity.remove(handle.entityId().toLowerCase(Locale.ROOT));
        if (!isOpen()) {
            return;
        }
        for (String channel : handle.channels()) {
            send(requestFrame("unsubscribe", channel, handle.entityId()));
        }
    }

    @Override
    public void close() {
        ScheduledFuture<?> task = pingTask;
        if (task != null) {
            task.cancel(false);
        }
        handlersByEntity.clear();
        pendingAcks.values().forEach(ack -> ack.cancel(false));
        pendingAcks.clear();
        WebSocketSession current = session;
        session = null;
        if (current != null && current.isOpen()) {
            try {
                current.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.warn("Slot {} close failed: {}", slot, e.getMessage());
            }
        }
    }

    @Override
    public boolean isOpen() {
        WebSocketSession current = session;
        return current != null && current.isOpen();
    }

    @Override
    protected void handleTextMessage(WebSocketSession webSocketSession, TextMessage message) {
        listener.onActivity();

        JsonNode root;
        try {
            root = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.warn("Slot {} dropped unparseable frame: {}", slot, e.getOriginalMessage());
            return;
        }

        String channel = root.path("channel").asText("");
        JsonNode data = root.path("data");
        switch (channel) {
            case "pong" -> log.trace("Slot {} pong", slot);
            case "subscriptionResponse" -> onSubscriptionResponse(data);
            case "error" -> onErrorFrame(data.asText(data.toString()));
            default -> route(channel, data);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession webSocketSession, Throwable exception) {
        log.warn("Slot {} transport error: {}", slot, exception.getMessage());
        listener.onError(new TransportException("Slot " + slot + " transport error", exception));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession webSocketSession, CloseStatus status) {
        ScheduledFuture<?> task = pingTask;
        if (task != null) {
            task.cancel(false);
        }
        if (session != null) {
            log.warn("Slot {} WebSocket closed by peer: {}", slot, status);
            listener.onError(new TransportException("Slot " + slot + " closed: " + status));
        }
    }

    private void route(String channel, JsonNode data) {
        if (!channels.contains(channel)) {
            log.debug("Slot {} ignoring frame on channel '{}'", slot, channel);
            return;
        }
        String user = data.path("user").asText("").toLowerCase(Locale.ROOT);
        RawPayloadHandler handler = handlersByEntity.get(user);
        if (handler == null) {
            log.debug("Slot {} no subscription for user '{}' on {}", slot, user, channel);
            return;
        }
        handler.onPayload(new RawPayload(channel, user, data, System.currentTimeMillis()));
    }

    private void onSubscriptionResponse(JsonNode data) {
        if (!"subscribe".equals(data.path("method").asText())) {
            return;
        }
        JsonNode subscription = data.path("subscription");
        String key = ackKey(
                subscription.path("type").asText(),
                subscription.path("user").asText().toLowerCase(Locale.ROOT));
        CompletableFuture<Void> ack = pendingAcks.remove(key);
        if (ack != null) {
            ack.complete(null);
        }
    }

    private void onErrorFrame(String text) {
        TransportException error = isAuthorizationFailure(text)
                ? TransportException.unauthorized("Slot " + slot + " rejected: " + text)
                : new TransportException("Slot " + slot + " error frame: " + text);
        log.warn("Slot {} received error frame: {}", slot, text);
        pendingAcks.values().forEach(ack -> ack.completeExceptionally(error));
        pendingAcks.clear();
        listener.onError(error);
    }

    private void abandonSubscription(String user) {
        handlersByEntity.remove(user);
        for (String channel : channels) {
            pendingAcks.remove(ackKey(channel, user));
        }
    }

    private void sendPing() {
        if (!isOpen()) {
            return;
        }
        try {
            ObjectNode ping = objectMapper.createObjectNode();
            ping.put("method", "ping");
            send(objectMapper.writeValueAsString(ping));
        } catch (JsonProcessingException | TransportException e) {
            log.warn("Slot {} ping failed: {}", slot, e.getMessage());
        }
    }

    private String requestFrame(String method, String channel, String entityId) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("method", method);
        ObjectNode subscription = frame.putObject("subscription");
        subscription.put("type", channel);
        subscription.put("user", entityId);
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new TransportException("Could not encode " + method + " frame", e);
        }
    }

    private void send(String text) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            throw new TransportException("Slot " + slot + " is not connected");
        }
        try {
            current.sendMessage(new TextMessage(text));
        } catch (IOException | IllegalStateException e) {
            throw new TransportException("Slot " + slot + " send failed: " + e.getMessage(), e);
        }
    }

    private void closeQuietly() {
        if (session != null) {
            close();
        }
    }

    private static String ackKey(String channel, String user) {
        return channel + ":" + user;
    }

    static boolean isAuthorizationFailure(String message) {
        if (TransportException.looksUnauthorized(message)) {
            return true;
        }
        return message != null && (message.contains("[401]") || message.contains("[403]"));
    }
}
