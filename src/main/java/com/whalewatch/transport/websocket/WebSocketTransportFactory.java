package com.whalewatch.transport.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whalewatch.config.MonitorProperties;
import com.whalewatch.transport.StreamTransport;
import com.whalewatch.transport.TransportFactory;
import com.whalewatch.transport.TransportListener;
import com.whalewatch.transport.TransportSettings;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import java.net.URI;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/**
 * Builds {@link WebSocketStreamTransport}s sharing one JSR-356 client and one ping scheduler.
 * Snapshot frames can be large, so the container's text buffer is raised to 4 MB.
 */
public class WebSocketTransportFactory implements TransportFactory {

    private static final int MAX_TEXT_MESSAGE_BYTES = 4 * 1024 * 1024;

    private final MonitorProperties.Transport transportProperties;
    private final ObjectMapper objectMapper;
    private final WebSocketClient webSocketClient;
    private final ScheduledExecutorService pingScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "ws-ping");
        thread.setDaemon(true);
        return thread;
    });

    public WebSocketTransportFactory(MonitorProperties.Transport transportProperties, ObjectMapper objectMapper) {
        this.transportProperties = transportProperties;
        this.objectMapper = objectMapper;

        WebSocketContainer container = ContainerProvider.getWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize(MAX_TEXT_MESSAGE_BYTES);
        this.webSocketClient = new StandardWebSocketClient(container);
    }

    @Override
    public StreamTransport create(int slot, TransportSettings settings, TransportListener listener) {
        return new WebSocketStreamTransport(
                slot,
                URI.create(transportProperties.getWsUrl()),
                transportProperties.getChannels(),
                settings,
                listener,
                webSocketClient,
                objectMapper,
                pingScheduler,
                transportProperties.getPingInterval());
    }

    @Override
    public String getStrategyName() {
        return "websocket";
    }
}
