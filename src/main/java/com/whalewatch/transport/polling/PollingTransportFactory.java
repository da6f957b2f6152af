package com.whalewatch.transport.polling;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whalewatch.config.MonitorProperties;
import com.whalewatch.transport.StreamTransport;
import com.whalewatch.transport.TransportFactory;
import com.whalewatch.transport.TransportListener;
import com.whalewatch.transport.TransportSettings;
import java.time.Clock;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

public class PollingTransportFactory implements TransportFactory {

    private final MonitorProperties.Transport transportProperties;
    private final InfoApiClient infoApiClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PollingTransportFactory(
            MonitorProperties.Transport transportProperties, ObjectMapper objectMapper, Clock clock) {
        this.transportProperties = transportProperties;
        this.objectMapper = objectMapper;
        this.clock = clock;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) transportProperties.getHttpTimeout().toMillis());
        requestFactory.setReadTimeout((int) transportProperties.getHttpTimeout().toMillis());
        this.infoApiClient = new InfoApiClient(new RestTemplate(requestFactory), transportProperties.getInfoUrl());
    }

    @Override
    public StreamTransport create(int slot, TransportSettings settings, TransportListener listener) {
        return new PollingStreamTransport(
                slot, infoApiClient, listener, objectMapper, clock, transportProperties.getPollInterval());
    }

    @Override
    public String getStrategyName() {
        return "polling";
    }
}
