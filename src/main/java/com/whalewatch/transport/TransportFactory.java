package com.whalewatch.transport;

/** Creates transports of one strategy. Each call returns a fresh, unconnected transport. */
public interface TransportFactory {

    StreamTransport create(int slot, TransportSettings settings, TransportListener listener);

    String getStrategyName();
}
