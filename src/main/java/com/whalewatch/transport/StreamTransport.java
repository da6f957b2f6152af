package com.whalewatch.transport;

import java.time.Duration;

/**
 * One upstream connection able to carry subscriptions for several entities.
 *
 * <p>Implementations differ only in how events are obtained (a persistent stream or periodic
 * polling); both deliver {@link RawPayload}s of the same shape. Every blocking call is bounded:
 * {@link #connect} by its timeout argument and {@link #subscribe} by the subscribe timeout of the
 * {@link TransportSettings} the transport was created with. Failures surface as
 * {@link com.whalewatch.exception.TransportException}.
 */
public interface StreamTransport {

    /** Opens the connection and returns once it is ready to accept subscriptions. */
    void connect(Duration timeout);

    /** Subscribes one entity; {@code onEvent} is invoked for every payload routed to it. */
    SubscriptionHandle subscribe(String entityId, RawPayloadHandler onEvent);

    void unsubscribe(SubscriptionHandle handle);

    /** Closes the connection. Safe to call more than once. */
    void close();

    boolean isOpen();
}
