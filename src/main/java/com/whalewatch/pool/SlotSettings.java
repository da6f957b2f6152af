package com.whalewatch.pool;

import com.whalewatch.transport.TransportSettings;
import java.time.Duration;

/** Timeouts and pacing for one subscribe pass; fallback mode uses a slower instance. */
record SlotSettings(TransportSettings transport, Duration subscriptionDelay) {

    Duration connectTimeout() {
        return transport.connectTimeout();
    }
}
