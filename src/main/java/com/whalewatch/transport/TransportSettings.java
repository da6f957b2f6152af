package com.whalewatch.transport;

import java.time.Duration;

/** Per-connection timeouts; the fallback mode uses longer values than the normal pool. */
public record TransportSettings(Duration connectTimeout, Duration subscribeTimeout) {}
