package com.whalewatch.status;

import com.whalewatch.engine.EngineStats;
import com.whalewatch.pool.PoolStatus;
import lombok.Builder;
import lombok.Getter;

/** Point-in-time view of the whole monitor, served by {@code GET /api/status}. */
@Getter
@Builder
public class SystemStatus {

    private final long startedAt;
    private final long uptimeMs;
    private final long lastHeartbeatAt;
    private final PoolStatus pool;
    private final EngineStats engine;
    private final long payloadsReceived;
    private final long eventsAccepted;
    private final long replaysSkipped;
    private final int pendingAggregations;
    private final int queueDepth;
    private final long queueDropped;
}
