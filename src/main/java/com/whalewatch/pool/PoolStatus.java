package com.whalewatch.pool;

import com.whalewatch.domain.enums.ConnectionState;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class PoolStatus {

    private final boolean running;
    private final boolean fallbackMode;
    private final String strategy;
    private final int totalEntities;
    private final int subscribedEntities;
    private final double successRate;
    private final int totalReconnects;
    private final String lastStartError;
    private final List<SlotStatus> slots;

    @Getter
    @Builder
    public static class SlotStatus {
        private final int slot;
        private final ConnectionState state;
        private final int assignedEntities;
        private final int subscribedEntities;
        private final long lastMessageAgeMs;
        private final int consecutiveFailures;
        private final int reconnectCount;
        private final String lastError;
    }
}
