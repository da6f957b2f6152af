package com.whalewatch.pool;

import com.whalewatch.domain.enums.ConnectionState;
import com.whalewatch.transport.StreamTransport;
import com.whalewatch.transport.SubscriptionHandle;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Health and subscription state of one pool slot. Mutated only by {@link ConnectionPoolManager};
 * read from any thread.
 */
public class ConnectionRecord {

    private final int slot;
    private final List<String> assignedEntities;
    private final SlotSettings settings;

    private final Map<String, SubscriptionHandle> handles = new ConcurrentHashMap<>();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicInteger reconnectCount = new AtomicInteger();

    private volatile ConnectionState state = ConnectionState.CONNECTING;
    private volatile StreamTransport transport;
    private volatile long lastMessageAt;
    private volatile String lastError;
    private volatile boolean retired;

    ConnectionRecord(int slot, List<String> assignedEntities, SlotSettings settings) {
        this.slot = slot;
        this.assignedEntities = List.copyOf(assignedEntities);
        this.settings = settings;
    }

    public int getSlot() {
        return slot;
    }

    public List<String> getAssignedEntities() {
        return assignedEntities;
    }

    public ConnectionState getState() {
        return state;
    }

    public long getLastMessageAt() {
        return lastMessageAt;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public int getReconnectCount() {
        return reconnectCount.get();
    }

    public int getSubscribedCount() {
        return handles.size();
    }

    public String getLastError() {
        return lastError;
    }

    public boolean isFullySubscribed() {
        return handles.size() == assignedEntities.size();
    }

    SlotSettings getSettings() {
        return settings;
    }

    StreamTransport getTransport() {
        return transport;
    }

    List<SubscriptionHandle> getHandles() {
        return new ArrayList<>(handles.values());
    }

    void setState(ConnectionState state) {
        this.state = state;
    }

    void setTransport(StreamTransport transport) {
        this.transport = transport;
    }

    void markMessage(long now) {
        this.lastMessageAt = now;
    }

    void setLastError(String lastError) {
        this.lastError = lastError;
    }

    int recordFailure() {
        return consecutiveFailures.incrementAndGet();
    }

    void resetFailures() {
        consecutiveFailures.set(0);
    }

    void incrementReconnectCount() {
        reconnectCount.incrementAndGet();
    }

    void addHandle(SubscriptionHandle handle) {
        handles.put(handle.entityId(), handle);
    }

    void clearHandles() {
        handles.clear();
    }

    /** Marks the record as torn down. Workers still starting it must release their transport. */
    void retire() {
        retired = true;
    }

    boolean isRetired() {
        return retired;
    }
}
