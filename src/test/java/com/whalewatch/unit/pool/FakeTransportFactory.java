package com.whalewatch.unit.pool;

import com.whalewatch.exception.TransportException;
import com.whalewatch.pool.ConnectionPoolManager;
import com.whalewatch.transport.RawPayload;
import com.whalewatch.transport.RawPayloadHandler;
import com.whalewatch.transport.StreamTransport;
import com.whalewatch.transport.SubscriptionHandle;
import com.whalewatch.transport.TransportFactory;
import com.whalewatch.transport.TransportListener;
import com.whalewatch.transport.TransportSettings;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** Scriptable transports for pool tests. Failure rules apply per entity or per connect call. */
class FakeTransportFactory implements TransportFactory {

    final List<FakeTransport> created = new CopyOnWriteArrayList<>();
    final Map<Integer, TransportSettings> settingsBySlot = new ConcurrentHashMap<>();

    /** Subscriptions of these entities always fail, except on the fallback slot. */
    final Set<String> failingInPool = ConcurrentHashMap.newKeySet();
    /** Subscriptions of these entities always fail, on every slot. */
    final Set<String> failingEverywhere = ConcurrentHashMap.newKeySet();
    final Set<String> unauthorized = ConcurrentHashMap.newKeySet();
    /** Entity id to number of subscribe attempts that fail before one succeeds. */
    final Map<String, AtomicInteger> transientFailures = new ConcurrentHashMap<>();
    final Map<String, AtomicInteger> subscribeAttempts = new ConcurrentHashMap<>();
    final AtomicInteger connectFailures = new AtomicInteger();
    volatile boolean connectUnauthorized;
    volatile long closeDelayMs;

    @Override
    public StreamTransport create(int slot, TransportSettings settings, TransportListener listener) {
        settingsBySlot.put(slot, settings);
        FakeTransport transport = new FakeTransport(slot, listener);
        created.add(transport);
        return transport;
    }

    @Override
    public String getStrategyName() {
        return "fake";
    }

    List<FakeTransport> forSlot(int slot) {
        return created.stream().filter(t -> t.slot == slot).toList();
    }

    int attemptsFor(String entityId) {
        AtomicInteger attempts = subscribeAttempts.get(entityId);
        return attempts == null ? 0 : attempts.get();
    }

    class FakeTransport implements StreamTransport {

        final int slot;
        final TransportListener listener;
        final Map<String, RawPayloadHandler> handlers = new ConcurrentHashMap<>();
        final AtomicInteger unsubscribeCalls = new AtomicInteger();
        volatile boolean open;
        volatile boolean closed;

        FakeTransport(int slot, TransportListener listener) {
            this.slot = slot;
            this.listener = listener;
        }

        @Override
        public void connect(Duration timeout) {
            if (connectUnauthorized) {
                throw TransportException.unauthorized("handshake rejected [401]");
            }
            if (connectFailures.getAndUpdate(n -> Math.max(n - 1, 0)) > 0) {
                throw TransportException.timeout("connect timed out");
            }
            open = true;
        }

        @Override
        public SubscriptionHandle subscribe(String entityId, RawPayloadHandler onEvent) {
            subscribeAttempts.computeIfAbsent(entityId, id -> new AtomicInteger()).incrementAndGet();
            if (unauthorized.contains(entityId)) {
                throw TransportException.unauthorized("unauthorized " + entityId);
            }
            if (failingEverywhere.contains(entityId)
                    || (slot != ConnectionPoolManager.FALLBACK_SLOT && failingInPool.contains(entityId))) {
                throw TransportException.timeout("subscribe timed out for " + entityId);
            }
            AtomicInteger remaining = transientFailures.get(entityId);
            if (remaining != null && remaining.getAndDecrement() > 0) {
                throw new TransportException("transient failure for " + entityId);
            }
            handlers.put(entityId, onEvent);
            return new SubscriptionHandle(entityId, List.of("userFills"));
        }

        @Override
        public void unsubscribe(SubscriptionHandle handle) {
            unsubscribeCalls.incrementAndGet();
            handlers.remove(handle.entityId());
        }

        @Override
        public void close() {
            if (closeDelayMs > 0) {
                try {
                    Thread.sleep(closeDelayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            open = false;
            closed = true;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        void deliver(String entityId, RawPayload payload) {
            handlers.get(entityId).onPayload(payload);
        }
    }
}
