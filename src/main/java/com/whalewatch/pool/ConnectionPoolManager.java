package com.whalewatch.pool;

import com.whalewatch.config.MonitorProperties;
import com.whalewatch.domain.enums.ConnectionState;
import com.whalewatch.domain.model.WatchedEntity;
import com.whalewatch.exception.PoolStartException;
import com.whalewatch.exception.TransportException;
import com.whalewatch.observability.MonitorMetrics;
import com.whalewatch.transport.RawPayload;
import com.whalewatch.transport.RawPayloadHandler;
import com.whalewatch.transport.StreamTransport;
import com.whalewatch.transport.SubscriptionHandle;
import com.whalewatch.transport.TransportFactory;
import com.whalewatch.transport.TransportListener;
import com.whalewatch.transport.TransportSettings;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Keeps K independent upstream connections alive, each owning a disjoint shard of the watched
 * entities.
 *
 * <p><b>Start:</b> entities are dealt round-robin across slots. Each slot connects (bounded by the
 * connect timeout), then subscribes its entities one at a time with a pause between subscriptions.
 * Connects and subscribes are retried up to {@code subscribeAttempts} times with capped exponential
 * backoff; authorization errors are not retried and fail the whole slot. If the pass subscribes
 * fewer entities than the success floor, every slot is torn down and the pass is repeated once as
 * a single connection with longer timeouts and delays (fallback mode). If that also falls short,
 * {@link #start} throws {@link PoolStartException}.
 *
 * <p><b>Health:</b> a periodic check measures {@code now - lastMessageAt} for every live slot. Past
 * the critical staleness, past the failure ceiling, or with a closed transport, the slot is
 * reconnected on its own worker; past the warn staleness it is only marked
 * {@link ConnectionState#DEGRADED}.
 *
 * <p><b>Isolation:</b> every slot runs on its own worker from {@code slotExecutor}. A reconnect or
 * failure in one slot never blocks another. Unsubscribe and close calls run on
 * {@code cleanupExecutor} and are each bounded by their own timeout so a hung socket cannot stall a
 * reconnect or shutdown. When no cleanup worker is free the call is skipped and logged, never run
 * on the caller.
 *
 * <p>A torn-down record is retired. A worker still starting a retired record (for example one
 * waiting out its stagger when the pass timed out) releases its transport instead of subscribing.
 */
@Service
public class ConnectionPoolManager {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPoolManager.class);

    /** Slot id used by the single connection of fallback mode. */
    public static final int FALLBACK_SLOT = 99;

    private final MonitorProperties.Pool poolProperties;
    private final TransportFactory transportFactory;
    private final RawPayloadHandler payloadHandler;
    private final MonitorMetrics monitorMetrics;
    private final Clock clock;
    private final Executor slotExecutor;
    private final Executor cleanupExecutor;

    private final Map<Integer, ConnectionRecord> records = new ConcurrentSkipListMap<>();
    private final AtomicInteger totalReconnects = new AtomicInteger();

    private volatile boolean running;
    private volatile boolean fallbackMode;
    private volatile String lastStartError;

    public ConnectionPoolManager(
            MonitorProperties monitorProperties,
            TransportFactory transportFactory,
            RawPayloadHandler payloadHandler,
            MonitorMetrics monitorMetrics,
            Clock clock,
            @Qualifier("slotExecutor") Executor slotExecutor,
            @Qualifier("cleanupExecutor") Executor cleanupExecutor) {
        this.poolProperties = monitorProperties.getPool();
        this.transportFactory = transportFactory;
        this.payloadHandler = payloadHandler;
        this.monitorMetrics = monitorMetrics;
        this.clock = clock;
        this.slotExecutor = slotExecutor;
        this.cleanupExecutor = cleanupExecutor;

        monitorMetrics.gauge("pool.slots.ready", this, ConnectionPoolManager::getReadySlotCount);
    }

    /**
     * Partitions the active entities across slots and brings every slot up.
     *
     * @throws PoolStartException if both the pooled pass and the fallback pass stay below the success floor
     */
    public synchronized void start(List<WatchedEntity> entities) {
        if (running) {
            log.warn("Connection pool already running");
            return;
        }

        List<String> entityIds = entities.stream()
                .filter(WatchedEntity::isActive)
                .map(WatchedEntity::getId)
                .toList();
        lastStartError = null;
        fallbackMode = false;

        if (entityIds.isEmpty()) {
            log.warn("No active entities to watch, connection pool idle");
            running = true;
            return;
        }

        log.info(
                "Starting {} connection pool: {} entities across {} slots",
                transportFactory.getStrategyName(),
                entityIds.size(),
                Math.min(poolProperties.getSize(), entityIds.size()));

        double successRate = runPass(
                partition(entityIds, poolProperties.getSize()),
                normalSettings(),
                poolProperties.getSlotStagger().toMillis());
        if (successRate >= poolProperties.getSuccessFloor()) {
            running = true;
            log.info("Connection pool started: {}% of entities subscribed", percent(successRate));
            return;
        }

        log.warn(
                "Initial subscribe pass reached {}% (floor {}%), falling back to a single conservative connection",
                percent(successRate),
                percent(poolProperties.getSuccessFloor()));
        teardownAll();
        fallbackMode = true;

        Map<Integer, List<String>> single = new LinkedHashMap<>();
        single.put(FALLBACK_SLOT, entityIds);
        double fallbackRate = runPass(single, fallbackSettings(), 0L);
        if (fallbackRate >= poolProperties.getSuccessFloor()) {
            running = true;
            log.info("Connection pool started in fallback mode: {}% of entities subscribed", percent(fallbackRate));
            return;
        }

        teardownAll();
        fallbackMode = false;
        lastStartError = "Fallback pass reached " + percent(fallbackRate) + "%";
        log.error("Connection pool failed to start: {}", lastStartError);
        throw new PoolStartException("Connection pool failed to start: " + lastStartError, fallbackRate);
    }

    /**
     * Periodic health tick. Schedules a reconnect for stale, failing or closed slots and flags
     * quiet ones as degraded. Never blocks on a reconnect.
     */
    @Scheduled(
            fixedDelayString = "${monitor.pool.health-check-interval:30s}",
            initialDelayString = "${monitor.pool.health-check-interval:30s}")
    public void runHealthCheck() {
        if (!running) {
            return;
        }
        long now = clock.millis();
        long warnMs = poolProperties.getWarnStaleness().toMillis();
        long criticalMs = poolProperties.getCriticalStaleness().toMillis();

        for (ConnectionRecord record : records.values()) {
            ConnectionState state = record.getState();
            if (state == ConnectionState.FAILED
                    || state == ConnectionState.RECONNECTING
                    || state == ConnectionState.CONNECTING) {
                continue;
            }

            long staleness = now - record.getLastMessageAt();
            StreamTransport transport = record.getTransport();
            boolean closed = transport == null || !transport.isOpen();
            boolean tooManyFailures = record.getConsecutiveFailures() > poolProperties.getFailureCeiling();

            if (staleness > criticalMs || tooManyFailures || closed) {
                log.warn(
                        "Slot {} unhealthy (staleness={}ms, failures={}, closed={}), reconnecting",
                        record.getSlot(),
                        staleness,
                        record.getConsecutiveFailures(),
                        closed);
                record.setState(ConnectionState.RECONNECTING);
                CompletableFuture.runAsync(() -> reconnectSafely(record), slotExecutor);
            } else if (staleness > warnMs) {
                if (state == ConnectionState.READY) {
                    log.warn("Slot {} quiet for {}ms, marking degraded", record.getSlot(), staleness);
                    record.setState(ConnectionState.DEGRADED);
                }
            } else if (state == ConnectionState.DEGRADED && record.isFullySubscribed()) {
                log.info("Slot {} healthy again", record.getSlot());
                record.setState(ConnectionState.READY);
            }
        }
    }

    /**
     * Replaces the slot's transport: best-effort bounded cleanup of the old one, then connect and
     * re-subscribe the same entities. Connect failures are retried with capped backoff up to
     * {@code maxReconnectAttempts}; an authorization failure or exhausted attempts leave the slot
     * {@link ConnectionState#FAILED}.
     */
    public void reconnect(int slot) {
        ConnectionRecord record = records.get(slot);
        if (record == null) {
            log.warn("Reconnect requested for unknown slot {}", slot);
            return;
        }
        record.setState(ConnectionState.RECONNECTING);
        discard(record);

        int maxAttempts = poolProperties.getMaxReconnectAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (!running || record.isRetired()) {
                log.info("Pool stopping, abandoning reconnect of slot {}", slot);
                return;
            }
            StreamTransport transport =
                    transportFactory.create(slot, record.getSettings().transport(), listenerFor(record));
            record.setTransport(transport);
            try {
                transport.connect(record.getSettings().connectTimeout());
            } catch (TransportException e) {
                record.recordFailure();
                record.setLastError(e.getMessage());
                bounded(transport::close, poolProperties.getCloseTimeout(), slot, "close");
                if (e.isAuthorization()) {
                    record.setState(ConnectionState.FAILED);
                    log.error("Slot {} reconnect rejected, not retrying: {}", slot, e.getMessage());
                    return;
                }
                if (attempt < maxAttempts) {
                    long delay = computeBackoff(attempt);
                    log.warn(
                            "Slot {} reconnect attempt {}/{} failed, retrying in {}ms: {}",
                            slot,
                            attempt,
                            maxAttempts,
                            delay,
                            e.getMessage());
                    if (!pause(delay)) {
                        return;
                    }
                }
                continue;
            }

            if (releaseIfRetired(record, transport)) {
                return;
            }
            record.resetFailures();
            record.markMessage(clock.millis());
            subscribeAll(record, transport);
            if (record.isRetired()) {
                return;
            }
            record.incrementReconnectCount();
            totalReconnects.incrementAndGet();
            monitorMetrics.recordReconnect();
            log.info(
                    "Slot {} reconnected (reconnect #{}): {}/{} entities subscribed, state {}",
                    slot,
                    record.getReconnectCount(),
                    record.getSubscribedCount(),
                    record.getAssignedEntities().size(),
                    record.getState());
            return;
        }

        record.setState(ConnectionState.FAILED);
        log.error("Slot {} failed to reconnect after {} attempts", slot, maxAttempts);
    }

    /**
     * Unsubscribes and closes every slot. Each slot is cleaned up on its own worker and each call is
     * bounded, so shutdown completes within roughly one unsubscribe plus one close timeout.
     */
    public synchronized void stop() {
        if (!running && records.isEmpty()) {
            return;
        }
        running = false;
        log.info("Stopping connection pool ({} slots)", records.size());
        teardownAll();
        fallbackMode = false;
        log.info("Connection pool stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isFallbackMode() {
        return fallbackMode;
    }

    public PoolStatus getStatus() {
        long now = clock.millis();
        List<PoolStatus.SlotStatus> slots = new ArrayList<>();
        int total = 0;
        int subscribed = 0;
        for (ConnectionRecord record : records.values()) {
            total += record.getAssignedEntities().size();
            subscribed += record.getSubscribedCount();
            slots.add(PoolStatus.SlotStatus.builder()
                    .slot(record.getSlot())
                    .state(record.getState())
                    .assignedEntities(record.getAssignedEntities().size())
                    .subscribedEntities(record.getSubscribedCount())
                    .lastMessageAgeMs(record.getLastMessageAt() > 0 ? now - record.getLastMessageAt() : -1)
                    .consecutiveFailures(record.getConsecutiveFailures())
                    .reconnectCount(record.getReconnectCount())
                    .lastError(record.getLastError())
                    .build());
        }

        return PoolStatus.builder()
                .running(running)
                .fallbackMode(fallbackMode)
                .strategy(transportFactory.getStrategyName())
                .totalEntities(total)
                .subscribedEntities(subscribed)
                .successRate(total == 0 ? 0.0 : (double) subscribed / total)
                .totalReconnects(totalReconnects.get())
                .lastStartError(lastStartError)
                .slots(slots)
                .build();
    }

    public int getReadySlotCount() {
        return (int) records.values().stream()
                .filter(record -> record.getState() == ConnectionState.READY)
                .count();
    }

    /** Delay before retry {@code attempt + 1}: base doubled per attempt, capped at the configured max. */
    public long computeBackoff(int attempt) {
        long base = poolProperties.getBackoffBase().toMillis();
        long max = poolProperties.getBackoffMax().toMillis();
        int shift = Math.min(Math.max(attempt - 1, 0), 30);
        return Math.min(base * (1L << shift), max);
    }

    /** Round-robin: entity {@code i} goes to slot {@code i % size}. Slots left empty are omitted. */
    static Map<Integer, List<String>> partition(List<String> entityIds, int size) {
        Map<Integer, List<String>> shards = new LinkedHashMap<>();
        for (int i = 0; i < entityIds.size(); i++) {
            shards.computeIfAbsent(i % size, slot -> new ArrayList<>()).add(entityIds.get(i));
        }
        return shards;
    }

    private double runPass(Map<Integer, List<String>> shards, SlotSettings settings, long staggerMs) {
        List<CompletableFuture<Void>> startups = new ArrayList<>();
        int index = 0;
        for (Map.Entry<Integer, List<String>> shard : shards.entrySet()) {
            ConnectionRecord record = new ConnectionRecord(shard.getKey(), shard.getValue(), settings);
            records.put(record.getSlot(), record);
            long delay = index++ * staggerMs;
            startups.add(CompletableFuture.runAsync(
                    () -> {
                        if (delay == 0 || pause(delay)) {
                            openSlot(record);
                        }
                    },
                    slotExecutor));
        }

        try {
            CompletableFuture.allOf(startups.toArray(new CompletableFuture[0]))
                    .get(poolProperties.getStartTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Subscribe pass still running after {}ms, counting what is subscribed so far",
                    poolProperties.getStartTimeout().toMillis());
        } catch (ExecutionException e) {
            log.error("Slot startup failed unexpectedly", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for slots to start");
        }

        int total = 0;
        int subscribed = 0;
        for (ConnectionRecord record : records.values()) {
            total += record.getAssignedEntities().size();
            subscribed += record.getSubscribedCount();
        }
        return total == 0 ? 1.0 : (double) subscribed / total;
    }

    private void openSlot(ConnectionRecord record) {
        int slot = record.getSlot();
        if (record.isRetired()) {
            log.info("Slot {} was torn down before it started, skipping", slot);
            return;
        }
        record.setState(ConnectionState.CONNECTING);
        StreamTransport transport =
                transportFactory.create(slot, record.getSettings().transport(), listenerFor(record));
        record.setTransport(transport);

        try {
            withRetry(record, "connect", () -> {
                transport.connect(record.getSettings().connectTimeout());
                return null;
            });
        } catch (TransportException e) {
            record.setLastError(e.getMessage());
            record.setState(ConnectionState.FAILED);
            log.error("Slot {} could not connect: {}", slot, e.getMessage());
            return;
        }
        if (releaseIfRetired(record, transport)) {
            return;
        }

        record.resetFailures();
        record.markMessage(clock.millis());
        subscribeAll(record, transport);
        if (record.isRetired()) {
            return;
        }
        log.info(
                "Slot {} up: {}/{} entities subscribed, state {}",
                slot,
                record.getSubscribedCount(),
                record.getAssignedEntities().size(),
                record.getState());
    }

    private void subscribeAll(ConnectionRecord record, StreamTransport transport) {
        int slot = record.getSlot();
        List<String> assigned = record.getAssignedEntities();
        long delayMs = record.getSettings().subscriptionDelay().toMillis();

        for (int i = 0; i < assigned.size(); i++) {
            if (releaseIfRetired(record, transport)) {
                return;
            }
            String entityId = assigned.get(i);
            try {
                SubscriptionHandle handle = withRetry(
                        record,
                        "subscribe " + entityId,
                        () -> transport.subscribe(entityId, payload -> onPayload(record, payload)));
                record.addHandle(handle);
                log.info("Slot {} subscribed {} ({}/{})", slot, entityId, i + 1, assigned.size());
            } catch (TransportException e) {
                record.setLastError(e.getMessage());
                if (e.isAuthorization()) {
                    record.setState(ConnectionState.FAILED);
                    log.error("Slot {} rejected as unauthorized, abandoning slot: {}", slot, e.getMessage());
                    return;
                }
                log.error("Slot {} gave up subscribing {}: {}", slot, entityId, e.getMessage());
            }

            if (i < assigned.size() - 1 && delayMs > 0 && !pause(delayMs)) {
                break;
            }
        }

        if (releaseIfRetired(record, transport)) {
            return;
        }
        if (record.isFullySubscribed()) {
            record.setState(ConnectionState.READY);
        } else if (record.getSubscribedCount() > 0) {
            record.setState(ConnectionState.DEGRADED);
        } else {
            record.setState(ConnectionState.FAILED);
        }
    }

    private <T> T withRetry(ConnectionRecord record, String operation, Supplier<T> call) {
        int attempts = poolProperties.getSubscribeAttempts();
        TransportException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return call.get();
            } catch (TransportException e) {
                last = e;
                record.recordFailure();
                if (e.isAuthorization()) {
                    throw e;
                }
                if (attempt < attempts) {
                    long delay = computeBackoff(attempt);
                    log.warn(
                            "Slot {} {} failed (attempt {}/{}), retrying in {}ms: {}",
                            record.getSlot(),
                            operation,
                            attempt,
                            attempts,
                            delay,
                            e.getMessage());
                    if (!pause(delay)) {
                        throw new TransportException("Slot " + record.getSlot() + " " + operation + " interrupted", e);
                    }
                }
            }
        }
        throw last;
    }

    private void onPayload(ConnectionRecord record, RawPayload payload) {
        record.markMessage(clock.millis());
        try {
            payloadHandler.onPayload(payload);
        } catch (RuntimeException e) {
            log.error("Slot {} payload handling failed", record.getSlot(), e);
        }
    }

    private TransportListener listenerFor(ConnectionRecord record) {
        return new TransportListener() {
            @Override
            public void onActivity() {
                record.markMessage(clock.millis());
            }

            @Override
            public void onError(Throwable error) {
                int failures = record.recordFailure();
                record.setLastError(error.getMessage());
                log.warn("Slot {} transport error #{}: {}", record.getSlot(), failures, error.getMessage());
            }
        };
    }

    private void reconnectSafely(ConnectionRecord record) {
        try {
            reconnect(record.getSlot());
        } catch (RuntimeException e) {
            record.setState(ConnectionState.FAILED);
            record.setLastError(e.getMessage());
            log.error("Slot {} reconnect crashed", record.getSlot(), e);
        }
    }

    private void teardownAll() {
        List<CompletableFuture<Void>> closing = new ArrayList<>();
        for (ConnectionRecord record : records.values()) {
            record.retire();
            closing.add(CompletableFuture.runAsync(() -> discard(record), slotExecutor));
        }
        long window = poolProperties.getUnsubscribeTimeout().toMillis()
                + poolProperties.getCloseTimeout().toMillis()
                + 1_000L;
        try {
            CompletableFuture.allOf(closing.toArray(new CompletableFuture[0])).get(window, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Slot teardown exceeded {}ms, continuing", window);
        } catch (ExecutionException e) {
            log.warn("Slot teardown failed: {}", e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        records.clear();
    }

    /** Best-effort cleanup of the slot's current transport; never throws. */
    private void discard(ConnectionRecord record) {
        StreamTransport transport = record.getTransport();
        if (transport == null) {
            return;
        }
        record.setTransport(null);
        release(record, transport);
    }

    /**
     * Closes {@code transport} if the record was retired while a worker was still starting it.
     * The teardown that retired the record may have run before this transport existed.
     */
    private boolean releaseIfRetired(ConnectionRecord record, StreamTransport transport) {
        if (!record.isRetired()) {
            return false;
        }
        log.info("Slot {} was torn down while starting, releasing its transport", record.getSlot());
        if (record.getTransport() == transport) {
            record.setTransport(null);
        }
        release(record, transport);
        return true;
    }

    private void release(ConnectionRecord record, StreamTransport transport) {
        List<SubscriptionHandle> handles = record.getHandles();
        record.clearHandles();
        int slot = record.getSlot();
        bounded(
                () -> handles.forEach(transport::unsubscribe),
                poolProperties.getUnsubscribeTimeout(),
                slot,
                "unsubscribe");
        bounded(transport::close, poolProperties.getCloseTimeout(), slot, "close");
    }

    private void bounded(Runnable operation, Duration timeout, int slot, String name) {
        CompletableFuture<Void> future;
        try {
            future = CompletableFuture.runAsync(operation, cleanupExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Slot {} {} skipped: no cleanup worker free", slot, name);
            return;
        }
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Slot {} {} timed out after {}ms", slot, name, timeout.toMillis());
        } catch (ExecutionException e) {
            log.warn("Slot {} {} failed: {}", slot, name, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Slot {} {} interrupted", slot, name);
        }
    }

    private SlotSettings normalSettings() {
        return new SlotSettings(
                new TransportSettings(poolProperties.getConnectTimeout(), poolProperties.getSubscribeTimeout()),
                poolProperties.getSubscriptionDelay());
    }

    private SlotSettings fallbackSettings() {
        MonitorProperties.Fallback fallback = poolProperties.getFallback();
        return new SlotSettings(
                new TransportSettings(fallback.getConnectTimeout(), fallback.getSubscribeTimeout()),
                fallback.getSubscriptionDelay());
    }

    private static boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static long percent(double rate) {
        return Math.round(rate * 100);
    }
}
