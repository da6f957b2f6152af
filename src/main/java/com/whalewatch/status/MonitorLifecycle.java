package com.whalewatch.status;

import com.whalewatch.aggregation.OrderAggregationBuffer;
import com.whalewatch.engine.MonitorRegistry;
import com.whalewatch.exception.PoolStartException;
import com.whalewatch.pool.ConnectionPoolManager;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Starts monitoring once the context is up and tears it down in order on shutdown.
 *
 * <p>The pool is started in the background so the status endpoints answer while slots are still
 * subscribing. A start failure is logged and left visible in the pool status; the process keeps
 * running. Shutdown order:
 * <ol>
 *   <li>Stop the connection pool (no more payloads)</li>
 *   <li>Discard pending order aggregations and their timers</li>
 * </ol>
 * The alert queue processor has a lower phase, so it stops afterwards and drains what is queued.
 */
@Service
public class MonitorLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(MonitorLifecycle.class);

    private final ConnectionPoolManager connectionPoolManager;
    private final OrderAggregationBuffer aggregationBuffer;
    private final MonitorRegistry monitorRegistry;
    private final MonitorStatusService monitorStatusService;
    private final Executor slotExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public MonitorLifecycle(
            ConnectionPoolManager connectionPoolManager,
            OrderAggregationBuffer aggregationBuffer,
            MonitorRegistry monitorRegistry,
            MonitorStatusService monitorStatusService,
            @Qualifier("slotExecutor") Executor slotExecutor) {
        this.connectionPoolManager = connectionPoolManager;
        this.aggregationBuffer = aggregationBuffer;
        this.monitorRegistry = monitorRegistry;
        this.monitorStatusService = monitorStatusService;
        this.slotExecutor = slotExecutor;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        monitorStatusService.recordStart();
        CompletableFuture.runAsync(this::startPool, slotExecutor);
        log.info("Monitor starting for {} active entities", monitorRegistry.getActiveEntities().size());
    }

    void startPool() {
        try {
            connectionPoolManager.start(monitorRegistry.getActiveEntities());
        } catch (PoolStartException e) {
            log.error("Monitoring is not running: {} (success rate {}%)",
                    e.getMessage(), Math.round(e.getSuccessRate() * 100));
        } catch (RuntimeException e) {
            log.error("Unexpected error starting connection pool", e);
        }
    }

    @Override
    public void stop() {
        log.info("Monitor shutdown initiated...");
        try {
            stopPool();
            discardPendingAggregations();
            log.info("Monitor shutdown completed");
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    // Highest phase: starts after everything else, stops before everything else.
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    void stopPool() {
        try {
            connectionPoolManager.stop();
        } catch (RuntimeException e) {
            log.warn("Failed to stop connection pool cleanly", e);
        }
    }

    void discardPendingAggregations() {
        try {
            aggregationBuffer.shutdown();
        } catch (RuntimeException e) {
            log.warn("Failed to shut down aggregation buffer cleanly", e);
        }
    }
}
