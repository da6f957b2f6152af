package com.whalewatch.ingest;

import com.whalewatch.domain.model.AggregatedEvent;
import com.whalewatch.engine.AlertRuleEngine;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Single consumer thread that drains the {@link AlertEventQueue} into the {@link AlertRuleEngine}
 * in arrival order. Items still queued when the processor stops are evaluated before the thread
 * exits.
 */
@Component
public class AlertQueueProcessor implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(AlertQueueProcessor.class);

    private final AlertEventQueue alertEventQueue;
    private final AlertRuleEngine alertRuleEngine;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread consumerThread;

    public AlertQueueProcessor(AlertEventQueue alertEventQueue, AlertRuleEngine alertRuleEngine) {
        this.alertEventQueue = alertEventQueue;
        this.alertRuleEngine = alertRuleEngine;
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            consumerThread = new Thread(this::processLoop, "alert-queue-processor");
            consumerThread.setDaemon(true);
            consumerThread.start();
            log.info("AlertQueueProcessor started");
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            if (consumerThread != null) {
                consumerThread.interrupt();
            }
            log.info("AlertQueueProcessor stopping");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    // Started before the monitor lifecycle so the queue drains as soon as slots deliver.
    @Override
    public int getPhase() {
        return 0;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    private void processLoop() {
        while (running.get()) {
            try {
                process(alertEventQueue.take());
            } catch (InterruptedException e) {
                if (!running.get()) {
                    log.info("AlertQueueProcessor interrupted during shutdown");
                    break;
                }
                log.warn("AlertQueueProcessor interrupted unexpectedly, resuming");
            }
        }
        drainRemaining();
    }

    /** Evaluates one event; failures are logged so the loop keeps going. */
    public void process(AggregatedEvent event) {
        try {
            alertRuleEngine.process(event);
        } catch (RuntimeException e) {
            log.error("Rule evaluation failed for {} ({})", event.getSourceId(), event.getEntityId(), e);
        }
    }

    /** Evaluates whatever is left in the queue; returns how many events were drained. */
    public int drainRemaining() {
        int drained = 0;
        AggregatedEvent remaining;
        while ((remaining = alertEventQueue.poll()) != null) {
            process(remaining);
            drained++;
        }
        if (drained > 0) {
            log.info("Drained {} remaining events during shutdown", drained);
        }
        return drained;
    }
}
