package com.whalewatch.window;

import com.whalewatch.config.MonitorProperties;
import com.whalewatch.config.RedisConfig;
import com.whalewatch.domain.enums.Direction;
import com.whalewatch.domain.model.WindowCounter;
import com.whalewatch.domain.model.WindowSample;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Rolling per-(entity, direction) totals persisted in Redis.
 *
 * <p>Windows are aligned to a fixed anchor rather than to calendar boundaries:
 * {@code windowStart(now) = anchor + floor((now - anchor) / length) * length}. A stored counter
 * whose window start is older than the current one is treated as zero and reset on the next write,
 * so restarts keep honoring the live window.
 *
 * <p>Amounts are summed as {@link BigDecimal}. Updates for the same key are serialized by a per-key
 * lock; different keys never contend.
 *
 * <p>A failed write leaves the stored counter untouched (fail-closed) and reads fall back to the
 * last value this process saw for the key.
 *
 * <p>Key schema: {@code whalewatch:window:{entityId}:{direction}}
 */
@Service
public class SlidingWindowAggregator {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowAggregator.class);

    public static final String KEY_PREFIX = RedisConfig.KEY_PREFIX_WINDOW;

    private final RedisTemplate<String, Object> redisTemplate;
    private final Clock clock;
    private final long windowLengthMs;
    private final long anchorEpochMs;
    private final Duration ttl;
    private final int maxSamples;

    private final ConcurrentHashMap<String, ReentrantLock> keyLocks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, WindowCounter> lastKnown = new ConcurrentHashMap<>();

    public SlidingWindowAggregator(
            RedisTemplate<String, Object> redisTemplate, MonitorProperties monitorProperties, Clock clock) {
        MonitorProperties.Window window = monitorProperties.getWindow();
        this.redisTemplate = redisTemplate;
        this.clock = clock;
        this.windowLengthMs = window.getLength().toMillis();
        this.anchorEpochMs = window.getAnchorEpochMs();
        this.ttl = window.getLength().plus(window.getTtlMargin());
        this.maxSamples = window.getMaxSamples();
    }

    /** Start of the window containing {@code timestamp}. */
    public long windowStart(long timestamp) {
        return anchorEpochMs + Math.floorDiv(timestamp - anchorEpochMs, windowLengthMs) * windowLengthMs;
    }

    /** True if {@code occurredAt} falls inside the window that is live right now. */
    public boolean isInCurrentWindow(long occurredAt) {
        return occurredAt >= windowStart(clock.millis());
    }

    /**
     * Adds {@code amount} to the live window of the (entity, direction) counter.
     *
     * @return true if the amount was persisted; false if the event is older than the live window
     *     or the store rejected the write
     */
    public boolean update(String entityId, Direction direction, BigDecimal amount, String sourceId, long occurredAt) {
        long now = clock.millis();
        long currentStart = windowStart(now);
        if (occurredAt < currentStart) {
            log.debug(
                    "Ignoring stale event {} for {} {}: occurredAt {} < windowStart {}",
                    sourceId,
                    entityId,
                    direction,
                    occurredAt,
                    currentStart);
            return false;
        }

        String key = buildKey(entityId, direction);
        ReentrantLock lock = keyLocks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            WindowCounter counter;
            try {
                counter = load(key);
            } catch (DataAccessException e) {
                log.error("Window read failed for {}, update not applied: {}", key, e.getMessage());
                return false;
            }

            if (counter == null || counter.getWindowStart() < currentStart) {
                counter = WindowCounter.empty(entityId, direction, currentStart);
            }

            counter.setCumulativeAmount(counter.getCumulativeAmount().add(amount));
            List<WindowSample> samples = counter.getSamples();
            samples.add(new WindowSample(sourceId, amount, occurredAt));
            if (samples.size() > maxSamples) {
                samples.subList(0, samples.size() - maxSamples).clear();
            }
            counter.setUpdatedAt(now);

            try {
                redisTemplate.opsForValue().set(key, counter, ttl);
            } catch (DataAccessException e) {
                log.error("Window write failed for {}, keeping last-known total: {}", key, e.getMessage());
                return false;
            }
            lastKnown.put(key, counter);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cumulative amount of the live window, zero when there is none. Falls back to the last
     * counter seen by this process when Redis cannot be read.
     */
    public BigDecimal read(String entityId, Direction direction) {
        String key = buildKey(entityId, direction);
        WindowCounter counter;
        try {
            counter = load(key);
        } catch (DataAccessException e) {
            log.warn("Window read failed for {}, using last-known total: {}", key, e.getMessage());
            counter = lastKnown.get(key);
        }

        if (counter == null || counter.getWindowStart() < windowStart(clock.millis())) {
            return BigDecimal.ZERO;
        }
        return counter.getCumulativeAmount();
    }

    private WindowCounter load(String key) {
        Object value = redisTemplate.opsForValue().get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof WindowCounter counter) {
            if (counter.getSamples() == null) {
                counter.setSamples(new ArrayList<>());
            }
            return counter;
        }
        log.warn("Unexpected value type {} at {}, ignoring", value.getClass().getSimpleName(), key);
        return null;
    }

    public static String buildKey(String entityId, Direction direction) {
        return KEY_PREFIX + entityId + ":" + direction.name().toLowerCase(Locale.ROOT);
    }
}
