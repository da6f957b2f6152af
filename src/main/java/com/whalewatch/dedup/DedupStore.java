package com.whalewatch.dedup;

import com.whalewatch.config.MonitorProperties;
import com.whalewatch.config.RedisConfig;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Redis-backed record of source ids that already produced (or are producing) an alert evaluation.
 *
 * <p>Each marker lives for the window length plus a safety margin, so a marker always outlives
 * the cumulative window it protects. The stored value is the first-seen epoch millis.
 *
 * <p>Every Redis failure fails open: an event whose status cannot be verified is treated as new,
 * trading a rare duplicate alert for never silently dropping one.
 *
 * <p>Key schema: {@code whalewatch:dedup:{sourceId}}
 */
@Service
public class DedupStore {

    private static final Logger log = LoggerFactory.getLogger(DedupStore.class);

    public static final String KEY_PREFIX = RedisConfig.KEY_PREFIX_DEDUP;

    private final RedisTemplate<String, Object> redisTemplate;
    private final Duration ttl;
    private final boolean atomicClaim;
    private final Clock clock;

    public DedupStore(RedisTemplate<String, Object> redisTemplate, MonitorProperties monitorProperties, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.ttl = monitorProperties
                .getWindow()
                .getLength()
                .plus(monitorProperties.getDedup().getTtlMargin());
        this.atomicClaim = monitorProperties.getDedup().isAtomicClaim();
        this.clock = clock;
    }

    /**
     * @return true if a marker exists for this source id; false when absent or when Redis is unreachable
     */
    public boolean isProcessed(String sourceId) {
        try {
            Boolean exists = redisTemplate.hasKey(KEY_PREFIX + sourceId);
            return exists != null && exists;
        } catch (DataAccessException e) {
            log.warn("Dedup lookup failed for {}, treating as unprocessed: {}", sourceId, e.getMessage());
            return false;
        }
    }

    /** Idempotent: re-marking refreshes the TTL and keeps the original first-seen value. */
    public void markProcessed(String sourceId) {
        String key = KEY_PREFIX + sourceId;
        try {
            Boolean created = redisTemplate.opsForValue().setIfAbsent(key, clock.millis(), ttl);
            if (created != null && !created) {
                redisTemplate.expire(key, ttl);
            }
        } catch (DataAccessException e) {
            log.error("Dedup mark failed for {}: {}", sourceId, e.getMessage());
        }
    }

    /**
     * Claims a source id for evaluation.
     *
     * <p>With atomic claims enabled this is a single {@code SET NX} with TTL, so two concurrent
     * claims of the same id cannot both win. Otherwise it falls back to check-then-mark.
     *
     * @return true if the caller should evaluate the event, false if it was already claimed
     */
    public boolean claim(String sourceId) {
        if (!atomicClaim) {
            if (isProcessed(sourceId)) {
                return false;
            }
            markProcessed(sourceId);
            return true;
        }

        try {
            Boolean claimed = redisTemplate.opsForValue().setIfAbsent(KEY_PREFIX + sourceId, clock.millis(), ttl);
            if (claimed == null) {
                return true;
            }
            if (!claimed) {
                log.debug("Source id already claimed: {}", sourceId);
            }
            return claimed;
        } catch (DataAccessException e) {
            log.warn("Dedup claim failed for {}, processing anyway: {}", sourceId, e.getMessage());
            return true;
        }
    }

    public Duration getTtl() {
        return ttl;
    }
}
