package com.whalewatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration with Jackson JSON value serialization.
 *
 * <p>All keys are prefixed with "whalewatch:" so the monitor can share a Redis server.
 * Values never contain {@code java.time} types (timestamps are epoch millis), so the
 * Jackson 2 serializer needs no extra modules.
 *
 * <p>Key schema:
 * <pre>
 *   whalewatch:dedup:{sourceId}               → first-seen epoch millis (TTL window + margin)
 *   whalewatch:window:{entityId}:{direction}  → WindowCounter JSON (TTL window + margin)
 *   whalewatch:status:lastUpdate              → epoch millis of the last heartbeat
 *   whalewatch:status:startTime               → epoch millis of process start
 * </pre>
 */
@Configuration
public class RedisConfig {

    public static final String KEY_PREFIX = "whalewatch:";

    public static final String KEY_PREFIX_DEDUP = KEY_PREFIX + "dedup:";
    public static final String KEY_PREFIX_WINDOW = KEY_PREFIX + "window:";

    public static final String KEY_STATUS_LAST_UPDATE = KEY_PREFIX + "status:lastUpdate";
    public static final String KEY_STATUS_START_TIME = KEY_PREFIX + "status:startTime";

    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory redisConnectionFactory) {
        RedisTemplate<String, Object> redisTemplate = new RedisTemplate<>();
        redisTemplate.setConnectionFactory(redisConnectionFactory);

        StringRedisSerializer keySerializer = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer valueSerializer = new GenericJackson2JsonRedisSerializer();

        redisTemplate.setKeySerializer(keySerializer);
        redisTemplate.setValueSerializer(valueSerializer);
        redisTemplate.setHashKeySerializer(keySerializer);
        redisTemplate.setHashValueSerializer(valueSerializer);

        return redisTemplate;
    }
}
