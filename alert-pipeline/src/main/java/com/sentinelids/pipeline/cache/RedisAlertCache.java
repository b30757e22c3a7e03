package com.sentinelids.pipeline.cache;

import com.sentinelids.pipeline.stream.FieldCodec;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link AlertCache} storing JSON documents in Redis with {@code SET key value PX ttl}.
 *
 * @author Naveed Gung
 */
@Component
public class RedisAlertCache implements AlertCache {

    private static final Logger log = LoggerFactory.getLogger(RedisAlertCache.class);

    private final StringRedisTemplate redisTemplate;
    private final FieldCodec codec;
    private final Counter failures;

    public RedisAlertCache(StringRedisTemplate redisTemplate, FieldCodec codec, MeterRegistry meterRegistry) {
        this.redisTemplate = redisTemplate;
        this.codec = codec;
        this.failures = Counter.builder("sentinel.cache.failures")
                .description("Cache reads and writes that failed and were ignored")
                .register(meterRegistry);
    }

    @Override
    public boolean put(String key, Object value, Duration ttl) {
        try {
            String json = value instanceof String s ? s : codec.toJson(value);
            redisTemplate.opsForValue().set(key, json, ttl.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Cached {} (ttl {})", key, ttl);
            return true;
        } catch (Exception e) {
            failures.increment();
            log.warn("Failed to cache {}: {}", key, e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (Exception e) {
            failures.increment();
            log.warn("Failed to read cache entry {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
