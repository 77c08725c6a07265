package com.example.namespacedcache.kv;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * {@link KvClient} backed by a {@link StringRedisTemplate}. Driver failures surface as
 * Spring's unchecked {@code DataAccessException}s.
 */
public class RedisKvClient implements KvClient {

    private final StringRedisTemplate redis;

    public RedisKvClient(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        // Sub-millisecond expiries round up to 1ms; Redis rejects a zero TTL.
        redis.opsForValue().set(key, value, Math.max(1, ttl.toMillis()), TimeUnit.MILLISECONDS);
    }
}
