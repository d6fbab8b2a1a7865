package com.phillippitts.querybridge.service.cache;

import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Durable cache store on Redis via Spring Data Redis.
 *
 * <p>Values are written with {@code SET key value EX ttl}. Connection failures surface as
 * Spring {@code DataAccessException}s, which the response cache downgrades to misses.
 */
public class RedisCacheStore implements CacheStore {

    private final StringRedisTemplate redis;

    public RedisCacheStore(StringRedisTemplate redis) {
        this.redis = Objects.requireNonNull(redis, "redis");
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        redis.opsForValue().set(key, value, ttl);
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redis.delete(key));
    }

    @Override
    public Set<String> keys(String prefix) {
        Set<String> keys = redis.keys(prefix + "*");
        return keys == null ? Set.of() : new HashSet<>(keys);
    }

    @Override
    public String name() {
        return "redis";
    }
}
