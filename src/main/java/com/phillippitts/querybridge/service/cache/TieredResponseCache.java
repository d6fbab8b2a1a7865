package com.phillippitts.querybridge.service.cache;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Response cache with a durable primary store in front of the in-process fallback
 * ({@code cache.store=redis}).
 *
 * <p>Reads try the primary first and fall back to process memory; writes go to the primary
 * and always to the fallback, so answers survive a primary outage for as long as the
 * fallback keeps them. A primary failure is counted and logged, never propagated.
 */
public class TieredResponseCache extends AbstractResponseCache {

    private final CacheStore primary;

    public TieredResponseCache(boolean enabled, Duration defaultTtl, CacheStore primary, InMemoryCacheStore fallback) {
        super(enabled, defaultTtl, fallback);
        this.primary = Objects.requireNonNull(primary, "primary");
    }

    @Override
    protected boolean primaryInUse() {
        return true;
    }

    @Override
    protected boolean primaryHealthy() {
        try {
            primary.set(HEALTH_CHECK_KEY, "{}", Duration.ofSeconds(10));
            boolean found = primary.get(HEALTH_CHECK_KEY).isPresent();
            primary.delete(HEALTH_CHECK_KEY);
            return found;
        } catch (RuntimeException e) {
            recordError("health:" + primary.name(), HEALTH_CHECK_KEY, e);
            return false;
        }
    }

    @Override
    protected Optional<String> readPayload(String key) {
        try {
            Optional<String> value = primary.get(key);
            if (value.isPresent()) {
                return value;
            }
        } catch (RuntimeException e) {
            recordError("get:" + primary.name(), key, e);
        }
        return fallback.get(key);
    }

    @Override
    protected void writePayload(String key, String payload, Duration ttl) {
        try {
            primary.set(key, payload, ttl);
        } catch (RuntimeException e) {
            recordError("set:" + primary.name(), key, e);
        }
        fallback.set(key, payload, ttl);
    }

    @Override
    protected boolean removeKey(String key) {
        boolean removed = false;
        try {
            removed = primary.delete(key);
        } catch (RuntimeException e) {
            recordError("delete:" + primary.name(), key, e);
        }
        return fallback.delete(key) || removed;
    }

    @Override
    protected void removePrefix(String prefix) {
        try {
            for (String key : primary.keys(prefix)) {
                primary.delete(key);
            }
        } catch (RuntimeException e) {
            recordError("clear:" + primary.name(), prefix + "*", e);
        }
        for (String key : fallback.keys(prefix)) {
            fallback.delete(key);
        }
    }

    @Override
    protected long countKeys() {
        try {
            return primary.keys(QueryFingerprint.PREFIX).size();
        } catch (RuntimeException e) {
            recordError("size:" + primary.name(), QueryFingerprint.PREFIX + "*", e);
            return fallback.keys(QueryFingerprint.PREFIX).size();
        }
    }
}
