package com.phillippitts.querybridge.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Response cache held entirely in process memory ({@code cache.store=memory}).
 */
public class LocalResponseCache extends AbstractResponseCache {

    public LocalResponseCache(boolean enabled, Duration defaultTtl, InMemoryCacheStore store) {
        super(enabled, defaultTtl, store);
    }

    @Override
    protected boolean primaryInUse() {
        return false;
    }

    @Override
    protected Optional<String> readPayload(String key) {
        return fallback.get(key);
    }

    @Override
    protected void writePayload(String key, String payload, Duration ttl) {
        fallback.set(key, payload, ttl);
    }

    @Override
    protected boolean removeKey(String key) {
        return fallback.delete(key);
    }

    @Override
    protected void removePrefix(String prefix) {
        for (String key : fallback.keys(prefix)) {
            fallback.delete(key);
        }
    }

    @Override
    protected long countKeys() {
        return fallback.keys(QueryFingerprint.PREFIX).size();
    }
}
