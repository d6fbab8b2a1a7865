package com.phillippitts.querybridge.service.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Key/value store with per-entry time-to-live holding serialized cache payloads.
 *
 * <p>Implementations may throw unchecked exceptions on connectivity problems; the response
 * cache treats any such exception as a miss or no-op.
 *
 * @see RedisCacheStore
 * @see InMemoryCacheStore
 */
public interface CacheStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    /**
     * @return true if an entry was removed
     */
    boolean delete(String key);

    /**
     * @return live keys starting with {@code prefix}
     */
    Set<String> keys(String prefix);

    /** Short name for logs and stats. */
    String name();
}
