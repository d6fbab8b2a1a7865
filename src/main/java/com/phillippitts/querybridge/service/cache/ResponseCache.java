package com.phillippitts.querybridge.service.cache;

import com.phillippitts.querybridge.domain.CachedAnswer;

import java.time.Duration;
import java.util.Optional;

/**
 * Advisory cache of worker answers keyed by query fingerprint.
 *
 * <p>No method throws because of a store failure: errors are logged, counted and treated as a
 * miss or no-op. When caching is disabled every lookup misses and every write is ignored.
 *
 * @see LocalResponseCache
 * @see TieredResponseCache
 */
public interface ResponseCache {

    Optional<CachedAnswer> get(String fingerprint);

    /** Stores with the configured default TTL. */
    void set(String fingerprint, CachedAnswer answer);

    void set(String fingerprint, CachedAnswer answer, Duration ttl);

    boolean delete(String fingerprint);

    /** Removes every {@link QueryFingerprint#PREFIX} entry; other keys are untouched. */
    void clear();

    /** Number of cached answers, or -1 if the store could not be queried. */
    long size();

    CacheStats stats();

    void resetStats();

    /** Round-trips a short-lived probe entry through the stores. */
    boolean healthCheck();

    default String fingerprint(String text) {
        return QueryFingerprint.of(text);
    }
}
