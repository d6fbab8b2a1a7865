package com.phillippitts.querybridge.service.cache;

import com.phillippitts.querybridge.domain.CachedAnswer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base class for response caches: enabled flag, statistics, payload encoding and the
 * advisory error policy live here; subclasses only decide which stores are consulted.
 *
 * <p><b>Template methods:</b>
 * <ul>
 *   <li>{@link #readPayload(String)} - first stored payload for a key, in store order</li>
 *   <li>{@link #writePayload(String, String, Duration)} - write to every store</li>
 *   <li>{@link #removeKey(String)}, {@link #removePrefix(String)}, {@link #countKeys()}</li>
 * </ul>
 *
 * <p>Subclass implementations may throw; the failure is logged, counted in
 * {@link CacheStats#errors()} and reported as a miss or no-op.
 */
public abstract class AbstractResponseCache implements ResponseCache {

    private static final Logger LOG = LogManager.getLogger(AbstractResponseCache.class);

    static final String HEALTH_CHECK_KEY = "health:check";
    private static final Duration HEALTH_CHECK_TTL = Duration.ofSeconds(10);

    private final boolean enabled;
    private final Duration defaultTtl;
    protected final InMemoryCacheStore fallback;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();
    private final AtomicLong deletes = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    protected AbstractResponseCache(boolean enabled, Duration defaultTtl, InMemoryCacheStore fallback) {
        this.enabled = enabled;
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    @Override
    public final Optional<CachedAnswer> get(String fingerprint) {
        if (!enabled || fingerprint == null) {
            return Optional.empty();
        }
        Optional<String> payload;
        try {
            payload = readPayload(fingerprint);
        } catch (RuntimeException e) {
            recordError("get", fingerprint, e);
            payload = Optional.empty();
        }
        if (payload.isPresent()) {
            try {
                CachedAnswer answer = CachedAnswerCodec.decode(payload.get());
                hits.incrementAndGet();
                LOG.debug("Cache hit: key={}", fingerprint);
                return Optional.of(answer);
            } catch (RuntimeException e) {
                recordError("decode", fingerprint, e);
            }
        }
        misses.incrementAndGet();
        LOG.debug("Cache miss: key={}", fingerprint);
        return Optional.empty();
    }

    @Override
    public final void set(String fingerprint, CachedAnswer answer) {
        set(fingerprint, answer, defaultTtl);
    }

    @Override
    public final void set(String fingerprint, CachedAnswer answer, Duration ttl) {
        if (!enabled || fingerprint == null || answer == null) {
            return;
        }
        Duration effectiveTtl = (ttl == null || ttl.isZero() || ttl.isNegative()) ? defaultTtl : ttl;
        try {
            writePayload(fingerprint, CachedAnswerCodec.encode(answer), effectiveTtl);
            sets.incrementAndGet();
            LOG.debug("Cache set: key={}, ttlSeconds={}", fingerprint, effectiveTtl.toSeconds());
        } catch (RuntimeException e) {
            recordError("set", fingerprint, e);
        }
    }

    @Override
    public final boolean delete(String fingerprint) {
        if (fingerprint == null) {
            return false;
        }
        try {
            boolean removed = removeKey(fingerprint);
            deletes.incrementAndGet();
            return removed;
        } catch (RuntimeException e) {
            recordError("delete", fingerprint, e);
            return false;
        }
    }

    @Override
    public final void clear() {
        try {
            removePrefix(QueryFingerprint.PREFIX);
            LOG.info("Response cache cleared");
        } catch (RuntimeException e) {
            recordError("clear", QueryFingerprint.PREFIX + "*", e);
        }
    }

    @Override
    public final long size() {
        try {
            return countKeys();
        } catch (RuntimeException e) {
            recordError("size", QueryFingerprint.PREFIX + "*", e);
            return -1;
        }
    }

    @Override
    public final CacheStats stats() {
        long h = hits.get();
        long m = misses.get();
        long total = h + m;
        double hitRate = total == 0 ? 0.0 : (h * 100.0) / total;
        return new CacheStats(h, m, sets.get(), deletes.get(), errors.get(), hitRate, total,
                fallback.size(), enabled, primaryInUse());
    }

    @Override
    public final void resetStats() {
        hits.set(0);
        misses.set(0);
        sets.set(0);
        deletes.set(0);
        errors.set(0);
    }

    /**
     * Writes, reads back and deletes a probe entry directly against the stores.
     * Probe traffic is not counted in hit/miss statistics.
     */
    @Override
    public final boolean healthCheck() {
        if (!enabled) {
            return true;
        }
        try {
            CachedAnswer probe = new CachedAnswer("ok", List.of(), Instant.now());
            writePayload(HEALTH_CHECK_KEY, CachedAnswerCodec.encode(probe), HEALTH_CHECK_TTL);
            boolean found = readPayload(HEALTH_CHECK_KEY).isPresent();
            removeKey(HEALTH_CHECK_KEY);
            return found && primaryHealthy();
        } catch (RuntimeException e) {
            LOG.error("Cache health check failed: {}", e.toString());
            return false;
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** True when a durable primary store sits in front of the fallback. */
    protected abstract boolean primaryInUse();

    /**
     * Probes the primary store on its own, since {@link #readPayload(String)} hides primary
     * outages behind the fallback. Local caches have no primary and report healthy.
     */
    protected boolean primaryHealthy() {
        return true;
    }

    protected abstract Optional<String> readPayload(String key);

    protected abstract void writePayload(String key, String payload, Duration ttl);

    protected abstract boolean removeKey(String key);

    protected abstract void removePrefix(String prefix);

    protected abstract long countKeys();

    /**
     * Counts and logs a store failure. Subclasses call this for failures they absorb
     * themselves, e.g. a primary outage answered from the fallback.
     */
    protected final void recordError(String operation, String key, RuntimeException e) {
        errors.incrementAndGet();
        LOG.error("Cache {} error: key={}, error={}", operation, key, e.toString());
    }
}
