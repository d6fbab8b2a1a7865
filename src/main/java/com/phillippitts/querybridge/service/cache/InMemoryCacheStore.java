package com.phillippitts.querybridge.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Bounded in-process store on Caffeine: size-based eviction plus a per-entry time-to-live.
 *
 * <p>Maintenance runs on the calling thread, so eviction and expiry are visible as soon as
 * the call that caused them returns.
 */
public final class InMemoryCacheStore implements CacheStore {

    private record Entry(String value, long ttlNanos) {
    }

    private static final class PerEntryTtl implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    private final int capacity;
    private final Cache<String, Entry> entries;

    public InMemoryCacheStore(int capacity) {
        this(capacity, Clock.systemUTC());
    }

    public InMemoryCacheStore(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        Objects.requireNonNull(clock, "clock");
        this.capacity = capacity;
        this.entries = Caffeine.newBuilder()
                .maximumSize(capacity)
                .expireAfter(new PerEntryTtl())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.getIfPresent(key)).map(Entry::value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        entries.put(key, new Entry(value, Math.max(0, ttl.toNanos())));
    }

    @Override
    public boolean delete(String key) {
        return entries.asMap().remove(key) != null;
    }

    @Override
    public Set<String> keys(String prefix) {
        entries.cleanUp();
        Set<String> result = new LinkedHashSet<>();
        for (String key : entries.asMap().keySet()) {
            if (key.startsWith(prefix)) {
                result.add(key);
            }
        }
        return result;
    }

    @Override
    public String name() {
        return "memory";
    }

    /** Number of live entries after pending evictions and expiries are applied. */
    public int size() {
        entries.cleanUp();
        return Math.toIntExact(entries.estimatedSize());
    }

    public int capacity() {
        return capacity;
    }
}
