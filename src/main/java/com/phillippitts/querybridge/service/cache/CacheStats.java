package com.phillippitts.querybridge.service.cache;

/**
 * Snapshot of response cache statistics.
 *
 * @param hits lookups answered from any store
 * @param misses lookups that found nothing
 * @param sets successful writes
 * @param deletes explicit deletions
 * @param errors store failures downgraded to miss/no-op
 * @param hitRate hits as a percentage of lookups (0-100)
 * @param total lookups
 * @param fallbackSize entries held in the in-process store
 * @param enabled whether caching is enabled
 * @param primaryInUse whether a durable primary store is configured
 */
public record CacheStats(
        long hits,
        long misses,
        long sets,
        long deletes,
        long errors,
        double hitRate,
        long total,
        int fallbackSize,
        boolean enabled,
        boolean primaryInUse
) {
}
