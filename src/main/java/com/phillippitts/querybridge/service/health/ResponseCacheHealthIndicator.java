package com.phillippitts.querybridge.service.health;

import com.phillippitts.querybridge.service.cache.CacheStats;
import com.phillippitts.querybridge.service.cache.ResponseCache;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the response cache.
 *
 * <p>A failed probe is reported as DEGRADED rather than DOWN: the cache is advisory and
 * queries still succeed without it.
 */
@Component("responseCacheHealthIndicator")
public class ResponseCacheHealthIndicator implements HealthIndicator {

    private final ResponseCache cache;

    public ResponseCacheHealthIndicator(ResponseCache cache) {
        this.cache = cache;
    }

    @Override
    public Health health() {
        CacheStats stats = cache.stats();
        Health.Builder builder = cache.healthCheck() ? Health.up() : Health.status("DEGRADED");
        return builder
                .withDetail("enabled", stats.enabled())
                .withDetail("primaryInUse", stats.primaryInUse())
                .withDetail("fallbackSize", stats.fallbackSize())
                .withDetail("hitRate", String.format("%.2f%%", stats.hitRate()))
                .withDetail("errors", stats.errors())
                .build();
    }
}
