package com.phillippitts.querybridge.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the response cache.
 *
 * @param enabled when false every lookup is a miss and every write a no-op
 * @param store {@code memory} (in-process only) or {@code redis} (Redis primary + in-process fallback)
 * @param ttlSeconds default entry time-to-live
 * @param fallbackCapacity size bound of the in-process store
 */
@ConfigurationProperties(prefix = "cache")
@Validated
public record CacheProperties(
        @DefaultValue("true")
        boolean enabled,

        @DefaultValue("memory")
        @NotNull(message = "Cache store must be set")
        StoreType store,

        @DefaultValue("3600")
        @Positive(message = "TTL must be positive")
        long ttlSeconds,

        @DefaultValue("100")
        @Positive(message = "Fallback capacity must be positive")
        int fallbackCapacity
) {
    public enum StoreType { MEMORY, REDIS }

    public static CacheProperties defaults() {
        return new CacheProperties(true, StoreType.MEMORY, 3600, 100);
    }
}
