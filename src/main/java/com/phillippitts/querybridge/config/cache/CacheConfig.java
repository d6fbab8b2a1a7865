package com.phillippitts.querybridge.config.cache;

import com.phillippitts.querybridge.config.properties.CacheProperties;
import com.phillippitts.querybridge.service.cache.InMemoryCacheStore;
import com.phillippitts.querybridge.service.cache.LocalResponseCache;
import com.phillippitts.querybridge.service.cache.RedisCacheStore;
import com.phillippitts.querybridge.service.cache.ResponseCache;
import com.phillippitts.querybridge.service.cache.TieredResponseCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Selects the response cache implementation from {@code cache.store}.
 *
 * <ul>
 *   <li>{@code memory} (default): {@link LocalResponseCache}</li>
 *   <li>{@code redis}: {@link TieredResponseCache} with a {@link RedisCacheStore} primary;
 *       connection settings come from {@code spring.data.redis.*}</li>
 * </ul>
 */
@Configuration
public class CacheConfig {

    private static final Logger LOG = LogManager.getLogger(CacheConfig.class);

    @Bean
    public ResponseCache responseCache(CacheProperties props, ObjectProvider<StringRedisTemplate> redisTemplate) {
        InMemoryCacheStore fallback = new InMemoryCacheStore(props.fallbackCapacity());
        Duration ttl = Duration.ofSeconds(props.ttlSeconds());

        if (props.store() == CacheProperties.StoreType.REDIS) {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template != null) {
                LOG.info("Response cache: redis primary + in-memory fallback (enabled={}, ttlSeconds={})",
                        props.enabled(), props.ttlSeconds());
                return new TieredResponseCache(props.enabled(), ttl, new RedisCacheStore(template), fallback);
            }
            LOG.warn("cache.store=redis but no Redis template is available; running in memory-only mode");
        }
        LOG.info("Response cache: in-memory (enabled={}, ttlSeconds={}, capacity={})",
                props.enabled(), props.ttlSeconds(), props.fallbackCapacity());
        return new LocalResponseCache(props.enabled(), ttl, fallback);
    }
}
