package one.nothere.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import java.time.Duration;
import one.nothere.support.cache.CaffeineTtlCache;
import one.nothere.support.cache.NoOpTtlCache;
import one.nothere.support.cache.TtlCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Factory for creating caches with consistent configuration.
 * Centralizes cache creation so scorers and the robots cache share one policy.
 */
@Component
public class CacheFactory {

    private static final Logger log = LoggerFactory.getLogger(CacheFactory.class);

    private final MeterRegistry meterRegistry;

    @Autowired
    public CacheFactory(ObjectProvider<MeterRegistry> meterRegistry) {
        this.meterRegistry = meterRegistry.getIfAvailable();
    }

    public CacheFactory() {
        this.meterRegistry = null;
    }

    /**
     * Create a cache with specified configuration.
     *
     * @param ttl expiry after write; null keeps entries until evicted by size
     */
    public <K, V> TtlCache<K, V> createCache(String name, int maxSize, Duration ttl) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
            .maximumSize(maxSize)
            .recordStats();
        if (ttl != null) {
            builder.expireAfterWrite(ttl);
        }
        Cache<K, V> cache = builder.build();
        if (meterRegistry != null) {
            CaffeineCacheMetrics.monitor(meterRegistry, cache, name);
        }
        log.debug("Created cache '{}' (maxSize={}, ttl={})", name, maxSize, ttl == null ? "none" : ttl);
        return new CaffeineTtlCache<>(name, cache);
    }

    /**
     * Create a cache, or a pass-through when caching is switched off.
     */
    public <K, V> TtlCache<K, V> createCache(String name, int maxSize, Duration ttl, boolean enabled) {
        return enabled ? createCache(name, maxSize, ttl) : new NoOpTtlCache<>();
    }
}
