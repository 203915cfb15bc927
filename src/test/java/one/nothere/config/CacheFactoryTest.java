package one.nothere.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import one.nothere.support.cache.CaffeineTtlCache;
import one.nothere.support.cache.NoOpTtlCache;
import one.nothere.support.cache.TtlCache;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class CacheFactoryTest {

    @Test
    void should_ReturnPassThrough_When_CachingDisabled() {
        TtlCache<String, String> cache = new CacheFactory().createCache("authority", 10, Duration.ofDays(7), false);

        assertThat(cache).isInstanceOf(NoOpTtlCache.class);
    }

    @Test
    void should_CreateCaffeineCache_AndRegisterMetrics() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        StaticListableBeanFactory beans = new StaticListableBeanFactory();
        beans.addBean("meterRegistry", registry);
        CacheFactory factory = new CacheFactory(beans.getBeanProvider(MeterRegistry.class));

        TtlCache<String, String> cache = factory.createCache("equity", 10, null, true);
        cache.put("a", "b");

        assertThat(cache).isInstanceOf(CaffeineTtlCache.class);
        assertThat(cache.getIfPresent("a")).contains("b");
        assertThat(registry.find("cache.size").tag("cache", "equity").gauge()).isNotNull();
    }
}
