package quest.gekko.pulse.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Dashboard read caches. Entries are evicted whenever a bucket is recomputed; the expiry
 * only bounds how long a read can outlive a change made outside this process.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    @Bean
    public Caffeine<Object, Object> caffeine() {
        return Caffeine.newBuilder().maximumSize(5_000).expireAfterWrite(Duration.ofMinutes(10));
    }

    @Bean
    public CacheManager cacheManager(final Caffeine<Object, Object> caffeine) {
        final CaffeineCacheManager cacheManager = new CaffeineCacheManager("aggregates", "alignment");
        cacheManager.setCaffeine(caffeine);
        return cacheManager;
    }
}
