package quest.gekko.dataflag.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@EnableCaching
public class CacheConfig {
    public static final String REVISIONS = "revisions";
    public static final String FLAG_TYPES = "flagTypes";
    public static final String OPINION_TYPES = "opinionTypes";
    public static final String CATEGORY_TYPES = "categoryTypes";

    @Bean
    public Caffeine<Object, Object> caffeine() {
        return Caffeine.newBuilder().maximumSize(1_000).expireAfterWrite(Duration.ofMinutes(15));
    }

    @Bean
    public CacheManager cacheManager(final Caffeine<Object, Object> caffeine) {
        final CaffeineCacheManager cacheManager = new CaffeineCacheManager(REVISIONS, FLAG_TYPES, OPINION_TYPES, CATEGORY_TYPES);
        cacheManager.setCaffeine(caffeine);
        return cacheManager;
    }
}
