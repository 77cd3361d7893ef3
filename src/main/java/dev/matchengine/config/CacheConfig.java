package dev.matchengine.config;

import dev.matchengine.cache.MatchQueryCache;
import dev.matchengine.metrics.MatchMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the query cache with its configured capacity and TTL.
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MatchQueryCache matchQueryCache(MatchingConfig matchingConfig, MatchMetrics metrics, Clock clock) {
        MatchingConfig.Cache settings = matchingConfig.getCache();
        MatchQueryCache cache = new MatchQueryCache(settings.getMaxEntries(), settings.getTtl(), clock);
        metrics.bindCache(cache);
        log.info("Match cache ready (capacity: {}, ttl: {})", settings.getMaxEntries(), settings.getTtl());
        return cache;
    }
}
