package dev.matchengine.metrics;

import dev.matchengine.cache.MatchQueryCache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prometheus metrics for ranking, cache and configuration operations.
 */
@Component
public class MatchMetrics {

    private static final String TAG_KIND = "anchor_kind";
    private final MeterRegistry registry;

    // Counters
    private final Counter pairsScoredCounter;
    private final Counter tenantRejectionsCounter;
    private final Counter cacheHitsCounter;
    private final Counter cacheMissesCounter;
    private final Counter weightUpdatesCounter;
    private final Counter weightRejectionsCounter;

    // Timers (per anchor kind)
    private final ConcurrentHashMap<String, Timer> rankTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger lastPoolSize = new AtomicInteger(0);
    private final AtomicLong weightVersion = new AtomicLong(0);

    public MatchMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.pairsScoredCounter = Counter.builder("match_engine_pairs_scored_total")
                .description("Total candidate/job pairs scored")
                .register(registry);

        this.tenantRejectionsCounter = Counter.builder("match_engine_tenant_rejections_total")
                .description("Pool members or pairs rejected for crossing tenants")
                .register(registry);

        this.cacheHitsCounter = Counter.builder("match_engine_cache_hits_total")
                .description("Rankings served from the query cache")
                .register(registry);

        this.cacheMissesCounter = Counter.builder("match_engine_cache_misses_total")
                .description("Rankings computed because the cache had no fresh entry")
                .register(registry);

        this.weightUpdatesCounter = Counter.builder("match_engine_weight_updates_total")
                .description("Weight configuration snapshots installed")
                .register(registry);

        this.weightRejectionsCounter = Counter.builder("match_engine_weight_rejections_total")
                .description("Weight updates rejected by validation")
                .register(registry);

        Gauge.builder("match_engine_last_pool_size", lastPoolSize, AtomicInteger::get)
                .description("Pool size of the last computed ranking")
                .register(registry);

        Gauge.builder("match_engine_weight_version", weightVersion, AtomicLong::get)
                .description("Version of the installed weight configuration")
                .register(registry);
    }

    /**
     * Expose size and eviction count of the query cache.
     */
    public void bindCache(MatchQueryCache cache) {
        Gauge.builder("match_engine_cache_size", cache, MatchQueryCache::size)
                .description("Entries held by the query cache")
                .register(registry);
        FunctionCounter.builder("match_engine_cache_evictions_total", cache, MatchQueryCache::evictionCount)
                .description("Entries evicted for capacity")
                .register(registry);
    }

    /**
     * Get or create a ranking timer for an anchor kind.
     */
    public Timer getRankTimer(String anchorKind) {
        return rankTimers.computeIfAbsent(anchorKind, kind ->
                Timer.builder("match_engine_rank_duration")
                        .description("Time to compute a ranking")
                        .tag(TAG_KIND, kind)
                        .register(registry)
        );
    }

    public void recordRankLatency(String anchorKind, Duration elapsed) {
        getRankTimer(anchorKind).record(elapsed);
    }

    public void recordPairsScored(int count) {
        pairsScoredCounter.increment(count);
    }

    public void recordTenantRejections(int count) {
        if (count > 0) {
            tenantRejectionsCounter.increment(count);
        }
    }

    public void recordCacheHit() {
        cacheHitsCounter.increment();
    }

    public void recordCacheMiss() {
        cacheMissesCounter.increment();
    }

    public void recordWeightUpdate(long version) {
        weightUpdatesCounter.increment();
        weightVersion.set(version);
    }

    public void recordWeightRejection() {
        weightRejectionsCounter.increment();
    }

    public void updateWeightVersion(long version) {
        weightVersion.set(version);
    }

    public void updateLastPoolSize(int size) {
        lastPoolSize.set(size);
    }
}
