package dev.matchengine.metrics;

import dev.matchengine.cache.CacheKey;
import dev.matchengine.cache.MatchQueryCache;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MatchMetricsTest {

    private MeterRegistry meterRegistry;
    private MatchMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new MatchMetrics(meterRegistry);
    }

    @Nested
    @DisplayName("Counters")
    class CounterTests {

        @Test
        @DisplayName("Should accumulate pairs scored")
        void shouldAccumulatePairsScored() {
            metrics.recordPairsScored(10);
            metrics.recordPairsScored(5);

            assertThat(meterRegistry.counter("match_engine_pairs_scored_total").count()).isEqualTo(15.0);
        }

        @Test
        @DisplayName("Should ignore zero tenant rejections")
        void shouldIgnoreZeroRejections() {
            metrics.recordTenantRejections(0);
            metrics.recordTenantRejections(2);

            assertThat(meterRegistry.counter("match_engine_tenant_rejections_total").count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should record cache hits and misses")
        void shouldRecordCacheLookups() {
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordCacheMiss();

            assertThat(meterRegistry.counter("match_engine_cache_hits_total").count()).isEqualTo(1.0);
            assertThat(meterRegistry.counter("match_engine_cache_misses_total").count()).isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("Timers")
    class TimerTests {

        @Test
        @DisplayName("Should keep one timer per anchor kind")
        void shouldReuseTimerPerKind() {
            metrics.recordRankLatency("candidate", Duration.ofMillis(12));

            assertThat(metrics.getRankTimer("candidate")).isSameAs(metrics.getRankTimer("candidate"));
            assertThat(metrics.getRankTimer("candidate")).isNotSameAs(metrics.getRankTimer("job"));
            assertThat(metrics.getRankTimer("candidate").count()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Gauges")
    class GaugeTests {

        @Test
        @DisplayName("Should expose weight version and pool size")
        void shouldExposeGauges() {
            metrics.recordWeightUpdate(3);
            metrics.updateLastPoolSize(42);

            assertThat(meterRegistry.get("match_engine_weight_version").gauge().value()).isEqualTo(3.0);
            assertThat(meterRegistry.get("match_engine_last_pool_size").gauge().value()).isEqualTo(42.0);
            assertThat(meterRegistry.counter("match_engine_weight_updates_total").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should follow cache size and evictions")
        void shouldBindCache() {
            MatchQueryCache cache = new MatchQueryCache(1, Duration.ZERO, Clock.systemUTC());
            metrics.bindCache(cache);

            cache.put(new CacheKey("t", "a", 1), List.of());
            cache.put(new CacheKey("t", "b", 1), List.of());

            assertThat(meterRegistry.get("match_engine_cache_size").gauge().value()).isEqualTo(1.0);
            assertThat(meterRegistry.get("match_engine_cache_evictions_total").functionCounter().count())
                    .isEqualTo(1.0);
        }
    }
}
