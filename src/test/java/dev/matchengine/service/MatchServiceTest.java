package dev.matchengine.service;

import dev.matchengine.cache.MatchQueryCache;
import dev.matchengine.config.MatchingConfig;
import dev.matchengine.exception.EntityNotFoundException;
import dev.matchengine.exception.TenantMismatchException;
import dev.matchengine.metrics.MatchMetrics;
import dev.matchengine.model.CacheStrategy;
import dev.matchengine.model.Entity;
import dev.matchengine.model.EntityKind;
import dev.matchengine.model.MatchExplanation;
import dev.matchengine.model.MatchQuery;
import dev.matchengine.model.MatchResult;
import dev.matchengine.model.SkillRef;
import dev.matchengine.model.WeightUpdate;
import dev.matchengine.repository.InMemoryEntityRepository;
import dev.matchengine.scoring.CompositeScorer;
import dev.matchengine.scoring.EmbeddingSimilarityScorer;
import dev.matchengine.scoring.GeoDistanceScorer;
import dev.matchengine.scoring.SemanticSimilarityScorer;
import dev.matchengine.scoring.SkillScorer;
import dev.matchengine.scoring.TitleSimilarityScorer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchServiceTest {

    private MeterRegistry meterRegistry;
    private MatchingConfig matchingConfig;
    private MatchQueryCache cache;
    private InMemoryEntityRepository repository;
    private MatchService matchService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        MatchMetrics metrics = new MatchMetrics(meterRegistry);
        matchingConfig = new MatchingConfig();
        matchingConfig.setParallelThreshold(4);

        CompositeScorer compositeScorer = new CompositeScorer(new SkillScorer(), new TitleSimilarityScorer(),
                new SemanticSimilarityScorer(), new EmbeddingSimilarityScorer(), new GeoDistanceScorer());
        TenantGuard tenantGuard = new TenantGuard(metrics);
        cache = new MatchQueryCache(100, Duration.ofMinutes(15), Clock.systemUTC());
        metrics.bindCache(cache);
        repository = new InMemoryEntityRepository();

        matchService = new MatchService(
                repository,
                tenantGuard,
                new MatchRanker(compositeScorer, tenantGuard, matchingConfig),
                compositeScorer,
                new WeightConfigurationStore(matchingConfig, metrics),
                cache,
                new ExplainabilityAssembler(),
                metrics,
                matchingConfig);

        repository.add(candidate("c1", "t1"), EntityKind.CANDIDATE);
        repository.add(job("j1", "t1", "java", "spring"), EntityKind.JOB);
        repository.add(job("j2", "t1", "java", "sql", "aws"), EntityKind.JOB);
        repository.add(job("j9", "t2", "java", "spring"), EntityKind.JOB);
    }

    private static Entity candidate(String id, String tenantId) {
        return Entity.builder()
                .id(id)
                .tenantId(tenantId)
                .kind(EntityKind.CANDIDATE)
                .title("Java Developer")
                .skills(List.of(SkillRef.must("java"), SkillRef.needed("spring")))
                .build();
    }

    private static Entity job(String id, String tenantId, String mustSkill, String... neededSkills) {
        List<SkillRef> skills = new ArrayList<>();
        skills.add(SkillRef.must(mustSkill));
        for (String skill : neededSkills) {
            skills.add(SkillRef.needed(skill));
        }
        return Entity.builder()
                .id(id)
                .tenantId(tenantId)
                .kind(EntityKind.JOB)
                .title("Java Developer")
                .skills(skills)
                .build();
    }

    @Nested
    @DisplayName("Ranking")
    class RankingTests {

        @Test
        @DisplayName("Should rank the tenant's pool by id lookup")
        void shouldRankById() {
            StepVerifier.create(matchService.matchById("t1", EntityKind.CANDIDATE, "c1", MatchQuery.topK(5)))
                    .assertNext(results -> assertThat(results)
                            .extracting(MatchResult::counterpartId)
                            .containsExactly("j1", "j2"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should report an unknown or foreign anchor as not found")
        void shouldReportMissingAnchor() {
            StepVerifier.create(matchService.matchById("t2", EntityKind.CANDIDATE, "c1", MatchQuery.topK(5)))
                    .expectError(EntityNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should fail before scoring when the anchor has no tenant")
        void shouldRejectAnchorWithoutTenant() {
            Entity anchor = candidate("c-x", null);

            StepVerifier.create(matchService.rank(anchor, List.of(job("j1", "t1", "java")), MatchQuery.topK(5)))
                    .expectError(TenantMismatchException.class)
                    .verify();
            assertThat(cache.size()).isZero();
        }

        @Test
        @DisplayName("Should rank and cache an anchor that carries no kind")
        void shouldRankAnchorWithoutKind() {
            Entity anchor = Entity.builder()
                    .id("c-x")
                    .tenantId("t1")
                    .title("Java Developer")
                    .skills(List.of(SkillRef.must("java"), SkillRef.needed("spring")))
                    .build();
            MatchQuery query = MatchQuery.topK(5);

            StepVerifier.create(matchService.rank(anchor, List.of(job("j1", "t1", "java", "spring")), query))
                    .assertNext(results -> assertThat(results)
                            .extracting(MatchResult::counterpartId)
                            .containsExactly("j1"))
                    .verifyComplete();
            assertThat(matchService.isCached(anchor, query)).isTrue();
        }

        @Test
        @DisplayName("Should score large pools in parallel with the same ordering")
        void shouldRankLargePoolInParallel() {
            List<Entity> pool = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                pool.add(job(String.format("j%02d", i), "t1", "java", i % 2 == 0 ? "spring" : "sql"));
            }
            MatchQuery query = MatchQuery.builder().topK(10).strategy(CacheStrategy.OFF).build();

            StepVerifier.create(matchService.rank(candidate("c1", "t1"), pool, query))
                    .assertNext(results -> assertThat(results)
                            .hasSize(10)
                            .extracting(MatchResult::counterpartId)
                            .containsExactly("j00", "j02", "j04", "j06", "j08", "j10", "j12", "j14", "j16", "j18"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should cap top-K at the configured maximum")
        void shouldCapTopK() {
            matchingConfig.setMaxTopK(1);

            StepVerifier.create(matchService.matchById("t1", EntityKind.CANDIDATE, "c1", MatchQuery.topK(50)))
                    .assertNext(results -> assertThat(results).hasSize(1))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Caching")
    class CachingTests {

        @Test
        @DisplayName("Should serve an identical query from the cache")
        void shouldServeRepeatedQueryFromCache() {
            AtomicReference<List<MatchResult>> first = new AtomicReference<>();
            StepVerifier.create(matchService.matchById("t1", EntityKind.CANDIDATE, "c1", MatchQuery.topK(5)))
                    .consumeNextWith(first::set)
                    .verifyComplete();

            StepVerifier.create(matchService.matchById("t1", EntityKind.CANDIDATE, "c1", MatchQuery.topK(5)))
                    .assertNext(second -> assertThat(second).isEqualTo(first.get()))
                    .verifyComplete();

            assertThat(meterRegistry.counter("match_engine_cache_hits_total").count()).isEqualTo(1.0);
            assertThat(meterRegistry.counter("match_engine_cache_misses_total").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should recompute after a weight update")
        void shouldRecomputeAfterWeightUpdate() {
            matchService.matchById("t1", EntityKind.CANDIDATE, "c1", MatchQuery.topK(5)).block();
            matchService.updateWeights(WeightUpdate.builder().titleWeight(0.0).build());

            StepVerifier.create(matchService.matchById("t1", EntityKind.CANDIDATE, "c1", MatchQuery.topK(5)))
                    .assertNext(results -> assertThat(results)
                            .allSatisfy(r -> assertThat(r.weightVersion()).isEqualTo(2)))
                    .verifyComplete();
            assertThat(meterRegistry.counter("match_engine_cache_hits_total").count()).isZero();
        }

        @Test
        @DisplayName("Should bypass the cache with strategy off")
        void shouldBypassCacheWhenOff() {
            MatchQuery off = MatchQuery.builder().topK(5).strategy(CacheStrategy.OFF).build();

            matchService.matchById("t1", EntityKind.CANDIDATE, "c1", off).block();

            assertThat(cache.size()).isZero();
            assertThat(matchService.isCachedById("t1", EntityKind.CANDIDATE, "c1", MatchQuery.topK(5))).isFalse();
        }

        @Test
        @DisplayName("Should report cached rankings and forget them on clear")
        void shouldTrackCachedRankings() {
            matchService.matchById("t1", EntityKind.CANDIDATE, "c1", MatchQuery.topK(5)).block();
            assertThat(matchService.isCachedById("t1", EntityKind.CANDIDATE, "c1", MatchQuery.topK(5))).isTrue();

            matchService.clearCache();

            assertThat(matchService.isCachedById("t1", EntityKind.CANDIDATE, "c1", MatchQuery.topK(5))).isFalse();
        }
    }

    @Nested
    @DisplayName("Explain")
    class ExplainTests {

        @Test
        @DisplayName("Should explain a pair with the current weights")
        void shouldExplainPair() {
            MatchExplanation explanation = matchService.explainById("t1", "c1", "j1");

            assertThat(explanation.candidateId()).isEqualTo("c1");
            assertThat(explanation.jobId()).isEqualTo("j1");
            assertThat(explanation.weightsVersion()).isEqualTo(1);
            assertThat(explanation.weights()).isEqualTo(matchService.currentWeights());
            assertThat(cache.size()).isZero();
        }

        @Test
        @DisplayName("Should reject a pair across tenants")
        void shouldRejectCrossTenantPair() {
            Entity foreignJob = job("j9", "t2", "java");

            assertThatThrownBy(() -> matchService.explain(candidate("c1", "t1"), foreignJob))
                    .isInstanceOf(TenantMismatchException.class);
        }

        @Test
        @DisplayName("Should treat a job of another tenant as missing")
        void shouldNotFindForeignJob() {
            assertThatThrownBy(() -> matchService.explainById("t1", "c1", "j9"))
                    .isInstanceOf(EntityNotFoundException.class);
        }

        @Test
        @DisplayName("Should reject two entities of the same kind")
        void shouldRejectSameKind() {
            assertThatThrownBy(() -> matchService.explain(candidate("c1", "t1"), candidate("c2", "t1")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
