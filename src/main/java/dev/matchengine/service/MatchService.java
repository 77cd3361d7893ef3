package dev.matchengine.service;

import dev.matchengine.cache.CacheKey;
import dev.matchengine.cache.MatchQueryCache;
import dev.matchengine.config.MatchingConfig;
import dev.matchengine.exception.EntityNotFoundException;
import dev.matchengine.metrics.MatchMetrics;
import dev.matchengine.model.CacheStrategy;
import dev.matchengine.model.Entity;
import dev.matchengine.model.EntityKind;
import dev.matchengine.model.MatchExplanation;
import dev.matchengine.model.MatchQuery;
import dev.matchengine.model.MatchResult;
import dev.matchengine.model.WeightConfiguration;
import dev.matchengine.model.WeightUpdate;
import dev.matchengine.repository.EntityRepository;
import dev.matchengine.repository.PoolFilter;
import dev.matchengine.scoring.CompositeScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Entry point of the matching engine: tenant guard, query cache, scoring and
 * explanations.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MatchService {

    private final EntityRepository entityRepository;
    private final TenantGuard tenantGuard;
    private final MatchRanker matchRanker;
    private final CompositeScorer compositeScorer;
    private final WeightConfigurationStore weightStore;
    private final MatchQueryCache matchQueryCache;
    private final ExplainabilityAssembler explainabilityAssembler;
    private final MatchMetrics metrics;
    private final MatchingConfig matchingConfig;

    /**
     * Look up an anchor by id and rank the opposite kind of the same tenant.
     */
    public Mono<List<MatchResult>> matchById(String tenantId, EntityKind kind, String anchorId, MatchQuery query) {
        return Mono.fromCallable(() -> entityRepository.findById(tenantId, kind, anchorId)
                        .orElseThrow(() -> new EntityNotFoundException(kind, anchorId)))
                .flatMap(anchor -> rank(anchor, loadPool(anchor), query));
    }

    /**
     * Rank a pool for an anchor using the current weight snapshot. The tenant
     * check runs before the cache is consulted.
     */
    public Mono<List<MatchResult>> rank(Entity anchor, List<Entity> pool, MatchQuery query) {
        return Mono.defer(() -> {
            tenantGuard.requireTenant(anchor);
            MatchQuery bounded = boundTopK(query);
            WeightConfiguration weights = weightStore.current();
            CacheKey key = CacheKey.of(anchor, bounded, weights.version());

            if (bounded.strategy() != CacheStrategy.OFF) {
                Optional<List<MatchResult>> cached = matchQueryCache.get(key, bounded.maxAge());
                if (cached.isPresent()) {
                    metrics.recordCacheHit();
                    log.debug("Cache hit for {}", key);
                    return Mono.just(cached.get());
                }
                metrics.recordCacheMiss();
            }

            return compute(anchor, pool, bounded, weights)
                    .doOnNext(results -> {
                        if (bounded.strategy() != CacheStrategy.OFF) {
                            matchQueryCache.put(key, results);
                        }
                    });
        });
    }

    /**
     * Compute a ranking and store it regardless of any cached entry.
     */
    public Mono<List<MatchResult>> refresh(Entity anchor, List<Entity> pool, MatchQuery query) {
        return Mono.defer(() -> {
            tenantGuard.requireTenant(anchor);
            MatchQuery bounded = boundTopK(query);
            WeightConfiguration weights = weightStore.current();
            CacheKey key = CacheKey.of(anchor, bounded, weights.version());
            return compute(anchor, pool, bounded, weights)
                    .doOnNext(results -> matchQueryCache.put(key, results));
        });
    }

    /**
     * True when the cache already holds a fresh ranking for this anchor and query.
     */
    public boolean isCached(Entity anchor, MatchQuery query) {
        tenantGuard.requireTenant(anchor);
        MatchQuery bounded = boundTopK(query);
        CacheKey key = CacheKey.of(anchor, bounded, weightStore.current().version());
        return matchQueryCache.containsFresh(key, bounded.maxAge());
    }

    /**
     * Same check by anchor id. A missing anchor is reported as not cached.
     */
    public boolean isCachedById(String tenantId, EntityKind kind, String anchorId, MatchQuery query) {
        if (query.strategy() == CacheStrategy.OFF) {
            return false;
        }
        return entityRepository.findById(tenantId, kind, anchorId)
                .map(anchor -> isCached(anchor, query))
                .orElse(false);
    }

    /**
     * Explain one pair with the current weights. Never cached.
     */
    public MatchExplanation explain(Entity anchor, Entity counterpart) {
        return explain(anchor, counterpart, weightStore.current());
    }

    public MatchExplanation explain(Entity anchor, Entity counterpart, WeightConfiguration weights) {
        tenantGuard.requireSameTenant(anchor, counterpart);
        if (anchor.getKind() != null && anchor.getKind() == counterpart.getKind()) {
            throw new IllegalArgumentException("Cannot explain two entities of the same kind");
        }
        MatchResult result = compositeScorer.score(anchor, counterpart, weights);
        metrics.recordPairsScored(1);
        return explainabilityAssembler.assemble(result, weights);
    }

    /**
     * Explain a candidate/job pair looked up inside one tenant.
     */
    public MatchExplanation explainById(String tenantId, String candidateId, String jobId) {
        Entity candidate = entityRepository.findById(tenantId, EntityKind.CANDIDATE, candidateId)
                .orElseThrow(() -> new EntityNotFoundException(EntityKind.CANDIDATE, candidateId));
        Entity job = entityRepository.findById(tenantId, EntityKind.JOB, jobId)
                .orElseThrow(() -> new EntityNotFoundException(EntityKind.JOB, jobId));
        return explain(candidate, job);
    }

    public WeightConfiguration currentWeights() {
        return weightStore.current();
    }

    public WeightConfiguration updateWeights(WeightUpdate update) {
        return weightStore.update(update);
    }

    public void clearCache() {
        matchQueryCache.clear();
    }

    List<Entity> loadPool(Entity anchor) {
        EntityKind poolKind = anchor.getKind() != null ? anchor.getKind().opposite() : EntityKind.JOB;
        return entityRepository.queryPool(anchor.getTenantId(), PoolFilter.of(poolKind, matchingConfig.getMaxPoolSize()));
    }

    private Mono<List<MatchResult>> compute(Entity anchor, List<Entity> pool, MatchQuery query,
                                            WeightConfiguration weights) {
        long started = System.nanoTime();
        List<Entity> bounded = pool;
        if (matchingConfig.getMaxPoolSize() > 0 && pool.size() > matchingConfig.getMaxPoolSize()) {
            log.warn("Pool of {} entities for '{}' truncated to {}", pool.size(), anchor.getId(),
                    matchingConfig.getMaxPoolSize());
            bounded = pool.subList(0, matchingConfig.getMaxPoolSize());
        }
        List<Entity> eligible = matchRanker.eligiblePool(anchor, bounded, query, weights);

        Flux<MatchResult> scored;
        if (eligible.size() > matchingConfig.getParallelThreshold()) {
            scored = Flux.fromIterable(eligible)
                    .parallel()
                    .runOn(Schedulers.parallel())
                    .map(member -> compositeScorer.score(anchor, member, weights))
                    .sequential();
        } else {
            scored = Flux.fromIterable(eligible)
                    .map(member -> compositeScorer.score(anchor, member, weights));
        }

        String kind = anchor.getKind() != null ? anchor.getKind().wireName() : "unknown";
        return scored
                .filter(result -> matchRanker.accepts(result, query))
                .collectList()
                .map(results -> matchRanker.selectTopK(results, query.topK()))
                .timeout(matchingConfig.getRankTimeout())
                .doOnSuccess(results -> {
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                    metrics.recordPairsScored(eligible.size());
                    metrics.updateLastPoolSize(eligible.size());
                    metrics.recordRankLatency(kind, elapsed);
                    log.info("Ranked {} '{}' against {} entities: {} results in {} ms",
                            kind, anchor.getId(), eligible.size(),
                            results != null ? results.size() : 0, elapsed.toMillis());
                });
    }

    private MatchQuery boundTopK(MatchQuery query) {
        int max = matchingConfig.getMaxTopK();
        if (max > 0 && query.topK() > max) {
            return query.toBuilder().topK(max).build();
        }
        return query;
    }
}
