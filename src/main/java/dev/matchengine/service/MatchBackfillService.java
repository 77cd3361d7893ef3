package dev.matchengine.service;

import dev.matchengine.model.BackfillSummary;
import dev.matchengine.model.Entity;
import dev.matchengine.model.EntityKind;
import dev.matchengine.model.MatchQuery;
import dev.matchengine.repository.EntityRepository;
import dev.matchengine.repository.PoolFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Warms the query cache for every anchor of one kind in a tenant.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MatchBackfillService {

    private enum Outcome { COMPUTED, SKIPPED, ERROR }

    private final EntityRepository entityRepository;
    private final MatchService matchService;

    /**
     * Rank each anchor and store the result. Anchors with a fresh cache entry
     * are skipped unless {@code force} is set. A failing anchor is counted and
     * the run goes on.
     *
     * @param limit maximum number of anchors, null for all
     */
    public Mono<BackfillSummary> backfill(String tenantId, EntityKind anchorKind, MatchQuery query,
                                          Integer limit, boolean force) {
        if (tenantId == null || tenantId.isBlank()) {
            return Mono.error(new IllegalArgumentException("Backfill requires a tenant id"));
        }
        if (limit != null && limit < 0) {
            return Mono.error(new IllegalArgumentException("Backfill limit must not be negative"));
        }

        return Mono.fromCallable(() -> entityRepository.queryPool(tenantId,
                        PoolFilter.of(anchorKind, limit != null ? limit : 0)))
                .flatMap(anchors -> {
                    log.info("Backfill of {} {} anchors for tenant '{}' (force={})",
                            anchors.size(), anchorKind.wireName(), tenantId, force);
                    return Flux.fromIterable(anchors)
                            .concatMap(anchor -> process(anchor, query, force))
                            .collectList()
                            .map(outcomes -> summarize(anchors.size(), outcomes));
                })
                .doOnNext(summary -> log.info("Backfill for tenant '{}' finished: {}", tenantId, summary));
    }

    private Mono<Outcome> process(Entity anchor, MatchQuery query, boolean force) {
        return Mono.defer(() -> {
                    if (!force && matchService.isCached(anchor, query)) {
                        log.debug("Backfill skipped '{}': fresh cache entry", anchor.getId());
                        return Mono.just(Outcome.SKIPPED);
                    }
                    return matchService.refresh(anchor, matchService.loadPool(anchor), query)
                            .thenReturn(Outcome.COMPUTED);
                })
                .onErrorResume(e -> {
                    log.error("Backfill failed for '{}': {}", anchor.getId(), e.getMessage(), e);
                    return Mono.just(Outcome.ERROR);
                });
    }

    private static BackfillSummary summarize(int processed, List<Outcome> outcomes) {
        int computed = 0;
        int skipped = 0;
        int errors = 0;
        for (Outcome outcome : outcomes) {
            switch (outcome) {
                case COMPUTED -> computed++;
                case SKIPPED -> skipped++;
                case ERROR -> errors++;
            }
        }
        return new BackfillSummary(processed, computed, skipped, errors);
    }
}
