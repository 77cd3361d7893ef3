package dev.matchengine.service;

import dev.matchengine.config.MatchingConfig;
import dev.matchengine.model.Entity;
import dev.matchengine.model.MatchQuery;
import dev.matchengine.model.MatchResult;
import dev.matchengine.model.WeightConfiguration;
import dev.matchengine.scoring.CompositeScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Turns an anchor and a pool into an ordered top-K list.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MatchRanker {

    private final CompositeScorer compositeScorer;
    private final TenantGuard tenantGuard;
    private final MatchingConfig matchingConfig;

    /**
     * Rank a pool against an explicit weight snapshot, without cache or filters.
     */
    public List<MatchResult> rank(Entity anchor, List<Entity> pool, int topK, WeightConfiguration weights) {
        return rank(anchor, pool, MatchQuery.topK(topK), weights);
    }

    /**
     * Sequential ranking: tenant guard, pool filters, scoring, ordering.
     */
    public List<MatchResult> rank(Entity anchor, List<Entity> pool, MatchQuery query, WeightConfiguration weights) {
        List<MatchResult> scored = eligiblePool(anchor, pool, query, weights).stream()
                .map(member -> compositeScorer.score(anchor, member, weights))
                .filter(result -> accepts(result, query))
                .toList();
        return selectTopK(scored, query.topK());
    }

    /**
     * Members that may be scored against the anchor: same tenant, opposite
     * kind, not the anchor itself, and passing the city filter.
     */
    public List<Entity> eligiblePool(Entity anchor, List<Entity> pool, MatchQuery query, WeightConfiguration weights) {
        List<Entity> sameTenant = tenantGuard.filterPool(anchor, pool);
        return sameTenant.stream()
                .filter(member -> member.getKind() == null || anchor.getKind() == null
                        || member.getKind() != anchor.getKind())
                .filter(member -> !Objects.equals(member.getId(), anchor.getId()))
                .filter(member -> passesCityFilter(anchor, member, query, weights))
                .toList();
    }

    /**
     * Post-scoring filters: non-zero score and the distance bound.
     */
    public boolean accepts(MatchResult result, MatchQuery query) {
        if (result.score() <= 0.0) {
            return false;
        }
        Double maxKm = query.maxDistanceKm();
        Double km = result.breakdown() != null ? result.breakdown().distanceKm() : null;
        return maxKm == null || km == null || km <= maxKm;
    }

    /**
     * Order by score descending, then by counterpart id ascending.
     * <p>
     * Scores are compared on a grid of width {@code tie-epsilon}: two scores in
     * the same cell {@code [n*eps, (n+1)*eps)} count as tied. Two scores less than
     * epsilon apart but on either side of a cell edge are still ordered by score.
     * A pairwise "closer than epsilon" test would not be transitive and could
     * break the sort.
     */
    public List<MatchResult> selectTopK(Collection<MatchResult> scored, int topK) {
        double epsilon = matchingConfig.getTieEpsilon();
        Comparator<MatchResult> byScore = epsilon > 0
                ? Comparator.comparingLong((MatchResult r) -> (long) Math.floor(r.score() / epsilon))
                : Comparator.comparingDouble(MatchResult::score);
        Comparator<MatchResult> order = byScore.reversed()
                .thenComparing(MatchResult::tieBreakKey, Comparator.nullsLast(Comparator.naturalOrder()));
        return scored.stream()
                .sorted(order)
                .limit(topK)
                .toList();
    }

    private boolean passesCityFilter(Entity anchor, Entity member, MatchQuery query, WeightConfiguration weights) {
        if (!query.cityFilter()) {
            return true;
        }
        String anchorCity = anchor.getCity();
        String memberCity = member.getCity();
        if (anchorCity == null || memberCity == null || anchorCity.equalsIgnoreCase(memberCity)) {
            return true;
        }
        // With distance scoring active the decay handles other cities
        if (weights.distanceWeight() > 0) {
            return true;
        }
        log.debug("City filter skipped '{}' ({} != {})", member.getId(), memberCity, anchorCity);
        return false;
    }
}
