package dev.matchengine.model;

import lombok.Builder;

import java.time.Duration;
import java.util.Locale;

/**
 * Options of one ranking request.
 *
 * @param topK          number of results to return
 * @param cityFilter    skip counterparts in another city (strict only while the distance weight is zero)
 * @param maxDistanceKm skip counterparts further away than this, when the distance is known
 * @param strategy      cache behaviour
 * @param maxAge        freshness bound overriding the cache TTL for this request
 */
@Builder(toBuilder = true)
public record MatchQuery(
        int topK,
        boolean cityFilter,
        Double maxDistanceKm,
        CacheStrategy strategy,
        Duration maxAge) {

    public MatchQuery {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1, got " + topK);
        }
        if (maxDistanceKm != null && (maxDistanceKm.isNaN() || maxDistanceKm <= 0)) {
            maxDistanceKm = null;
        }
        if (maxAge != null && maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must not be negative");
        }
        strategy = strategy != null ? strategy : CacheStrategy.HYBRID;
    }

    public static MatchQuery topK(int topK) {
        return MatchQuery.builder().topK(topK).build();
    }

    /**
     * Canonical form of the parameters that change the ranking, used in cache keys.
     * Strategy and maxAge only change how the cache is consulted and are left out.
     * An anchor without a kind is written as {@code any}. The distance bound is
     * kept exact since any difference can change which counterparts pass.
     */
    public String signature(EntityKind anchorKind, String anchorId) {
        return String.format(Locale.ROOT, "%s:%s|k=%d|city=%s|maxKm=%s",
                anchorKind != null ? anchorKind.wireName() : "any", anchorId, topK, cityFilter,
                maxDistanceKm != null ? Double.toString(maxDistanceKm) : "-");
    }
}
