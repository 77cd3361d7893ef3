package dev.matchengine.cache;

import dev.matchengine.model.Entity;
import dev.matchengine.model.MatchQuery;

/**
 * Cache key of a ranking. Tenant and weight version are always part of it, so
 * an entry can never be served to another tenant or after a weight change.
 */
public record CacheKey(String tenantId, String querySignature, long weightVersion) {

    public CacheKey {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Cache key requires a tenant");
        }
    }

    public static CacheKey of(Entity anchor, MatchQuery query, long weightVersion) {
        return new CacheKey(anchor.getTenantId(), query.signature(anchor.getKind(), anchor.getId()), weightVersion);
    }
}
