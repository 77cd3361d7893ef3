package dev.matchengine.repository;

import dev.matchengine.model.EntityKind;

/**
 * Pool query sent to the ingestion side.
 *
 * @param kind  kind of entities wanted
 * @param city  optional canonical city constraint
 * @param limit maximum number of entities, 0 for no limit
 */
public record PoolFilter(EntityKind kind, String city, int limit) {

    public PoolFilter {
        if (kind == null) {
            throw new IllegalArgumentException("Pool kind is required");
        }
        if (limit < 0) {
            throw new IllegalArgumentException("Pool limit must not be negative");
        }
    }

    public static PoolFilter of(EntityKind kind, int limit) {
        return new PoolFilter(kind, null, limit);
    }
}
