package dev.matchengine.repository;

import dev.matchengine.model.Entity;
import dev.matchengine.model.EntityKind;

import java.util.List;
import java.util.Optional;

/**
 * Read access to skill-annotated entities owned by the ingestion side.
 * Every lookup is scoped to one tenant.
 */
public interface EntityRepository {

    Optional<Entity> findById(String tenantId, EntityKind kind, String id);

    List<Entity> queryPool(String tenantId, PoolFilter filter);
}
