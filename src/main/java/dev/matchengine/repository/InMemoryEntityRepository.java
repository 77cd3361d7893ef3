package dev.matchengine.repository;

import dev.matchengine.model.Entity;
import dev.matchengine.model.EntityKind;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entity store held in memory, keyed by tenant, kind and id.
 */
@Slf4j
public class InMemoryEntityRepository implements EntityRepository {

    private final Map<String, Map<EntityKind, Map<String, Entity>>> byTenant = new ConcurrentHashMap<>();

    public InMemoryEntityRepository() {
    }

    public InMemoryEntityRepository(EntityDocument document) {
        document.getCandidates().forEach(entity -> add(entity, EntityKind.CANDIDATE));
        document.getJobs().forEach(entity -> add(entity, EntityKind.JOB));
    }

    /**
     * Store an entity. The list it came from decides the kind when the entity carries none.
     */
    public void add(Entity entity, EntityKind defaultKind) {
        if (entity == null || entity.getId() == null || entity.getId().isBlank()) {
            log.warn("Skipping entity without id");
            return;
        }
        if (entity.getTenantId() == null || entity.getTenantId().isBlank()) {
            log.warn("Skipping entity '{}' without tenant", entity.getId());
            return;
        }
        if (entity.getKind() == null) {
            entity.setKind(defaultKind);
        }
        byTenant.computeIfAbsent(entity.getTenantId(), t -> new ConcurrentHashMap<>())
                .computeIfAbsent(entity.getKind(), k -> Collections.synchronizedMap(new LinkedHashMap<>()))
                .put(entity.getId(), entity);
    }

    @Override
    public Optional<Entity> findById(String tenantId, EntityKind kind, String id) {
        if (tenantId == null || kind == null || id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(kinds(tenantId).getOrDefault(kind, Map.of()).get(id));
    }

    @Override
    public List<Entity> queryPool(String tenantId, PoolFilter filter) {
        if (tenantId == null) {
            return List.of();
        }
        Map<String, Entity> entities = kinds(tenantId).getOrDefault(filter.kind(), Map.of());
        List<Entity> snapshot;
        synchronized (entities) {
            snapshot = List.copyOf(entities.values());
        }
        return snapshot.stream()
                .filter(entity -> filter.city() == null || filter.city().equalsIgnoreCase(entity.getCity()))
                .limit(filter.limit() > 0 ? filter.limit() : Long.MAX_VALUE)
                .toList();
    }

    public int size() {
        return byTenant.values().stream()
                .flatMap(kinds -> kinds.values().stream())
                .mapToInt(Map::size)
                .sum();
    }

    private Map<EntityKind, Map<String, Entity>> kinds(String tenantId) {
        return Objects.requireNonNullElseGet(byTenant.get(tenantId), () -> new EnumMap<>(EntityKind.class));
    }
}
