package dev.matchengine.service;

import dev.matchengine.exception.TenantMismatchException;
import dev.matchengine.metrics.MatchMetrics;
import dev.matchengine.model.Entity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Tenant boundary checked before any scoring, caching or explanation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TenantGuard {

    private final MatchMetrics metrics;

    /**
     * Reject an anchor whose tenant cannot be resolved.
     */
    public void requireTenant(Entity anchor) {
        if (anchor == null || isBlank(anchor.getTenantId())) {
            metrics.recordTenantRejections(1);
            throw new TenantMismatchException("Anchor has no tenant");
        }
    }

    /**
     * Reject a pair whose tenants differ.
     */
    public void requireSameTenant(Entity anchor, Entity counterpart) {
        requireTenant(anchor);
        if (counterpart == null || !anchor.getTenantId().equals(counterpart.getTenantId())) {
            metrics.recordTenantRejections(1);
            throw new TenantMismatchException("Pair crosses tenants");
        }
    }

    /**
     * Drop pool members that belong to another tenant than the anchor.
     */
    public List<Entity> filterPool(Entity anchor, List<Entity> pool) {
        requireTenant(anchor);
        String tenantId = anchor.getTenantId();
        List<Entity> allowed = pool.stream()
                .filter(member -> member != null && tenantId.equals(member.getTenantId()))
                .toList();

        int rejected = pool.size() - allowed.size();
        if (rejected > 0) {
            log.debug("Dropped {} pool members outside tenant of anchor '{}'", rejected, anchor.getId());
            metrics.recordTenantRejections(rejected);
        }
        return allowed;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
