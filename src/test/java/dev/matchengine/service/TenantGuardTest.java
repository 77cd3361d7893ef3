package dev.matchengine.service;

import dev.matchengine.exception.TenantMismatchException;
import dev.matchengine.metrics.MatchMetrics;
import dev.matchengine.model.Entity;
import dev.matchengine.model.EntityKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TenantGuardTest {

    @Mock
    private MatchMetrics metrics;

    private TenantGuard tenantGuard;

    @BeforeEach
    void setUp() {
        tenantGuard = new TenantGuard(metrics);
    }

    private Entity entity(String id, String tenantId, EntityKind kind) {
        return Entity.builder().id(id).tenantId(tenantId).kind(kind).build();
    }

    @Test
    @DisplayName("Should reject an anchor without tenant")
    void shouldRejectAnchorWithoutTenant() {
        assertThatThrownBy(() -> tenantGuard.requireTenant(entity("c1", " ", EntityKind.CANDIDATE)))
                .isInstanceOf(TenantMismatchException.class);
        verify(metrics).recordTenantRejections(1);
    }

    @Test
    @DisplayName("Should reject a pair across tenants")
    void shouldRejectCrossTenantPair() {
        assertThatThrownBy(() -> tenantGuard.requireSameTenant(
                entity("c1", "a", EntityKind.CANDIDATE), entity("j1", "b", EntityKind.JOB)))
                .isInstanceOf(TenantMismatchException.class);
    }

    @Test
    @DisplayName("Should accept a pair within one tenant")
    void shouldAcceptSameTenantPair() {
        assertThatCode(() -> tenantGuard.requireSameTenant(
                entity("c1", "a", EntityKind.CANDIDATE), entity("j1", "a", EntityKind.JOB)))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should drop pool members of other tenants and count them")
    void shouldFilterPool() {
        Entity anchor = entity("c1", "a", EntityKind.CANDIDATE);
        List<Entity> pool = List.of(
                entity("j1", "a", EntityKind.JOB),
                entity("j2", "b", EntityKind.JOB),
                entity("j3", null, EntityKind.JOB));

        List<Entity> allowed = tenantGuard.filterPool(anchor, pool);

        assertThat(allowed).extracting(Entity::getId).containsExactly("j1");
        verify(metrics).recordTenantRejections(2);
    }
}
