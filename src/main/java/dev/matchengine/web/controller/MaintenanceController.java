package dev.matchengine.web.controller;

import dev.matchengine.model.MatchQuery;
import dev.matchengine.service.MatchBackfillService;
import dev.matchengine.web.dto.BackfillRequest;
import dev.matchengine.web.dto.BackfillResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;

import static dev.matchengine.web.controller.TenantHeaders.TENANT_HEADER;

@RestController
@RequestMapping("/maintenance")
@RequiredArgsConstructor
@Slf4j
public class MaintenanceController {

    private final MatchBackfillService backfillService;

    /**
     * Compute and cache rankings for every anchor of one kind in the tenant.
     * Safe to run repeatedly.
     */
    @PostMapping("/matches/backfill")
    public Mono<ResponseEntity<BackfillResponse>> backfill(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestBody(required = false) BackfillRequest request) {
        return Mono.defer(() -> {
            String tenant = TenantHeaders.require(tenantId);
            BackfillRequest body = request != null ? request : new BackfillRequest();
            MatchQuery query = MatchQuery.builder()
                    .topK(body.getK())
                    .cityFilter(body.isCityFilter())
                    .maxAge(body.getMaxAge() != null ? Duration.ofSeconds(body.getMaxAge()) : null)
                    .build();
            log.info("[API] Backfill requested for tenant '{}': {}", tenant, body);
            return backfillService.backfill(tenant, body.getAnchorKind(), query, body.getLimit(), body.isForce())
                    .map(summary -> ResponseEntity.ok(BackfillResponse.ok(summary)));
        });
    }
}
