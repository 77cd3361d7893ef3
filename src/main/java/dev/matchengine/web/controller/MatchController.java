package dev.matchengine.web.controller;

import dev.matchengine.config.MatchingConfig;
import dev.matchengine.model.CacheStrategy;
import dev.matchengine.model.EntityKind;
import dev.matchengine.model.MatchExplanation;
import dev.matchengine.model.MatchQuery;
import dev.matchengine.service.ExplainabilityAssembler;
import dev.matchengine.service.MatchService;
import dev.matchengine.web.dto.MatchListResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

import static dev.matchengine.web.controller.TenantHeaders.TENANT_HEADER;

/**
 * Ranking and explanation endpoints. The tenant always comes from the request header.
 */
@RestController
@RequestMapping("/match")
@RequiredArgsConstructor
@Slf4j
public class MatchController {

    private final MatchService matchService;
    private final ExplainabilityAssembler explainabilityAssembler;
    private final MatchingConfig matchingConfig;

    @GetMapping("/candidate/{id}")
    public Mono<ResponseEntity<MatchListResponse>> matchCandidate(
            @PathVariable("id") String id,
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestParam(value = "k", required = false) Integer k,
            @RequestParam(value = "city_filter", defaultValue = "true") boolean cityFilter,
            @RequestParam(value = "max_distance_km", required = false) Double maxDistanceKm,
            @RequestParam(value = "strategy", required = false) String strategy,
            @RequestParam(value = "max_age", required = false) Long maxAge) {
        return match(EntityKind.CANDIDATE, id, tenantId, k, cityFilter, maxDistanceKm, strategy, maxAge);
    }

    @GetMapping("/job/{id}")
    public Mono<ResponseEntity<MatchListResponse>> matchJob(
            @PathVariable("id") String id,
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId,
            @RequestParam(value = "k", required = false) Integer k,
            @RequestParam(value = "city_filter", defaultValue = "true") boolean cityFilter,
            @RequestParam(value = "max_distance_km", required = false) Double maxDistanceKm,
            @RequestParam(value = "strategy", required = false) String strategy,
            @RequestParam(value = "max_age", required = false) Long maxAge) {
        return match(EntityKind.JOB, id, tenantId, k, cityFilter, maxDistanceKm, strategy, maxAge);
    }

    @GetMapping("/explain/{candidateId}/{jobId}")
    public Mono<ResponseEntity<MatchExplanation>> explain(
            @PathVariable("candidateId") String candidateId,
            @PathVariable("jobId") String jobId,
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId) {
        return Mono.fromCallable(() -> matchService.explainById(TenantHeaders.require(tenantId), candidateId, jobId))
                .map(ResponseEntity::ok);
    }

    private Mono<ResponseEntity<MatchListResponse>> match(EntityKind kind, String id, String tenantHeader,
                                                          Integer k, boolean cityFilter, Double maxDistanceKm,
                                                          String strategy, Long maxAge) {
        return Mono.defer(() -> {
            String tenantId = TenantHeaders.require(tenantHeader);
            MatchQuery query = MatchQuery.builder()
                    .topK(k != null ? k : matchingConfig.getDefaultTopK())
                    .cityFilter(cityFilter)
                    .maxDistanceKm(maxDistanceKm)
                    .strategy(strategy != null ? CacheStrategy.parse(strategy) : matchingConfig.getCache().getStrategy())
                    .maxAge(maxAge != null ? Duration.ofSeconds(maxAge) : null)
                    .build();
            boolean cached = matchService.isCachedById(tenantId, kind, id, query);

            return matchService.matchById(tenantId, kind, id, query)
                    .map(results -> {
                        List<MatchExplanation> matches = results.stream()
                                .map(explainabilityAssembler::assemble)
                                .toList();
                        MatchListResponse response = MatchListResponse.builder()
                                .candidateId(kind == EntityKind.CANDIDATE ? id : null)
                                .jobId(kind == EntityKind.JOB ? id : null)
                                .matches(matches)
                                .cityFilter(query.cityFilter())
                                .maxDistanceKm(query.maxDistanceKm())
                                .cacheStrategy(query.strategy().wireName())
                                .maxAgeSeconds(maxAge)
                                .cached(cached)
                                .build();
                        return ResponseEntity.ok(response);
                    });
        });
    }
}
