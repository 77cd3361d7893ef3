package dev.matchengine.web.controller;

import dev.matchengine.config.MatchingConfig;
import dev.matchengine.model.WeightConfiguration;
import dev.matchengine.service.MatchService;
import dev.matchengine.web.dto.MatchConfigRequest;
import dev.matchengine.web.dto.MatchConfigResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Weight configuration and cache management endpoints.
 */
@RestController
@RequestMapping("/match")
@RequiredArgsConstructor
@Slf4j
public class MatchConfigController {

    private final MatchService matchService;
    private final MatchingConfig matchingConfig;

    @GetMapping("/config")
    public Mono<ResponseEntity<MatchConfigResponse>> getConfig() {
        return Mono.just(ResponseEntity.ok(toResponse(matchService.currentWeights())));
    }

    @PutMapping("/config")
    public Mono<ResponseEntity<MatchConfigResponse>> updateConfig(@RequestBody MatchConfigRequest request) {
        return Mono.fromCallable(() -> matchService.updateWeights(request.toUpdate()))
                .map(weights -> ResponseEntity.ok(toResponse(weights)));
    }

    @PostMapping("/cache/clear")
    public Mono<ResponseEntity<Map<String, String>>> clearCache() {
        return Mono.fromRunnable(() -> {
                    matchService.clearCache();
                    log.info("[API] Match cache cleared");
                })
                .thenReturn(ResponseEntity.ok(Map.of("status", "cleared")));
    }

    private MatchConfigResponse toResponse(WeightConfiguration weights) {
        MatchingConfig.Cache cache = matchingConfig.getCache();
        return MatchConfigResponse.of(weights, cache.getStrategy(), cache.getTtl());
    }
}
