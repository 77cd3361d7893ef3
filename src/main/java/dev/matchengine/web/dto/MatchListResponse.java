package dev.matchengine.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.matchengine.model.MatchExplanation;
import lombok.Builder;

import java.util.List;

/**
 * Ranked matches for one anchor. Exactly one of the two id fields is set.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchListResponse(
        @JsonProperty("candidate_id") String candidateId,
        @JsonProperty("job_id") String jobId,
        @JsonProperty("matches") List<MatchExplanation> matches,
        @JsonProperty("city_filter") boolean cityFilter,
        @JsonProperty("max_distance_km") Double maxDistanceKm,
        @JsonProperty("cache_strategy") String cacheStrategy,
        @JsonProperty("max_age") Long maxAgeSeconds,
        @JsonProperty("cached") boolean cached) {
}
