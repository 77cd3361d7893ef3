package dev.matchengine.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.matchengine.model.CacheStrategy;
import dev.matchengine.model.WeightConfiguration;
import lombok.Builder;

import java.time.Duration;

@Builder
public record MatchConfigResponse(
        @JsonProperty("skill_weight") double skillWeight,
        @JsonProperty("title_weight") double titleWeight,
        @JsonProperty("semantic_weight") double semanticWeight,
        @JsonProperty("embedding_weight") double embeddingWeight,
        @JsonProperty("distance_weight") double distanceWeight,
        @JsonProperty("must_category_weight") double mustWeight,
        @JsonProperty("needed_category_weight") double neededWeight,
        @JsonProperty("min_skill_floor") int minSkillFloor,
        @JsonProperty("version") long version,
        @JsonProperty("cache_strategy") String cacheStrategy,
        @JsonProperty("cache_ttl") long cacheTtlSeconds) {

    public static MatchConfigResponse of(WeightConfiguration weights, CacheStrategy strategy, Duration ttl) {
        return MatchConfigResponse.builder()
                .skillWeight(weights.skillWeight())
                .titleWeight(weights.titleWeight())
                .semanticWeight(weights.semanticWeight())
                .embeddingWeight(weights.embeddingWeight())
                .distanceWeight(weights.distanceWeight())
                .mustWeight(weights.mustWeight())
                .neededWeight(weights.neededWeight())
                .minSkillFloor(weights.minSkillFloor())
                .version(weights.version())
                .cacheStrategy(strategy.wireName())
                .cacheTtlSeconds(ttl != null ? ttl.toSeconds() : 0)
                .build();
    }
}
