package dev.matchengine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Immutable snapshot of the scoring weights. A new snapshot with a higher
 * version is installed on every update; snapshots are never modified.
 */
@Builder(toBuilder = true)
public record WeightConfiguration(
        @JsonProperty("skill_weight") double skillWeight,
        @JsonProperty("title_weight") double titleWeight,
        @JsonProperty("semantic_weight") double semanticWeight,
        @JsonProperty("embedding_weight") double embeddingWeight,
        @JsonProperty("distance_weight") double distanceWeight,
        @JsonProperty("must_category_weight") double mustWeight,
        @JsonProperty("needed_category_weight") double neededWeight,
        @JsonProperty("min_skill_floor") int minSkillFloor,
        @JsonProperty("version") long version) {

    public double weightOf(MatchComponent component) {
        return switch (component) {
            case SKILL -> skillWeight;
            case TITLE -> titleWeight;
            case SEMANTIC -> semanticWeight;
            case EMBEDDING -> embeddingWeight;
            case DISTANCE -> distanceWeight;
        };
    }

    public double componentWeightSum() {
        return skillWeight + titleWeight + semanticWeight + embeddingWeight + distanceWeight;
    }

    public double categoryWeightSum() {
        return mustWeight + neededWeight;
    }
}
