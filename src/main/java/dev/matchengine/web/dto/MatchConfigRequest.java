package dev.matchengine.web.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.matchengine.model.WeightUpdate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial weight update. Omitted fields keep their current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MatchConfigRequest {

    @JsonProperty("skill_weight")
    private Double skillWeight;

    @JsonProperty("title_weight")
    private Double titleWeight;

    @JsonProperty("semantic_weight")
    private Double semanticWeight;

    @JsonProperty("embedding_weight")
    @JsonAlias("embed_weight")
    private Double embeddingWeight;

    @JsonProperty("distance_weight")
    private Double distanceWeight;

    @JsonProperty("must_weight")
    @JsonAlias("must_category_weight")
    private Double mustWeight;

    @JsonProperty("needed_weight")
    @JsonAlias("needed_category_weight")
    private Double neededWeight;

    @JsonProperty("min_skill_floor")
    private Integer minSkillFloor;

    public WeightUpdate toUpdate() {
        return WeightUpdate.builder()
                .skillWeight(skillWeight)
                .titleWeight(titleWeight)
                .semanticWeight(semanticWeight)
                .embeddingWeight(embeddingWeight)
                .distanceWeight(distanceWeight)
                .mustWeight(mustWeight)
                .neededWeight(neededWeight)
                .minSkillFloor(minSkillFloor)
                .build();
    }
}
