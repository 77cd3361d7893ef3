package dev.matchengine.model;

import lombok.Builder;

/**
 * Partial weight change. Null fields keep the value of the current snapshot.
 */
@Builder
public record WeightUpdate(
        Double skillWeight,
        Double titleWeight,
        Double semanticWeight,
        Double embeddingWeight,
        Double distanceWeight,
        Double mustWeight,
        Double neededWeight,
        Integer minSkillFloor) {

    /**
     * Merge onto the given snapshot. The version is left untouched.
     */
    public WeightConfiguration applyTo(WeightConfiguration current) {
        return current.toBuilder()
                .skillWeight(skillWeight != null ? skillWeight : current.skillWeight())
                .titleWeight(titleWeight != null ? titleWeight : current.titleWeight())
                .semanticWeight(semanticWeight != null ? semanticWeight : current.semanticWeight())
                .embeddingWeight(embeddingWeight != null ? embeddingWeight : current.embeddingWeight())
                .distanceWeight(distanceWeight != null ? distanceWeight : current.distanceWeight())
                .mustWeight(mustWeight != null ? mustWeight : current.mustWeight())
                .neededWeight(neededWeight != null ? neededWeight : current.neededWeight())
                .minSkillFloor(minSkillFloor != null ? minSkillFloor : current.minSkillFloor())
                .build();
    }
}
