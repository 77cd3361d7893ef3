package dev.matchengine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Wire view of a scored pair. Absent components are null.
 */
@Builder
public record MatchExplanation(
        @JsonProperty("candidate_id") String candidateId,
        @JsonProperty("job_id") String jobId,
        @JsonProperty("score") double score,
        @JsonProperty("skill_overlap") List<String> skillOverlap,
        @JsonProperty("candidate_only_skills") List<String> candidateOnlySkills,
        @JsonProperty("job_only_skills") List<String> jobOnlySkills,
        @JsonProperty("base_skill_overlap") double baseSkillOverlap,
        @JsonProperty("must_ratio") double mustRatio,
        @JsonProperty("needed_ratio") double neededRatio,
        @JsonProperty("weighted_skill_score") double weightedSkillScore,
        @JsonProperty("title_similarity") Double titleSimilarity,
        @JsonProperty("semantic_similarity") Double semanticSimilarity,
        @JsonProperty("embedding_similarity") Double embeddingSimilarity,
        @JsonProperty("distance_km") Double distanceKm,
        @JsonProperty("distance_score") Double distanceScore,
        @JsonProperty("low_skill_floor") boolean lowSkillFloor,
        @JsonProperty("components") Map<String, Component> components,
        @JsonProperty("requirements") Requirements requirements,
        @JsonProperty("weights_version") long weightsVersion,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        @JsonProperty("weights") WeightConfiguration weights) {

    /**
     * Raw similarity and its share of the composite score.
     */
    public record Component(
            @JsonProperty("raw") Double raw,
            @JsonProperty("weighted") Double weighted) {
    }

    public record Requirements(
            @JsonProperty("skills_must_list") List<RequirementCheck> mustList,
            @JsonProperty("skills_nice_list") List<RequirementCheck> niceList,
            @JsonProperty("skills_total_must") int totalMust,
            @JsonProperty("skills_total_nice") int totalNice,
            @JsonProperty("skills_matched_must") long matchedMust,
            @JsonProperty("skills_matched_nice") long matchedNice) {
    }
}
