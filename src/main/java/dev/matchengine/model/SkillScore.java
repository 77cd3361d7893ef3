package dev.matchengine.model;

import lombok.Builder;

import java.util.SortedSet;

/**
 * Output of the category-weighted skill comparison for one pair.
 */
@Builder
public record SkillScore(
        double weightedScore,
        double mustRatio,
        double neededRatio,
        double baseOverlap,
        SortedSet<String> overlap,
        SortedSet<String> anchorOnly,
        SortedSet<String> counterpartOnly,
        boolean lowSkillFloor,
        boolean categorized,
        RequirementSummary requirements) {
}
