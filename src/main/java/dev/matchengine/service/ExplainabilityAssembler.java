package dev.matchengine.service;

import dev.matchengine.model.ComponentScore;
import dev.matchengine.model.EntityKind;
import dev.matchengine.model.MatchComponent;
import dev.matchengine.model.MatchExplanation;
import dev.matchengine.model.MatchResult;
import dev.matchengine.model.RequirementSummary;
import dev.matchengine.model.ScoreBreakdown;
import dev.matchengine.model.SkillScore;
import dev.matchengine.model.WeightConfiguration;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands a scored pair into its wire-level breakdown. Pure: nothing is
 * recomputed, values are only mapped and rounded to four decimals.
 */
@Component
public class ExplainabilityAssembler {

    public MatchExplanation assemble(MatchResult result) {
        return assemble(result, null);
    }

    /**
     * @param weights snapshot to echo back in the explanation, or null to omit it
     */
    public MatchExplanation assemble(MatchResult result, WeightConfiguration weights) {
        if (!result.hasBreakdown()) {
            throw new IllegalArgumentException("Match result for '" + result.counterpartId() + "' has no breakdown");
        }
        ScoreBreakdown breakdown = result.breakdown();
        SkillScore skills = breakdown.skills();
        boolean anchorIsCandidate = result.anchorKind() != EntityKind.JOB;

        Map<String, MatchExplanation.Component> components = new LinkedHashMap<>();
        for (MatchComponent component : MatchComponent.values()) {
            ComponentScore score = breakdown.component(component);
            components.put(component.key(), new MatchExplanation.Component(
                    round(score.rawOrNull()), round(score.weightedOrNull())));
        }

        return MatchExplanation.builder()
                .candidateId(anchorIsCandidate ? result.anchorId() : result.counterpartId())
                .jobId(anchorIsCandidate ? result.counterpartId() : result.anchorId())
                .score(round4(result.score()))
                .skillOverlap(List.copyOf(skills.overlap()))
                .candidateOnlySkills(List.copyOf(anchorIsCandidate ? skills.anchorOnly() : skills.counterpartOnly()))
                .jobOnlySkills(List.copyOf(anchorIsCandidate ? skills.counterpartOnly() : skills.anchorOnly()))
                .baseSkillOverlap(round4(skills.baseOverlap()))
                .mustRatio(round4(skills.mustRatio()))
                .neededRatio(round4(skills.neededRatio()))
                .weightedSkillScore(round4(skills.weightedScore()))
                .titleSimilarity(round(breakdown.component(MatchComponent.TITLE).rawOrNull()))
                .semanticSimilarity(round(breakdown.component(MatchComponent.SEMANTIC).rawOrNull()))
                .embeddingSimilarity(round(breakdown.component(MatchComponent.EMBEDDING).rawOrNull()))
                .distanceKm(breakdown.distanceKm())
                .distanceScore(round(breakdown.component(MatchComponent.DISTANCE).rawOrNull()))
                .lowSkillFloor(skills.lowSkillFloor())
                .components(components)
                .requirements(requirements(skills.requirements()))
                .weightsVersion(result.weightVersion())
                .weights(weights)
                .build();
    }

    private static MatchExplanation.Requirements requirements(RequirementSummary summary) {
        RequirementSummary source = summary != null ? summary : RequirementSummary.EMPTY;
        return new MatchExplanation.Requirements(
                source.must(), source.nice(),
                source.totalMust(), source.totalNice(),
                source.matchedMust(), source.matchedNice());
    }

    private static Double round(Double value) {
        return value == null ? null : round4(value);
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
