package dev.matchengine.scoring;

import dev.matchengine.model.ComponentScore;
import dev.matchengine.model.Entity;
import dev.matchengine.model.MatchComponent;
import dev.matchengine.model.MatchResult;
import dev.matchengine.model.ScoreBreakdown;
import dev.matchengine.model.SkillScore;
import dev.matchengine.model.WeightConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Combines the skill, title, semantic, embedding and distance signals into
 * one score in [0,1].
 * <p>
 * Only components computable for the pair take part: weights of absent
 * components are left out of both the weighted sum and the normalizing
 * denominator. When the active weights sum to zero the weighted skill score
 * is used alone.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CompositeScorer {

    private final SkillScorer skillScorer;
    private final TitleSimilarityScorer titleScorer;
    private final SemanticSimilarityScorer semanticScorer;
    private final EmbeddingSimilarityScorer embeddingScorer;
    private final GeoDistanceScorer geoScorer;

    /**
     * Score one pair against a weight snapshot read by the caller.
     * Tenant checks happen before this is called.
     */
    public MatchResult score(Entity anchor, Entity counterpart, WeightConfiguration weights) {
        SkillScore skills = skillScorer.score(anchor, counterpart, weights);
        OptionalDouble distanceKm = geoScorer.distanceKm(anchor.getLocation(), counterpart.getLocation());

        Map<MatchComponent, ComponentScore> components = new EnumMap<>(MatchComponent.class);
        components.put(MatchComponent.SKILL, ComponentScore.of(skills.weightedScore()));
        components.put(MatchComponent.TITLE,
                toComponent(titleScorer.similarity(anchor.getTitle(), counterpart.getTitle())));
        components.put(MatchComponent.SEMANTIC,
                toComponent(semanticScorer.similarity(anchor.getTextBlob(), counterpart.getTextBlob())));
        components.put(MatchComponent.EMBEDDING,
                toComponent(embeddingScorer.similarity(anchor.getEmbedding(), counterpart.getEmbedding())));
        components.put(MatchComponent.DISTANCE, distanceKm.isPresent()
                ? ComponentScore.of(geoScorer.score(distanceKm.getAsDouble()))
                : ComponentScore.absent());

        double activeWeightSum = 0.0;
        double weightedSum = 0.0;
        for (Map.Entry<MatchComponent, ComponentScore> entry : components.entrySet()) {
            ComponentScore component = entry.getValue();
            if (component.present()) {
                double weight = weights.weightOf(entry.getKey());
                activeWeightSum += weight;
                weightedSum += weight * component.raw();
            }
        }

        boolean degenerate = activeWeightSum <= 0.0;
        double score;
        if (degenerate) {
            score = clamp(skills.weightedScore());
            components.put(MatchComponent.SKILL, components.get(MatchComponent.SKILL).withWeighted(score));
        } else {
            score = clamp(weightedSum / activeWeightSum);
            for (Map.Entry<MatchComponent, ComponentScore> entry : components.entrySet()) {
                ComponentScore component = entry.getValue();
                double share = weights.weightOf(entry.getKey()) * component.raw() / activeWeightSum;
                entry.setValue(component.withWeighted(share));
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Scored {} -> {}: {} (skill={}, activeWeights={}, degenerate={})",
                    anchor.getId(), counterpart.getId(), score, skills.weightedScore(), activeWeightSum, degenerate);
        }

        ScoreBreakdown breakdown = ScoreBreakdown.builder()
                .components(components)
                .skills(skills)
                .distanceKm(distanceKm.isPresent() ? distanceKm.getAsDouble() : null)
                .activeWeightSum(activeWeightSum)
                .degenerateWeights(degenerate)
                .build();

        return new MatchResult(anchor.getId(), anchor.getKind(), counterpart.getId(), score,
                counterpart.getId(), weights.version(), breakdown);
    }

    private static ComponentScore toComponent(OptionalDouble value) {
        return value.isPresent() ? ComponentScore.of(value.getAsDouble()) : ComponentScore.absent();
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
