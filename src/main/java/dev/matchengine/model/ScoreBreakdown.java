package dev.matchengine.model;

import lombok.Builder;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Everything the composite scorer computed for a pair.
 */
@Builder
public record ScoreBreakdown(
        Map<MatchComponent, ComponentScore> components,
        SkillScore skills,
        Double distanceKm,
        double activeWeightSum,
        boolean degenerateWeights) {

    public ScoreBreakdown {
        EnumMap<MatchComponent, ComponentScore> copy = new EnumMap<>(MatchComponent.class);
        for (MatchComponent component : MatchComponent.values()) {
            ComponentScore score = components != null ? components.get(component) : null;
            copy.put(component, score != null ? score : ComponentScore.absent());
        }
        components = Collections.unmodifiableMap(copy);
    }

    public ComponentScore component(MatchComponent component) {
        return components.get(component);
    }
}
