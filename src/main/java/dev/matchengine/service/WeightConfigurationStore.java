package dev.matchengine.service;

import dev.matchengine.config.MatchingConfig;
import dev.matchengine.exception.WeightValidationException;
import dev.matchengine.metrics.MatchMetrics;
import dev.matchengine.model.WeightConfiguration;
import dev.matchengine.model.WeightUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide holder of the current weight snapshot.
 * <p>
 * Readers take the current snapshot without locking and use it for the whole
 * call. Updates are serialized, validated and installed as a new snapshot
 * with the next version; a rejected update changes nothing.
 */
@Slf4j
@Service
public class WeightConfigurationStore {

    static final double SUM_TOLERANCE = 0.05;

    private final AtomicReference<WeightConfiguration> current;
    private final MatchMetrics metrics;
    private final Object writeLock = new Object();

    public WeightConfigurationStore(MatchingConfig matchingConfig, MatchMetrics metrics) {
        this.metrics = metrics;
        WeightConfiguration initial = fromConfig(matchingConfig.getWeights());
        List<String> violations = validate(initial);
        if (!violations.isEmpty()) {
            throw new IllegalStateException("Invalid startup weight configuration: " + String.join("; ", violations));
        }
        warnIfUnbalanced(initial);
        this.current = new AtomicReference<>(initial);
        metrics.updateWeightVersion(initial.version());
        log.info("Weight configuration installed: {}", initial);
    }

    public WeightConfiguration current() {
        return current.get();
    }

    /**
     * Validate and install a partial update.
     *
     * @return the installed snapshot
     * @throws WeightValidationException when any value is out of range
     */
    public WeightConfiguration update(WeightUpdate update) {
        synchronized (writeLock) {
            WeightConfiguration base = current.get();
            WeightConfiguration candidate = update.applyTo(base).toBuilder()
                    .version(base.version() + 1)
                    .build();

            List<String> violations = validate(candidate);
            if (!violations.isEmpty()) {
                metrics.recordWeightRejection();
                log.warn("Rejected weight update: {}", violations);
                throw new WeightValidationException(violations);
            }

            warnIfUnbalanced(candidate);
            current.set(candidate);
            metrics.recordWeightUpdate(candidate.version());
            log.info("Weight configuration updated to version {}: {}", candidate.version(), candidate);
            return candidate;
        }
    }

    static List<String> validate(WeightConfiguration weights) {
        List<String> violations = new ArrayList<>();
        checkUnit("skill_weight", weights.skillWeight(), violations);
        checkUnit("title_weight", weights.titleWeight(), violations);
        checkUnit("semantic_weight", weights.semanticWeight(), violations);
        checkUnit("embedding_weight", weights.embeddingWeight(), violations);
        checkUnit("distance_weight", weights.distanceWeight(), violations);
        checkUnit("must_weight", weights.mustWeight(), violations);
        checkUnit("needed_weight", weights.neededWeight(), violations);
        if (weights.minSkillFloor() < 0) {
            violations.add("min_skill_floor must be >= 0, got " + weights.minSkillFloor());
        }
        return violations;
    }

    private static void checkUnit(String name, double value, List<String> violations) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            violations.add(name + " must be within [0,1], got " + value);
        }
    }

    private static void warnIfUnbalanced(WeightConfiguration weights) {
        double componentSum = weights.componentWeightSum();
        if (Math.abs(componentSum - 1.0) > SUM_TOLERANCE) {
            log.warn("Component weights sum to {} (expected about 1.0); scores are still renormalized", componentSum);
        }
        double categorySum = weights.categoryWeightSum();
        if (Math.abs(categorySum - 1.0) > SUM_TOLERANCE) {
            log.warn("Category weights sum to {} (recommended 1.0)", categorySum);
        }
    }

    private static WeightConfiguration fromConfig(MatchingConfig.Weights weights) {
        return WeightConfiguration.builder()
                .skillWeight(weights.getSkill())
                .titleWeight(weights.getTitle())
                .semanticWeight(weights.getSemantic())
                .embeddingWeight(weights.getEmbedding())
                .distanceWeight(weights.getDistance())
                .mustWeight(weights.getMust())
                .neededWeight(weights.getNeeded())
                .minSkillFloor(weights.getMinSkillFloor())
                .version(1)
                .build();
    }
}
