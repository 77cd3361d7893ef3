package dev.matchengine.scoring;

import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Cosine similarity mapped from [-1,1] onto [0,1].
 */
@Component
public class EmbeddingSimilarityScorer {

    /**
     * Empty when either vector is missing or empty, the dimensions differ, or a vector has zero norm.
     */
    public OptionalDouble similarity(double[] a, double[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return OptionalDouble.empty();
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0 || Double.isNaN(dot)) {
            return OptionalDouble.empty();
        }
        double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        cosine = Math.max(-1.0, Math.min(1.0, cosine));
        return OptionalDouble.of((cosine + 1.0) / 2.0);
    }
}
