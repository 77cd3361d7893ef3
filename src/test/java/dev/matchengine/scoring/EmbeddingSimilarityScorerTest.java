package dev.matchengine.scoring;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EmbeddingSimilarityScorerTest {

    private EmbeddingSimilarityScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new EmbeddingSimilarityScorer();
    }

    @Test
    @DisplayName("Should map identical vectors to 1.0")
    void shouldScoreIdenticalVectorsAsOne() {
        double[] v = {0.2, 0.4, 0.1};

        assertThat(scorer.similarity(v, v).getAsDouble()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("Should map opposite vectors to 0.0 and orthogonal to 0.5")
    void shouldMapCosineOntoUnitInterval() {
        assertThat(scorer.similarity(new double[]{1, 0}, new double[]{-1, 0}).getAsDouble())
                .isCloseTo(0.0, within(1e-9));
        assertThat(scorer.similarity(new double[]{1, 0}, new double[]{0, 1}).getAsDouble())
                .isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("Should be absent for missing, mismatched or zero vectors")
    void shouldBeAbsentForUnusableVectors() {
        assertThat(scorer.similarity(null, new double[]{1})).isEmpty();
        assertThat(scorer.similarity(new double[0], new double[0])).isEmpty();
        assertThat(scorer.similarity(new double[]{1, 2}, new double[]{1, 2, 3})).isEmpty();
        assertThat(scorer.similarity(new double[]{0, 0}, new double[]{1, 1})).isEmpty();
    }
}
