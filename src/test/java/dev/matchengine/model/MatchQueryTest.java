package dev.matchengine.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchQueryTest {

    @Test
    @DisplayName("Should default to the hybrid cache strategy")
    void shouldDefaultStrategy() {
        assertThat(MatchQuery.topK(5).strategy()).isEqualTo(CacheStrategy.HYBRID);
        assertThat(CacheStrategy.parse("OFF")).isEqualTo(CacheStrategy.OFF);
        assertThat(CacheStrategy.parse("anything")).isEqualTo(CacheStrategy.HYBRID);
    }

    @Test
    @DisplayName("Should reject a non-positive top-K and negative max age")
    void shouldValidate() {
        assertThatThrownBy(() -> MatchQuery.topK(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MatchQuery.builder().topK(1).maxAge(Duration.ofSeconds(-1)).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should treat a non-positive distance bound as no bound")
    void shouldDropNonPositiveDistance() {
        assertThat(MatchQuery.builder().topK(1).maxDistanceKm(0.0).build().maxDistanceKm()).isNull();
    }

    @Test
    @DisplayName("Should build a canonical signature")
    void shouldBuildSignature() {
        MatchQuery query = MatchQuery.builder().topK(5).cityFilter(true).maxDistanceKm(30.0).build();

        assertThat(query.signature(EntityKind.JOB, "j1")).isEqualTo("job:j1|k=5|city=true|maxKm=30.0");
    }

    @Test
    @DisplayName("Should write a stable token for an anchor without a kind")
    void shouldSignAnchorWithoutKind() {
        assertThat(MatchQuery.topK(5).signature(null, "x1")).isEqualTo("any:x1|k=5|city=false|maxKm=-");
    }

    @Test
    @DisplayName("Should keep nearby distance bounds apart")
    void shouldKeepDistanceBoundsExact() {
        MatchQuery below = MatchQuery.builder().topK(5).maxDistanceKm(9.9999).build();
        MatchQuery above = MatchQuery.builder().topK(5).maxDistanceKm(10.0001).build();

        assertThat(below.signature(EntityKind.CANDIDATE, "c1"))
                .isNotEqualTo(above.signature(EntityKind.CANDIDATE, "c1"));
    }
}
