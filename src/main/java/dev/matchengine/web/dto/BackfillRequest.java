package dev.matchengine.web.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.matchengine.model.EntityKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BackfillRequest {

    @Builder.Default
    @JsonProperty("anchor_kind")
    private EntityKind anchorKind = EntityKind.CANDIDATE;

    @Builder.Default
    private int k = 10;

    @Builder.Default
    @JsonProperty("city_filter")
    private boolean cityFilter = true;

    @JsonAlias({"limit_candidates", "limit_jobs"})
    private Integer limit;

    private boolean force;

    // Seconds; entries younger than this count as fresh
    @JsonProperty("max_age")
    private Long maxAge;
}
