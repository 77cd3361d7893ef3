package dev.matchengine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BackfillSummary(
        @JsonProperty("processed") int processed,
        @JsonProperty("computed") int computed,
        @JsonProperty("skipped") int skipped,
        @JsonProperty("errors") int errors) {
}
