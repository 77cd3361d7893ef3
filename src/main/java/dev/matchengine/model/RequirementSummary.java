package dev.matchengine.model;

import java.util.List;

/**
 * Job-side requirements split into must and nice, each flagged against the
 * candidate's skills.
 */
public record RequirementSummary(List<RequirementCheck> must, List<RequirementCheck> nice) {

    public static final RequirementSummary EMPTY = new RequirementSummary(List.of(), List.of());

    public RequirementSummary {
        must = List.copyOf(must);
        nice = List.copyOf(nice);
    }

    public int totalMust() {
        return must.size();
    }

    public int totalNice() {
        return nice.size();
    }

    public long matchedMust() {
        return must.stream().filter(RequirementCheck::matched).count();
    }

    public long matchedNice() {
        return nice.stream().filter(RequirementCheck::matched).count();
    }
}
