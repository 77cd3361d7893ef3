package dev.matchengine.model;

/**
 * Scored pair. Created per scoring call and never persisted by the engine.
 *
 * @param tieBreakKey secondary ordering key for equal scores (counterpart id)
 */
public record MatchResult(
        String anchorId,
        EntityKind anchorKind,
        String counterpartId,
        double score,
        String tieBreakKey,
        long weightVersion,
        ScoreBreakdown breakdown) {

    public boolean hasBreakdown() {
        return breakdown != null;
    }
}
