package dev.matchengine.model;

/**
 * Value of one composite component for a pair. An absent component was not
 * computable (missing coordinates, embedding, title or text) and takes no
 * part in the weighted sum; it is not the same as a zero similarity.
 */
public record ComponentScore(boolean present, double raw, double weighted) {

    private static final ComponentScore ABSENT = new ComponentScore(false, 0.0, 0.0);

    public static ComponentScore absent() {
        return ABSENT;
    }

    public static ComponentScore of(double raw) {
        return new ComponentScore(true, raw, 0.0);
    }

    public ComponentScore withWeighted(double value) {
        return present ? new ComponentScore(true, raw, value) : ABSENT;
    }

    public Double rawOrNull() {
        return present ? raw : null;
    }

    public Double weightedOrNull() {
        return present ? weighted : null;
    }
}
