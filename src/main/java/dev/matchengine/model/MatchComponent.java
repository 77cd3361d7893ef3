package dev.matchengine.model;

import java.util.Locale;

/**
 * Signals combined into the composite score.
 */
public enum MatchComponent {
    SKILL,
    TITLE,
    SEMANTIC,
    EMBEDDING,
    DISTANCE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
