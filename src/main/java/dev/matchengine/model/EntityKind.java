package dev.matchengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Side of a match: a candidate profile or a job posting.
 */
public enum EntityKind {
    CANDIDATE,
    JOB;

    /**
     * The kind a pool must hold when this kind is the anchor.
     */
    public EntityKind opposite() {
        return this == CANDIDATE ? JOB : CANDIDATE;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EntityKind fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Entity kind is required");
        }
        return EntityKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
