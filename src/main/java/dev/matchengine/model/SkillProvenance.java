package dev.matchengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SkillProvenance {
    EXTRACTED,
    SYNTHETIC;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SkillProvenance fromWire(String value) {
        if (value != null && "synthetic".equalsIgnoreCase(value.trim())) {
            return SYNTHETIC;
        }
        return EXTRACTED;
    }
}
