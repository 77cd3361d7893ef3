package dev.matchengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SkillCategory {
    MUST,
    NEEDED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Anything that is not explicitly "must" is a needed (nice-to-have) skill.
     */
    @JsonCreator
    public static SkillCategory fromWire(String value) {
        if (value != null && "must".equalsIgnoreCase(value.trim())) {
            return MUST;
        }
        return NEEDED;
    }
}
