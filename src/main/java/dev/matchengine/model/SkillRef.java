package dev.matchengine.model;

import java.util.Locale;

/**
 * Canonical skill reference as annotated by the ingestion side.
 * Category and provenance are never null.
 */
public record SkillRef(String name, SkillCategory category, SkillProvenance provenance) {

    public SkillRef {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Skill name must not be blank");
        }
        name = name.trim().toLowerCase(Locale.ROOT);
        category = category != null ? category : SkillCategory.NEEDED;
        provenance = provenance != null ? provenance : SkillProvenance.EXTRACTED;
    }

    public static SkillRef must(String name) {
        return new SkillRef(name, SkillCategory.MUST, SkillProvenance.EXTRACTED);
    }

    public static SkillRef needed(String name) {
        return new SkillRef(name, SkillCategory.NEEDED, SkillProvenance.EXTRACTED);
    }

    public boolean isMust() {
        return category == SkillCategory.MUST;
    }
}
