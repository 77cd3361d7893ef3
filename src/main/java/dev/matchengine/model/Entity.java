package dev.matchengine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Candidate profile or job posting as delivered by the ingestion side.
 * Skills are already canonicalized; the engine never mutates an entity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Entity {
    private String id;
    private String tenantId;
    private EntityKind kind;
    private String title;
    private String city; // canonical city name

    private GeoPoint location;

    @Builder.Default
    private List<SkillRef> skills = new ArrayList<>();

    // Legacy documents carry a flat list without categories
    @Builder.Default
    private List<String> flatSkills = new ArrayList<>();

    private String textBlob;
    private double[] embedding;

    private Instant updatedAt;

    /**
     * True when the entity carries categorized skills.
     */
    @JsonIgnore
    public boolean hasCategories() {
        return skills != null && !skills.isEmpty();
    }

    /**
     * Canonical skill name to category, deduplicated. A "must" occurrence wins
     * over a "needed" one; otherwise first occurrence wins. Legacy flat skills
     * are all "needed".
     */
    @JsonIgnore
    public Map<String, SkillCategory> skillCategories() {
        Map<String, SkillCategory> result = new LinkedHashMap<>();
        if (hasCategories()) {
            for (SkillRef ref : skills) {
                if (ref == null) {
                    continue;
                }
                if (ref.isMust()) {
                    result.put(ref.name(), SkillCategory.MUST);
                } else {
                    result.putIfAbsent(ref.name(), SkillCategory.NEEDED);
                }
            }
            return Collections.unmodifiableMap(result);
        }
        if (flatSkills != null) {
            for (String raw : flatSkills) {
                if (raw != null && !raw.isBlank()) {
                    result.putIfAbsent(raw.trim().toLowerCase(Locale.ROOT), SkillCategory.NEEDED);
                }
            }
        }
        return Collections.unmodifiableMap(result);
    }
}
