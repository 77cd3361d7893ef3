package dev.matchengine.scoring;

import dev.matchengine.model.Entity;
import dev.matchengine.model.EntityKind;
import dev.matchengine.model.RequirementCheck;
import dev.matchengine.model.RequirementSummary;
import dev.matchengine.model.SkillCategory;
import dev.matchengine.model.SkillScore;
import dev.matchengine.model.WeightConfiguration;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Category-weighted skill overlap between two entities.
 */
@Component
public class SkillScorer {

    /**
     * Compare the skill sets of a pair.
     * <p>
     * Must and needed skills are compared independently with
     * {@code |A∩B| / max(|A|,|B|,1)} and combined as
     * {@code mustWeight*mustRatio + neededWeight*neededRatio}, clamped to [0,1].
     * When either side has no categories at all, both sides are compared as
     * needed only. The skill floor only sets a flag.
     *
     * @param anchor      the entity the ranking is for
     * @param counterpart the pool member being compared
     * @param weights     the snapshot in use for this call
     * @return the skill component with its overlap details
     */
    public SkillScore score(Entity anchor, Entity counterpart, WeightConfiguration weights) {
        Map<String, SkillCategory> anchorSkills = anchor.skillCategories();
        Map<String, SkillCategory> counterpartSkills = counterpart.skillCategories();
        boolean categorized = anchor.hasCategories() && counterpart.hasCategories();

        double mustRatio = 0.0;
        double neededRatio;
        if (categorized) {
            mustRatio = overlap(namesIn(anchorSkills, SkillCategory.MUST), namesIn(counterpartSkills, SkillCategory.MUST));
            neededRatio = overlap(namesIn(anchorSkills, SkillCategory.NEEDED),
                    namesIn(counterpartSkills, SkillCategory.NEEDED));
        } else {
            neededRatio = overlap(anchorSkills.keySet(), counterpartSkills.keySet());
        }
        double weighted = clamp(weights.mustWeight() * mustRatio + weights.neededWeight() * neededRatio);

        SortedSet<String> shared = new TreeSet<>(anchorSkills.keySet());
        shared.retainAll(counterpartSkills.keySet());
        SortedSet<String> anchorOnly = new TreeSet<>(anchorSkills.keySet());
        anchorOnly.removeAll(counterpartSkills.keySet());
        SortedSet<String> counterpartOnly = new TreeSet<>(counterpartSkills.keySet());
        counterpartOnly.removeAll(anchorSkills.keySet());

        boolean lowSkillFloor = anchorSkills.size() < weights.minSkillFloor()
                || counterpartSkills.size() < weights.minSkillFloor();

        return SkillScore.builder()
                .weightedScore(weighted)
                .mustRatio(mustRatio)
                .neededRatio(neededRatio)
                .baseOverlap(overlap(anchorSkills.keySet(), counterpartSkills.keySet()))
                .overlap(Collections.unmodifiableSortedSet(shared))
                .anchorOnly(Collections.unmodifiableSortedSet(anchorOnly))
                .counterpartOnly(Collections.unmodifiableSortedSet(counterpartOnly))
                .lowSkillFloor(lowSkillFloor)
                .categorized(categorized)
                .requirements(requirements(anchor, anchorSkills, counterpartSkills))
                .build();
    }

    /**
     * {@code |A∩B| / max(|A|,|B|,1)}; two empty sets give 0, not 1.
     */
    static double overlap(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        long shared = smaller.stream().filter(larger::contains).count();
        return (double) shared / Math.max(Math.max(a.size(), b.size()), 1);
    }

    private static Set<String> namesIn(Map<String, SkillCategory> skills, SkillCategory category) {
        return skills.entrySet().stream()
                .filter(e -> e.getValue() == category)
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());
    }

    /**
     * Job requirements checked against the candidate side. A job without
     * categories lists everything as nice-to-have.
     */
    private static RequirementSummary requirements(Entity anchor,
                                                   Map<String, SkillCategory> anchorSkills,
                                                   Map<String, SkillCategory> counterpartSkills) {
        boolean anchorIsJob = anchor.getKind() == EntityKind.JOB;
        Map<String, SkillCategory> jobSkills = anchorIsJob ? anchorSkills : counterpartSkills;
        Set<String> candidateSkills = anchorIsJob ? counterpartSkills.keySet() : anchorSkills.keySet();
        if (jobSkills.isEmpty()) {
            return RequirementSummary.EMPTY;
        }
        List<RequirementCheck> must = checks(jobSkills, SkillCategory.MUST, candidateSkills);
        List<RequirementCheck> nice = checks(jobSkills, SkillCategory.NEEDED, candidateSkills);
        return new RequirementSummary(must, nice);
    }

    private static List<RequirementCheck> checks(Map<String, SkillCategory> jobSkills,
                                                 SkillCategory category,
                                                 Set<String> candidateSkills) {
        return new TreeSet<>(namesIn(jobSkills, category)).stream()
                .map(name -> new RequirementCheck(name, candidateSkills.contains(name)))
                .toList();
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
