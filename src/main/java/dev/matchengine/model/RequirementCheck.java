package dev.matchengine.model;

/**
 * One job requirement and whether the candidate side covers it.
 */
public record RequirementCheck(String name, boolean matched) {
}
