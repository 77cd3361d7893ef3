package dev.matchengine.exception;

import java.util.List;

/**
 * Raised when a weight update is rejected. The current configuration is left unchanged.
 */
public class WeightValidationException extends RuntimeException {

    private final List<String> violations;

    public WeightValidationException(List<String> violations) {
        super("Invalid weight configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
