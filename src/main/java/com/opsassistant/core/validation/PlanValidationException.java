package com.opsassistant.core.validation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a candidate plan breaks one or more validation rules.
 */
public class PlanValidationException extends RuntimeException {

    private final List<PlanViolation> violations;

    public PlanValidationException(List<PlanViolation> violations) {
        super("Plan failed validation: " + violations.stream()
                .map(PlanViolation::toString)
                .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public List<PlanViolation> violations() {
        return violations;
    }
}
