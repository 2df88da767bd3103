package com.opsassistant.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A validated, immutable execution plan produced by the planner.
 * <p>
 * Structural invariants (contiguous step numbers, registered tools, required
 * parameters, comparison entities) are enforced by
 * {@link com.opsassistant.core.validation.PlanValidator}; this record only
 * guarantees immutability.
 *
 * @param taskDescription what the user wants to accomplish
 * @param intent          classified intent
 * @param steps           ordered steps, numbered from 1
 * @param comparisonMode  true when two or more entities are compared side by side
 * @param entities        compared entities in the order the model listed them
 */
public record Plan(
    String taskDescription,
    Intent intent,
    List<PlanStep> steps,
    boolean comparisonMode,
    Set<String> entities
) implements Serializable {

    public Plan {
        steps = steps == null ? List.of() : List.copyOf(steps);
        entities = entities == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(entities));
    }

    public PlanStep step(int stepNumber) {
        return steps.stream()
                .filter(s -> s.stepNumber() == stepNumber)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No step " + stepNumber + " in plan"));
    }
}
