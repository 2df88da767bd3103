package com.opsassistant.core.model;

import com.opsassistant.tools.ToolKind;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One planned tool invocation.
 *
 * @param stepNumber     1-based position within the plan
 * @param action         human-readable description of what the step does
 * @param tool           the tool to invoke
 * @param parameters     tool parameters; may contain references to earlier step outputs
 * @param expectedOutput what the step should produce
 * @param critical       whether a failure of this step makes the result incomplete
 */
public record PlanStep(
    int stepNumber,
    String action,
    ToolKind tool,
    Map<String, Object> parameters,
    String expectedOutput,
    boolean critical
) implements Serializable {

    public PlanStep {
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public PlanStep(int stepNumber, String action, ToolKind tool,
                    Map<String, Object> parameters, String expectedOutput) {
        this(stepNumber, action, tool, parameters, expectedOutput, true);
    }

    /** Returns a copy of this step with the given parameters. */
    public PlanStep withParameters(Map<String, Object> resolved) {
        return new PlanStep(stepNumber, action, tool, resolved, expectedOutput, critical);
    }
}
