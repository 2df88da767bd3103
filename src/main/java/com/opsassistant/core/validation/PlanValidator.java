package com.opsassistant.core.validation;

import com.opsassistant.core.execution.StepReferences;
import com.opsassistant.core.model.Intent;
import com.opsassistant.core.model.Plan;
import com.opsassistant.core.model.PlanStep;
import com.opsassistant.tools.ToolKind;
import com.opsassistant.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks candidate plans produced by the language model and turns them into {@link Plan}s.
 * <p>
 * The candidate is the parsed snake_case JSON object the planner prompt asks
 * for. Rules are checked in {@link ValidationRule} order; structural problems
 * in a step exclude that step from the later rules.
 */
@Component
public class PlanValidator {

    private static final Logger log = LoggerFactory.getLogger(PlanValidator.class);

    private final ToolRegistry toolRegistry;

    public PlanValidator(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    public Plan validate(Map<String, Object> candidate) {
        return validate(candidate, ValidationMode.COLLECT_ALL);
    }

    /**
     * Validates a raw candidate and builds the plan.
     *
     * @throws PlanValidationException listing the violations
     */
    public Plan validate(Map<String, Object> candidate, ValidationMode mode) {
        var violations = new Violations(mode);

        String taskDescription = requireString(candidate, "task_description", "plan", violations);
        Intent intent = null;
        String rawIntent = requireString(candidate, "intent", "plan", violations);
        if (rawIntent != null) {
            intent = Intent.fromWireName(rawIntent).orElse(null);
            if (intent == null) {
                violations.add(ValidationRule.REQUIRED_FIELDS, "plan field 'intent' must be one of "
                        + Arrays.stream(Intent.values()).map(Intent::wireName).toList() + ", got '" + rawIntent + "'");
            }
        }
        boolean comparisonMode = optionalBoolean(candidate, "comparison_mode", false, "plan", violations);
        Set<String> entities = optionalStrings(candidate, "entities", violations);

        List<StepDraft> drafts = new ArrayList<>();
        int stepCount = 0;
        Object rawSteps = candidate.get("steps");
        if (rawSteps == null) {
            violations.add(ValidationRule.REQUIRED_FIELDS, "plan field 'steps' is missing");
        } else if (!(rawSteps instanceof List<?> steps)) {
            violations.add(ValidationRule.REQUIRED_FIELDS, "plan field 'steps' must be a list");
        } else {
            stepCount = steps.size();
            for (int i = 0; i < steps.size(); i++) {
                StepDraft draft = parseStep(steps.get(i), i + 1, violations);
                if (draft != null) drafts.add(draft);
            }
            if (steps.isEmpty()) {
                violations.add(ValidationRule.NON_EMPTY_STEPS, "plan must contain at least one step");
            }
        }

        checkSemantics(drafts, stepCount, intent, comparisonMode, entities, violations);
        violations.throwIfAny();

        List<PlanStep> planSteps = drafts.stream()
                .map(d -> new PlanStep(d.stepNumber(), d.action(), d.tool(), d.parameters(),
                        d.expectedOutput(), d.critical()))
                .toList();
        Plan plan = new Plan(taskDescription, intent, planSteps, comparisonMode, entities);
        log.debug("Validated plan with {} steps (intent={}, comparison={})",
                planSteps.size(), intent.wireName(), comparisonMode);
        return plan;
    }

    /**
     * Re-checks an already built plan before execution, stopping at the first violation.
     */
    public void precheck(Plan plan) {
        var violations = new Violations(ValidationMode.FIRST_VIOLATION);
        if (plan.steps().isEmpty()) {
            violations.add(ValidationRule.NON_EMPTY_STEPS, "plan must contain at least one step");
        }
        List<StepDraft> drafts = new ArrayList<>();
        for (int i = 0; i < plan.steps().size(); i++) {
            PlanStep s = plan.steps().get(i);
            drafts.add(new StepDraft(i + 1, s.stepNumber(), s.action(), s.tool(), s.tool().wireName(),
                    s.parameters(), s.expectedOutput(), s.critical()));
        }
        checkSemantics(drafts, drafts.size(), plan.intent(), plan.comparisonMode(), plan.entities(), violations);
    }

    /**
     * @param drafts    steps that passed the structural checks, each with its position in the candidate
     * @param stepCount number of steps in the candidate, broken ones included
     */
    private void checkSemantics(List<StepDraft> drafts, int stepCount, Intent intent, boolean comparisonMode,
                                Set<String> entities, Violations violations) {
        for (StepDraft draft : drafts) {
            if (draft.stepNumber() != draft.position()) {
                violations.add(ValidationRule.CONTIGUOUS_STEP_NUMBERS, "step at position " + draft.position()
                        + " has step_number " + draft.stepNumber() + "; step numbers must run 1.." + stepCount);
            }
        }

        for (StepDraft draft : drafts) {
            if (draft.tool() == null || !toolRegistry.isRegistered(draft.tool())) {
                violations.add(ValidationRule.REGISTERED_TOOL, "step " + draft.stepNumber() + " uses unknown tool '"
                        + draft.toolName() + "'; available tools: " + availableTools());
            }
        }

        for (StepDraft draft : drafts) {
            if (draft.tool() == null) continue;
            for (String key : draft.tool().missingParameters(draft.parameters())) {
                violations.add(ValidationRule.REQUIRED_PARAMETERS, "step " + draft.stepNumber() + " ("
                        + draft.tool().wireName() + ") is missing required parameter '" + key + "'");
            }
        }

        if (intent == Intent.COMPARE || comparisonMode) {
            long distinct = entities.stream()
                    .map(e -> e.trim().toLowerCase(Locale.ROOT))
                    .filter(e -> !e.isEmpty())
                    .distinct()
                    .count();
            if (distinct < 2) {
                violations.add(ValidationRule.COMPARISON_ENTITIES,
                        "comparison plans must name at least 2 distinct entities, got " + entities);
            }
            // Only judged when no step was dropped as malformed.
            if (drafts.size() == stepCount) {
                for (String entity : entities) {
                    String needle = entity.trim().toLowerCase(Locale.ROOT);
                    if (!needle.isEmpty() && drafts.stream().noneMatch(d -> mentions(d, needle))) {
                        violations.add(ValidationRule.COMPARISON_ENTITIES,
                                "entity '" + entity + "' is not covered by any step");
                    }
                }
            }
        }

        var expected = new LinkedHashMap<Integer, String>();
        drafts.forEach(d -> expected.put(d.stepNumber(), d.expectedOutput()));
        for (StepDraft draft : drafts) {
            for (int ref : StepReferences.symbolicReferences(draft.parameters())) {
                if (ref == Integer.MAX_VALUE) {
                    violations.add(ValidationRule.BACKWARD_REFERENCES, "step " + draft.stepNumber()
                            + " references a step number out of range; steps may only reference earlier steps");
                } else if (ref >= draft.stepNumber() || !expected.containsKey(ref)) {
                    violations.add(ValidationRule.BACKWARD_REFERENCES, "step " + draft.stepNumber()
                            + " references step " + ref + "; steps may only reference earlier steps");
                }
            }
        }
    }

    private StepDraft parseStep(Object raw, int position, Violations violations) {
        if (!(raw instanceof Map<?, ?> rawMap)) {
            violations.add(ValidationRule.REQUIRED_FIELDS, "step at position " + position + " must be an object");
            return null;
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> step = (Map<String, Object>) rawMap;
        String where = "step at position " + position;
        int before = violations.count();

        Integer stepNumber = requireInteger(step, "step_number", where, violations);
        String action = requireString(step, "action", where, violations);
        String toolName = requireString(step, "tool", where, violations);
        String expectedOutput = requireString(step, "expected_output", where, violations);
        Map<String, Object> parameters = null;
        Object rawParameters = step.get("parameters");
        if (rawParameters == null) {
            violations.add(ValidationRule.REQUIRED_FIELDS, where + " is missing field 'parameters'");
        } else if (!(rawParameters instanceof Map<?, ?> map)) {
            violations.add(ValidationRule.REQUIRED_FIELDS, where + " field 'parameters' must be an object");
        } else {
            parameters = new LinkedHashMap<>();
            for (var entry : map.entrySet()) {
                parameters.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        }
        boolean critical = optionalBoolean(step, "critical", true, where, violations);

        if (violations.count() > before) {
            return null;
        }
        ToolKind tool = ToolKind.fromWireName(toolName).orElse(null);
        return new StepDraft(position, stepNumber, action, tool, toolName, parameters, expectedOutput, critical);
    }

    private static boolean mentions(StepDraft draft, String needle) {
        return (draft.action() + " " + draft.parameters().values()).toLowerCase(Locale.ROOT).contains(needle);
    }

    private String availableTools() {
        return toolRegistry.registeredKinds().stream()
                .map(ToolKind::wireName)
                .collect(Collectors.joining(", "));
    }

    private static String requireString(Map<String, Object> source, String field, String where, Violations violations) {
        Object value = source.get(field);
        if (value == null) {
            violations.add(ValidationRule.REQUIRED_FIELDS, where + " is missing field '" + field + "'");
            return null;
        }
        if (!(value instanceof String s) || s.isBlank()) {
            violations.add(ValidationRule.REQUIRED_FIELDS, where + " field '" + field + "' must be a non-empty string");
            return null;
        }
        return s.trim();
    }

    private static Integer requireInteger(Map<String, Object> source, String field, String where, Violations violations) {
        Object value = source.get(field);
        if (value == null) {
            violations.add(ValidationRule.REQUIRED_FIELDS, where + " is missing field '" + field + "'");
            return null;
        }
        if (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) {
            return n.intValue();
        }
        violations.add(ValidationRule.REQUIRED_FIELDS, where + " field '" + field + "' must be an integer");
        return null;
    }

    private static boolean optionalBoolean(Map<String, Object> source, String field, boolean fallback,
                                           String where, Violations violations) {
        Object value = source.get(field);
        if (value == null) return fallback;
        if (value instanceof Boolean b) return b;
        violations.add(ValidationRule.REQUIRED_FIELDS, where + " field '" + field + "' must be a boolean");
        return fallback;
    }

    private static Set<String> optionalStrings(Map<String, Object> source, String field, Violations violations) {
        Object value = source.get(field);
        var out = new LinkedHashSet<String>();
        if (value == null) return out;
        if (!(value instanceof Collection<?> items)) {
            violations.add(ValidationRule.REQUIRED_FIELDS, "plan field '" + field + "' must be a list of strings");
            return out;
        }
        for (Object item : items) {
            if (item != null && !item.toString().isBlank()) {
                out.add(item.toString().trim());
            }
        }
        return out;
    }

    private record StepDraft(int position, int stepNumber, String action, ToolKind tool, String toolName,
                             Map<String, Object> parameters, String expectedOutput, boolean critical) {}

    private static final class Violations {
        private final ValidationMode mode;
        private final List<PlanViolation> found = new ArrayList<>();

        Violations(ValidationMode mode) {
            this.mode = mode;
        }

        void add(ValidationRule rule, String message) {
            found.add(new PlanViolation(rule, message));
            if (mode == ValidationMode.FIRST_VIOLATION) {
                throw new PlanValidationException(found);
            }
        }

        int count() {
            return found.size();
        }

        void throwIfAny() {
            if (!found.isEmpty()) {
                throw new PlanValidationException(found);
            }
        }
    }
}
