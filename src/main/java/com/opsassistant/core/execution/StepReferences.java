package com.opsassistant.core.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsassistant.core.model.Plan;
import com.opsassistant.core.model.PlanStep;
import com.opsassistant.tools.FaultCode;
import com.opsassistant.tools.ToolFaultException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds and resolves references from one step's parameters to earlier steps' output.
 * <p>
 * Recognised forms: {@code {{step2}}}, {@code {{step_2}}}, {@code {{step2.items.0.name}}}
 * and {@code ${step2}}. A parameter value that textually contains another
 * step's {@code expectedOutput} (case-insensitive) is also treated as
 * depending on that step, without substitution.
 */
public final class StepReferences {

    private static final Pattern REFERENCE = Pattern.compile(
            "\\{\\{\\s*step_?(\\d+)((?:\\.[\\w-]+)*)\\s*}}|\\$\\{\\s*step_?(\\d+)((?:\\.[\\w-]+)*)\\s*}");

    private static final ObjectMapper JSON = new ObjectMapper();

    private StepReferences() {}

    /**
     * Step numbers named by symbolic references anywhere in the parameter values.
     */
    public static Set<Integer> symbolicReferences(Map<String, Object> parameters) {
        var found = new TreeSet<Integer>();
        for (String text : strings(parameters.values())) {
            Matcher m = REFERENCE.matcher(text);
            while (m.find()) {
                found.add(stepNumber(m.group(1) != null ? m.group(1) : m.group(3)));
            }
        }
        return found;
    }

    /**
     * All steps the given step depends on.
     *
     * @param expectedOutputs expected output of every step in the plan, by step number
     */
    public static Set<Integer> dependencies(int stepNumber, Map<String, Object> parameters,
                                            Map<Integer, String> expectedOutputs) {
        var deps = new TreeSet<>(symbolicReferences(parameters));
        List<String> values = strings(parameters.values());
        expectedOutputs.forEach((other, expected) -> {
            if (other >= stepNumber || expected == null || expected.isBlank()) return;
            String needle = expected.trim().toLowerCase(Locale.ROOT);
            for (String value : values) {
                if (value.toLowerCase(Locale.ROOT).contains(needle)) {
                    deps.add(other);
                    return;
                }
            }
        });
        return deps;
    }

    /**
     * Dependency sets for every step of a plan, keyed by step number in plan order.
     */
    public static Map<Integer, Set<Integer>> dependencyGraph(Plan plan) {
        var expected = new LinkedHashMap<Integer, String>();
        plan.steps().forEach(s -> expected.put(s.stepNumber(), s.expectedOutput()));
        var graph = new LinkedHashMap<Integer, Set<Integer>>();
        for (PlanStep step : plan.steps()) {
            graph.put(step.stepNumber(), dependencies(step.stepNumber(), step.parameters(), expected));
        }
        return graph;
    }

    /**
     * Substitutes symbolic references with dependency data.
     * <p>
     * A value consisting of a single reference is replaced by the referenced
     * value itself; references embedded in longer text are rendered as text
     * (scalars verbatim, structures as compact JSON).
     *
     * @throws ToolFaultException with {@link FaultCode#INVALID_PARAMETERS} when a reference cannot be resolved
     */
    public static Map<String, Object> resolve(Map<String, Object> parameters, Map<Integer, Object> dataByStep) {
        var resolved = new LinkedHashMap<String, Object>();
        parameters.forEach((key, value) -> resolved.put(key, resolveValue(value, dataByStep)));
        return resolved;
    }

    private static Object resolveValue(Object value, Map<Integer, Object> dataByStep) {
        if (value instanceof String text) {
            return resolveText(text, dataByStep);
        }
        if (value instanceof Map<?, ?> map) {
            var out = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> out.put(String.valueOf(k), resolveValue(v, dataByStep)));
            return out;
        }
        if (value instanceof Collection<?> items) {
            var out = new ArrayList<Object>();
            items.forEach(item -> out.add(resolveValue(item, dataByStep)));
            return out;
        }
        return value;
    }

    private static Object resolveText(String text, Map<Integer, Object> dataByStep) {
        Matcher m = REFERENCE.matcher(text);
        if (m.matches()) {
            return lookup(m, dataByStep);
        }
        m.reset();
        var sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(render(lookup(m, dataByStep))));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static Object lookup(Matcher m, Map<Integer, Object> dataByStep) {
        int step = stepNumber(m.group(1) != null ? m.group(1) : m.group(3));
        String path = m.group(1) != null ? m.group(2) : m.group(4);
        if (!dataByStep.containsKey(step)) {
            throw new ToolFaultException(FaultCode.INVALID_PARAMETERS,
                    "Reference '" + m.group() + "' names step " + step + " which has no output");
        }
        Object current = dataByStep.get(step);
        if (path == null || path.isEmpty()) {
            return current;
        }
        for (String segment : path.substring(1).split("\\.")) {
            current = navigate(current, segment);
            if (current == null) {
                throw new ToolFaultException(FaultCode.INVALID_PARAMETERS,
                        "Reference '" + m.group() + "' could not be resolved at '" + segment + "'");
            }
        }
        return current;
    }

    /**
     * Maps are indexed by key and lists by position; a field name applied to a
     * list projects that field from every element.
     */
    private static Object navigate(Object current, String segment) {
        if (current instanceof Map<?, ?> map) {
            return map.get(segment);
        }
        if (current instanceof List<?> list) {
            if (segment.chars().allMatch(Character::isDigit)) {
                int index = Integer.parseInt(segment);
                return index < list.size() ? list.get(index) : null;
            }
            var projected = new ArrayList<Object>();
            for (Object item : list) {
                Object field = navigate(item, segment);
                if (field != null) projected.add(field);
            }
            return projected.isEmpty() ? null : projected;
        }
        return null;
    }

    /**
     * Parses the digits of a reference; numbers too large for an int saturate
     * to {@link Integer#MAX_VALUE}, which never names a step.
     */
    static int stepNumber(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    static String render(Object value) {
        if (value == null) return "";
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ToolFaultException(FaultCode.INTERNAL_ERROR,
                    "Could not render step output as JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static List<String> strings(Collection<?> values) {
        var out = new ArrayList<String>();
        for (Object value : values) {
            if (value instanceof String s) {
                out.add(s);
            } else if (value instanceof Map<?, ?> map) {
                out.addAll(strings(map.values()));
            } else if (value instanceof Collection<?> items) {
                out.addAll(strings(items));
            }
        }
        return out;
    }
}
