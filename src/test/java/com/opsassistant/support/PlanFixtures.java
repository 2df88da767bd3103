package com.opsassistant.support;

import com.opsassistant.tools.Tool;
import com.opsassistant.tools.ToolKind;
import com.opsassistant.tools.ToolRegistry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw plan candidates in the snake_case shape the planner prompt asks the model for.
 */
public final class PlanFixtures {

    private PlanFixtures() {}

    public static Map<String, Object> step(int number, String tool, Map<String, Object> parameters) {
        var step = new HashMap<String, Object>();
        step.put("step_number", number);
        step.put("action", "Call " + tool + " " + parameters.values());
        step.put("tool", tool);
        step.put("parameters", parameters);
        step.put("expected_output", tool + " result " + number);
        return step;
    }

    public static Map<String, Object> plan(String intent, List<Map<String, Object>> steps) {
        var plan = new HashMap<String, Object>();
        plan.put("task_description", "Test task");
        plan.put("intent", intent);
        plan.put("steps", new ArrayList<>(steps));
        return plan;
    }

    public static Map<String, Object> weatherComparison(String... cities) {
        var steps = new ArrayList<Map<String, Object>>();
        for (int i = 0; i < cities.length; i++) {
            steps.add(step(i + 1, "weather", Map.of("city", cities[i])));
        }
        var plan = plan("compare", steps);
        plan.put("comparison_mode", true);
        plan.put("entities", List.of(cities));
        return plan;
    }

    /**
     * Registry with a no-op tool for every kind.
     */
    public static ToolRegistry allTools() {
        var tools = new ArrayList<Tool>();
        for (ToolKind kind : ToolKind.values()) {
            tools.add(new Tool() {
                @Override
                public ToolKind kind() {
                    return kind;
                }

                @Override
                public Object invoke(Map<String, Object> parameters) {
                    return Map.of();
                }
            });
        }
        return new ToolRegistry(tools);
    }
}
