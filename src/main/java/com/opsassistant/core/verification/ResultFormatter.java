package com.opsassistant.core.verification;

import com.opsassistant.core.model.ExecutionResult;
import com.opsassistant.core.model.Plan;
import com.opsassistant.core.model.PlanStep;
import com.opsassistant.core.model.StepResult;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Plain-text presentation of execution results, used when the model did
 * not produce a formatted output.
 */
@Component
public class ResultFormatter {

    private static final String RULE = "=".repeat(60);
    private static final int PREVIEW_ITEMS = 3;

    public String format(Plan plan, ExecutionResult execution) {
        var sb = new StringBuilder();
        sb.append(RULE).append('\n')
                .append("EXECUTION RESULTS").append('\n')
                .append(RULE).append('\n');
        if (plan.taskDescription() != null) {
            sb.append("Task: ").append(plan.taskDescription()).append('\n');
        }
        sb.append("Overall Status: ").append(execution.success() ? "SUCCESS" : "FAILED").append('\n')
                .append("Steps Completed: ").append(execution.stepsCompleted()).append('\n')
                .append("Steps Failed: ").append(execution.stepsFailed()).append("\n\n");

        for (StepResult result : execution.results()) {
            sb.append("Step ").append(result.stepNumber()).append(": ").append(result.status());
            actionOf(plan, result.stepNumber()).ifPresent(a -> sb.append(" (").append(a).append(')'));
            sb.append('\n');
            if (result.data() != null) {
                sb.append("  Data: ").append(formatData(result.data())).append('\n');
            }
            if (result.error() != null) {
                sb.append("  Error: ").append(result.error()).append('\n');
            }
            sb.append('\n');
        }
        return sb.append(RULE).toString();
    }

    static String formatData(Object data) {
        if (data instanceof Collection<?> items) {
            if (items.isEmpty()) return "Empty list";
            List<String> shown = items.stream().limit(PREVIEW_ITEMS).map(ResultFormatter::formatItem).toList();
            String prefix = items.size() > PREVIEW_ITEMS
                    ? items.size() + " items (showing first " + PREVIEW_ITEMS + "): "
                    : items.size() + " items: ";
            return prefix + String.join(", ", shown);
        }
        return formatItem(data);
    }

    static String formatItem(Object item) {
        if (!(item instanceof Map<?, ?> map)) return String.valueOf(item);
        if (map.containsKey("city")) {
            Object temperature = map.get("temperature");
            Object unit = map.get("temperature_unit");
            String conditions = map.get("conditions") != null ? ", " + map.get("conditions") : "";
            return map.get("city") + " (" + (temperature != null ? temperature : "N/A")
                    + (unit != null ? unit : "") + conditions + ")";
        }
        if (map.containsKey("full_name") || map.containsKey("stars")) {
            Object name = map.containsKey("full_name") ? map.get("full_name") : map.get("name");
            return name + " (" + map.get("stars") + " stars)";
        }
        if (map.containsKey("name")) return String.valueOf(map.get("name"));
        if (map.containsKey("title")) {
            Object extract = map.get("extract");
            return map.get("title") + (extract != null && !extract.toString().isBlank() ? ": " + extract : "");
        }
        return map.entrySet().stream()
                .limit(4)
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", map.size() > 4 ? ", ...}" : "}"));
    }

    private static Optional<String> actionOf(Plan plan, int stepNumber) {
        return plan.steps().stream()
                .filter(s -> s.stepNumber() == stepNumber)
                .map(PlanStep::action)
                .findFirst();
    }
}
