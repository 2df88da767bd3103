package com.opsassistant.core.planner;

import com.opsassistant.tools.ToolKind;
import com.opsassistant.tools.ToolRegistry;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the planning prompts. The tool catalogue is generated from the
 * registered tools so the model is never offered a tool the validator rejects.
 */
@Component
public class PlannerPrompts {

    private static final String ROLE = """
            You are the task planner of an operations assistant. Analyze the user's
            query and produce a structured execution plan that the assistant can run
            step by step with the tools below.
            """;

    private static final String FORMAT = """
            Respond with a JSON object in exactly this format:

            {
              "task_description": "Clear description of what the user wants to accomplish",
              "intent": "search|compare|summarize|mixed",
              "steps": [
                {
                  "step_number": 1,
                  "action": "Descriptive action to perform",
                  "tool": "%s",
                  "parameters": {"param_name": "param_value"},
                  "expected_output": "What this step should produce",
                  "critical": true
                }
              ],
              "comparison_mode": true|false,
              "entities": ["entity1", "entity2"]
            }

            Rules:
            1. Number steps contiguously starting at 1.
            2. Use only the tools listed above and always supply their required parameters.
            3. When comparing two or more things (cities, repositories, topics), set
               "intent" to "compare", "comparison_mode" to true and list every compared
               entity in "entities". Use one step per entity so the steps can run in parallel.
            4. A step may use the output of an EARLIER step by writing {{stepN}} or
               {{stepN.field}} inside a parameter value, e.g. {"topic": "{{step1.0.name}}"}.
            5. Set "critical" to false only for steps whose failure still leaves a useful answer.
            6. Infer reasonable optional parameters when the query does not state them.

            Example, query "Compare weather in London and Tokyo":
            {
              "task_description": "Compare current weather between London and Tokyo",
              "intent": "compare",
              "steps": [
                {"step_number": 1, "action": "Fetch current weather for London", "tool": "weather",
                 "parameters": {"city": "London", "units": "metric"}, "expected_output": "Weather data for London"},
                {"step_number": 2, "action": "Fetch current weather for Tokyo", "tool": "weather",
                 "parameters": {"city": "Tokyo", "units": "metric"}, "expected_output": "Weather data for Tokyo"}
              ],
              "comparison_mode": true,
              "entities": ["London", "Tokyo"]
            }

            Example, query "Tell me about machine learning and show me popular ML repos":
            {
              "task_description": "Explain machine learning and find popular ML repositories",
              "intent": "mixed",
              "steps": [
                {"step_number": 1, "action": "Get Wikipedia summary for machine learning", "tool": "wikipedia",
                 "parameters": {"topic": "Machine learning", "sentences": 3}, "expected_output": "Summary of machine learning"},
                {"step_number": 2, "action": "Search GitHub for popular machine learning repositories", "tool": "github",
                 "parameters": {"query": "machine learning", "sort": "stars", "limit": 5},
                 "expected_output": "List of popular ML repositories"}
              ],
              "comparison_mode": false,
              "entities": []
            }

            Respond with valid JSON only, without any explanatory text.
            """;

    private final ToolRegistry toolRegistry;

    public PlannerPrompts(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    public String systemPrompt() {
        var sb = new StringBuilder(ROLE).append("\nAvailable tools:\n");
        int index = 1;
        for (ToolKind kind : toolRegistry.registeredKinds()) {
            sb.append("\n").append(index++).append(". tool \"").append(kind.wireName()).append("\": ")
                    .append(kind.purpose()).append("\n   Parameters:\n");
            for (String doc : kind.parameterDocs()) {
                sb.append("   - ").append(doc).append("\n");
            }
            sb.append("   Example parameters: ").append(kind.example()).append("\n");
        }
        String toolNames = String.join("|", toolRegistry.registeredKinds().stream().map(ToolKind::wireName).toList());
        return sb.append("\n").append(FORMAT.formatted(toolNames)).toString();
    }

    public String userPrompt(String query, ComparisonHint hint) {
        var sb = new StringBuilder("Create an execution plan for this query: ").append(query.trim()).append("\n");
        if (hint.comparison()) {
            sb.append("\nHint: this looks like a comparison query (matched '").append(hint.trigger()).append("')");
            if (!hint.entities().isEmpty()) {
                sb.append("; possible entities: ").append(String.join(", ", hint.entities()));
            }
            sb.append(". Decide yourself whether comparison_mode applies.\n");
        }
        return sb.toString();
    }

    /**
     * Re-prompt after a rejected response, echoing what was wrong with it.
     */
    public String repairPrompt(String query, ComparisonHint hint, List<String> problems) {
        var sb = new StringBuilder(userPrompt(query, hint));
        sb.append("\nYour previous response was rejected for these reasons:\n");
        for (String problem : problems) {
            sb.append("- ").append(problem).append("\n");
        }
        sb.append("Return a corrected plan that fixes every problem listed above.\n");
        return sb.toString();
    }
}
