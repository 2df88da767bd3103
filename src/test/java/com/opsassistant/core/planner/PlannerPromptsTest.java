package com.opsassistant.core.planner;

import com.opsassistant.support.PlanFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlannerPromptsTest {

    private final PlannerPrompts prompts = new PlannerPrompts(PlanFixtures.allTools());

    @Test
    @DisplayName("system prompt lists every registered tool with its parameters")
    void systemPromptCatalogue() {
        String prompt = prompts.systemPrompt();

        assertTrue(prompt.contains("tool \"github\""));
        assertTrue(prompt.contains("tool \"weather\""));
        assertTrue(prompt.contains("tool \"wikipedia\""));
        assertTrue(prompt.contains("github|weather|wikipedia"));
        assertTrue(prompt.contains("step_number"));
        assertTrue(prompt.contains("cities (optional)"));
    }

    @Test
    @DisplayName("user prompt carries the comparison hint")
    void userPromptHint() {
        var hint = new ComparisonHint(true, "compare", List.of("London", "Paris"));

        String prompt = prompts.userPrompt("Compare London and Paris", hint);

        assertTrue(prompt.contains("Compare London and Paris"));
        assertTrue(prompt.contains("matched 'compare'"));
        assertTrue(prompt.contains("London, Paris"));
    }

    @Test
    @DisplayName("user prompt omits the hint for non-comparisons")
    void userPromptWithoutHint() {
        assertFalse(prompts.userPrompt("Weather in Oslo", ComparisonHint.none()).contains("Hint"));
    }

    @Test
    @DisplayName("repair prompt lists each problem")
    void repairPrompt() {
        String prompt = prompts.repairPrompt("Weather in Oslo", ComparisonHint.none(),
                List.of("REQUIRED_PARAMETERS: step 1 (weather) is missing required parameter 'city'", "second"));

        assertTrue(prompt.startsWith("Create an execution plan for this query: Weather in Oslo"));
        assertTrue(prompt.contains("rejected for these reasons"));
        assertTrue(prompt.contains("- REQUIRED_PARAMETERS: step 1 (weather) is missing required parameter 'city'"));
        assertTrue(prompt.contains("- second"));
    }
}
