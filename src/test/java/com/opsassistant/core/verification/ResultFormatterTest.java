package com.opsassistant.core.verification;

import com.opsassistant.core.model.ExecutionResult;
import com.opsassistant.core.model.Intent;
import com.opsassistant.core.model.Plan;
import com.opsassistant.core.model.PlanStep;
import com.opsassistant.core.model.StepResult;
import com.opsassistant.tools.FaultCode;
import com.opsassistant.tools.ToolKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ResultFormatterTest {

    private final ResultFormatter formatter = new ResultFormatter();

    @Test
    @DisplayName("formats header, steps, data and errors")
    void format() {
        var plan = new Plan("Compare weather", Intent.COMPARE, List.of(
                new PlanStep(1, "Weather for London", ToolKind.WEATHER, Map.of("city", "London"), "London"),
                new PlanStep(2, "Weather for Paris", ToolKind.WEATHER, Map.of("city", "Paris"), "Paris")),
                true, Set.of("London", "Paris"));
        var execution = ExecutionResult.of(List.of(
                StepResult.success(1, Map.of("city", "London", "temperature", 12.0, "temperature_unit", "°C",
                        "conditions", "light rain"), 1, 5),
                StepResult.failed(2, FaultCode.UNAUTHORIZED, "Invalid API key", 1, 5)), List.of());

        String text = formatter.format(plan, execution);

        assertTrue(text.startsWith("=".repeat(60) + "\nEXECUTION RESULTS\n"));
        assertTrue(text.contains("Task: Compare weather"));
        assertTrue(text.contains("Overall Status: FAILED"));
        assertTrue(text.contains("Step 1: SUCCESS (Weather for London)"));
        assertTrue(text.contains("  Data: London (12.0°C, light rain)"));
        assertTrue(text.contains("Step 2: FAILED (Weather for Paris)"));
        assertTrue(text.contains("  Error: UNAUTHORIZED: Invalid API key"));
    }

    @Test
    @DisplayName("long lists show the first three items")
    void longList() {
        var repos = List.of(
                Map.of("full_name", "a/one", "stars", 5),
                Map.of("full_name", "a/two", "stars", 4),
                Map.of("full_name", "a/three", "stars", 3),
                Map.of("full_name", "a/four", "stars", 2));

        assertEquals("4 items (showing first 3): a/one (5 stars), a/two (4 stars), a/three (3 stars)",
                ResultFormatter.formatData(repos));
        assertEquals("Empty list", ResultFormatter.formatData(List.of()));
    }

    @Test
    @DisplayName("articles show title and extract")
    void article() {
        assertEquals("Java: A language.", ResultFormatter.formatItem(Map.of("title", "Java", "extract", "A language.")));
        assertEquals("42", ResultFormatter.formatItem(42));
    }
}
