package com.opsassistant.core.execution;

import com.opsassistant.core.model.Intent;
import com.opsassistant.core.model.Plan;
import com.opsassistant.core.model.PlanStep;
import com.opsassistant.tools.FaultCode;
import com.opsassistant.tools.ToolFaultException;
import com.opsassistant.tools.ToolKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StepReferencesTest {

    @Test
    @DisplayName("recognises all reference spellings")
    void symbolicReferences() {
        Map<String, Object> params = Map.of(
                "a", "{{step1}}",
                "b", "prefix {{step_2}} suffix",
                "c", "{{step3.items.0.name}}",
                "d", "${step4}",
                "e", List.of("{{ step5 }}"));

        assertEquals(Set.of(1, 2, 3, 4, 5), StepReferences.symbolicReferences(params));
    }

    @Test
    @DisplayName("plain text has no references")
    void noReferences() {
        assertTrue(StepReferences.symbolicReferences(Map.of("city", "London", "limit", 5)).isEmpty());
    }

    @Test
    @DisplayName("textual mention of an earlier expected output counts as a dependency")
    void textualDependency() {
        var expected = Map.of(1, "Top repository name", 2, "Weather data");
        Set<Integer> deps = StepReferences.dependencies(3,
                Map.of("topic", "the top repository name from github"), expected);
        assertEquals(Set.of(1), deps);
    }

    @Test
    @DisplayName("textual matches only point backwards")
    void textualDependencyIgnoresLaterSteps() {
        var expected = Map.of(1, "London", 2, "Paris");
        assertEquals(Set.of(), StepReferences.dependencies(1, Map.of("city", "Paris"), expected));
    }

    @Test
    @DisplayName("independent comparison steps have no dependencies")
    void dependencyGraph() {
        var plan = new Plan("Compare weather", Intent.COMPARE, List.of(
                new PlanStep(1, "London", ToolKind.WEATHER, Map.of("city", "London"), "Weather data for London"),
                new PlanStep(2, "Paris", ToolKind.WEATHER, Map.of("city", "Paris"), "Weather data for Paris"),
                new PlanStep(3, "Summary", ToolKind.WIKIPEDIA, Map.of("topic", "{{step1.city}}"), "Article")),
                true, Set.of("London", "Paris"));

        var graph = StepReferences.dependencyGraph(plan);

        assertEquals(List.of(1, 2, 3), List.copyOf(graph.keySet()));
        assertEquals(Set.of(), graph.get(1));
        assertEquals(Set.of(), graph.get(2));
        assertEquals(Set.of(1), graph.get(3));
    }

    @Test
    @DisplayName("a whole-value reference keeps the referenced type")
    void wholeValueReference() {
        var data = Map.<Integer, Object>of(1, List.of(Map.of("name", "spring-ai", "stars", 100)));

        var resolved = StepReferences.resolve(Map.of("items", "{{step1}}", "first", "{{step1.0.name}}"), data);

        assertEquals(data.get(1), resolved.get("items"));
        assertEquals("spring-ai", resolved.get("first"));
    }

    @Test
    @DisplayName("a field applied to a list projects it from every element")
    void projection() {
        var data = Map.<Integer, Object>of(1, List.of(Map.of("name", "a"), Map.of("name", "b")));

        var resolved = StepReferences.resolve(Map.of("names", "{{step1.name}}"), data);

        assertEquals(List.of("a", "b"), resolved.get("names"));
    }

    @Test
    @DisplayName("embedded references are rendered as text")
    void embeddedReference() {
        var data = Map.<Integer, Object>of(1, Map.of("city", "Paris", "temperature", 21.5));

        var resolved = StepReferences.resolve(
                Map.of("topic", "History of {{step1.city}} at ${step1.temperature} degrees"), data);

        assertEquals("History of Paris at 21.5 degrees", resolved.get("topic"));
    }

    @Test
    @DisplayName("unresolvable references fail with INVALID_PARAMETERS")
    void unresolvable() {
        var data = Map.<Integer, Object>of(1, Map.of("city", "Paris"));

        var missingStep = assertThrows(ToolFaultException.class,
                () -> StepReferences.resolve(Map.of("x", "{{step2}}"), data));
        assertEquals(FaultCode.INVALID_PARAMETERS, missingStep.code());

        var missingField = assertThrows(ToolFaultException.class,
                () -> StepReferences.resolve(Map.of("x", "{{step1.country}}"), data));
        assertEquals(FaultCode.INVALID_PARAMETERS, missingField.code());
    }

    @Test
    @DisplayName("step numbers beyond int range never name a step")
    void oversizedStepNumber() {
        assertEquals(Set.of(Integer.MAX_VALUE),
                StepReferences.symbolicReferences(Map.of("city", "{{step99999999999}}")));

        var e = assertThrows(ToolFaultException.class, () -> StepReferences.resolve(
                Map.of("city", "in {{step99999999999.name}}"), Map.<Integer, Object>of(1, "Paris")));
        assertEquals(FaultCode.INVALID_PARAMETERS, e.code());
        assertTrue(e.getMessage().contains("{{step99999999999.name}}"));
    }

    @Test
    @DisplayName("structures render as compact JSON")
    void renderJson() {
        assertEquals("{\"a\":1}", StepReferences.render(Map.of("a", 1)));
        assertEquals("", StepReferences.render(null));
    }
}
