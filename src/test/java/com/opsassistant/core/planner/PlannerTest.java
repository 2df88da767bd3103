package com.opsassistant.core.planner;

import com.opsassistant.core.llm.LlmFailure;
import com.opsassistant.core.llm.LlmParseException;
import com.opsassistant.core.llm.LlmService;
import com.opsassistant.core.llm.LlmUnavailableException;
import com.opsassistant.core.model.Plan;
import com.opsassistant.core.validation.PlanValidator;
import com.opsassistant.support.PlanFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static com.opsassistant.support.PlanFixtures.plan;
import static com.opsassistant.support.PlanFixtures.step;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class PlannerTest {

    private LlmService llmService;
    private PlannerProperties properties;
    private Planner planner;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        properties = new PlannerProperties();
        var registry = PlanFixtures.allTools();
        planner = new Planner(llmService, new PlanValidator(registry), new ComparisonDetector(),
                new PlannerPrompts(registry), properties);
    }

    @Test
    @DisplayName("valid first response becomes the plan")
    void validFirstResponse() {
        when(llmService.completeJson(anyString(), anyString(), anyInt()))
                .thenReturn(PlanFixtures.weatherComparison("London", "Paris"));

        Plan plan = planner.createPlan("Compare weather in London and Paris");

        assertEquals(2, plan.steps().size());
        assertTrue(plan.comparisonMode());
        verify(llmService, times(1)).completeJson(anyString(), anyString(), eq(2000));
    }

    @Test
    @DisplayName("invalid response is repaired and the second prompt lists the violations")
    void repairLoop() {
        Map<String, Object> invalid = plan("search", List.of(step(1, "weather", Map.of("units", "metric"))));
        when(llmService.completeJson(anyString(), anyString(), anyInt()))
                .thenReturn(invalid)
                .thenReturn(plan("search", List.of(step(1, "weather", Map.of("city", "Oslo")))));

        Plan plan = planner.createPlan("Weather in Oslo");

        assertEquals("Oslo", plan.step(1).parameters().get("city"));
        var userPrompts = ArgumentCaptor.forClass(String.class);
        verify(llmService, times(2)).completeJson(anyString(), userPrompts.capture(), anyInt());
        String second = userPrompts.getAllValues().get(1);
        assertTrue(second.contains("rejected for these reasons"));
        assertTrue(second.contains("REQUIRED_PARAMETERS"));
        assertTrue(second.contains("'city'"));
        assertFalse(userPrompts.getAllValues().get(0).contains("rejected"));
    }

    @Test
    @DisplayName("unparseable response is repaired too")
    void parseFailureRepaired() {
        when(llmService.completeJson(anyString(), anyString(), anyInt()))
                .thenThrow(new LlmParseException("not JSON", "Sure! Here is a plan", null))
                .thenReturn(plan("search", List.of(step(1, "wikipedia", Map.of("topic", "Oslo")))));

        assertEquals(1, planner.createPlan("Tell me about Oslo").steps().size());
    }

    @Test
    @DisplayName("repeated invalid responses fail with INVALID_PLAN and the violations")
    void exhaustedRepairs() {
        when(llmService.completeJson(anyString(), anyString(), anyInt()))
                .thenReturn(plan("search", List.of(step(1, "stocks", Map.of("symbol", "AAPL")))));

        var e = assertThrows(PlanningException.class, () -> planner.createPlan("AAPL price"));

        assertEquals(PlanningFailure.INVALID_PLAN, e.reason());
        assertEquals(1, e.details().size());
        assertTrue(e.details().get(0).startsWith("REGISTERED_TOOL"));
        verify(llmService, times(2)).completeJson(anyString(), anyString(), anyInt());
    }

    @Test
    @DisplayName("a reference to a step number beyond int range is repaired, not thrown")
    void oversizedStepReferenceRepaired() {
        Map<String, Object> oversized = plan("search", List.of(
                step(1, "weather", Map.of("city", "{{step99999999999}}"))));
        when(llmService.completeJson(anyString(), anyString(), anyInt()))
                .thenReturn(oversized)
                .thenReturn(plan("search", List.of(step(1, "weather", Map.of("city", "Oslo")))));

        Plan plan = planner.createPlan("Weather in Oslo");

        assertEquals("Oslo", plan.step(1).parameters().get("city"));
        var prompts = ArgumentCaptor.forClass(String.class);
        verify(llmService, times(2)).completeJson(anyString(), prompts.capture(), anyInt());
        assertTrue(prompts.getAllValues().get(1).contains("BACKWARD_REFERENCES"));
    }

    @Test
    @DisplayName("a repeated oversized step reference ends in INVALID_PLAN")
    void oversizedStepReferenceExhausted() {
        when(llmService.completeJson(anyString(), anyString(), anyInt()))
                .thenReturn(plan("search", List.of(step(1, "weather", Map.of("city", "${step_4294967296}")))));

        var e = assertThrows(PlanningException.class, () -> planner.createPlan("Weather in Oslo"));

        assertEquals(PlanningFailure.INVALID_PLAN, e.reason());
        assertTrue(e.details().get(0).startsWith("BACKWARD_REFERENCES"));
    }

    @Test
    @DisplayName("an unexpected validator error is treated as a rejected attempt")
    void validatorErrorRepaired() {
        var validator = mock(PlanValidator.class);
        var registry = PlanFixtures.allTools();
        var guarded = new Planner(llmService, validator, new ComparisonDetector(), new PlannerPrompts(registry),
                properties);
        when(llmService.completeJson(anyString(), anyString(), anyInt()))
                .thenReturn(plan("search", List.of(step(1, "weather", Map.of("city", "Oslo")))));
        when(validator.validate(anyMap(), any())).thenThrow(new IllegalStateException("boom"));

        var e = assertThrows(PlanningException.class, () -> guarded.createPlan("Weather in Oslo"));

        assertEquals(PlanningFailure.INVALID_PLAN, e.reason());
        assertTrue(e.getMessage().contains("boom"));
        verify(llmService, times(2)).completeJson(anyString(), anyString(), anyInt());
    }

    @Test
    @DisplayName("over-long and letterless queries are rejected without calling the model")
    void rejectedQueries() {
        var tooLong = assertThrows(PlanningException.class,
                () -> planner.createPlan("x".repeat(Planner.MAX_QUERY_LENGTH + 1)));
        var noLetters = assertThrows(PlanningException.class, () -> planner.createPlan("42 + 17 = ?"));

        assertEquals(PlanningFailure.QUERY_TOO_LONG, tooLong.reason());
        assertEquals(PlanningFailure.INVALID_QUERY, noLetters.reason());
        verifyNoInteractions(llmService);
    }

    @Test
    @DisplayName("the query is trimmed and a query at the length limit is accepted")
    void checkQueryTrims() {
        assertEquals("Weather in Oslo", Planner.checkQuery("  Weather in Oslo \n"));
        String atLimit = "a".repeat(Planner.MAX_QUERY_LENGTH);
        assertEquals(atLimit, Planner.checkQuery(" " + atLimit + " "));
    }

    @Test
    @DisplayName("repair attempts are configurable")
    void noRepairs() {
        properties.setRepairAttempts(0);
        when(llmService.completeJson(anyString(), anyString(), anyInt()))
                .thenReturn(plan("search", List.of()));

        assertThrows(PlanningException.class, () -> planner.createPlan("anything"));
        verify(llmService, times(1)).completeJson(anyString(), anyString(), anyInt());
    }

    @Test
    @DisplayName("unavailable backend fails immediately with BACKEND_UNAVAILABLE")
    void backendUnavailable() {
        when(llmService.completeJson(anyString(), anyString(), anyInt()))
                .thenThrow(new LlmUnavailableException(LlmFailure.TIMEOUT, "timed out", null));

        var e = assertThrows(PlanningException.class, () -> planner.createPlan("Weather in Oslo"));

        assertEquals(PlanningFailure.BACKEND_UNAVAILABLE, e.reason());
        verify(llmService, times(1)).completeJson(anyString(), anyString(), anyInt());
    }

    @Test
    @DisplayName("blank query fails with EMPTY_QUERY without calling the model")
    void emptyQuery() {
        var e = assertThrows(PlanningException.class, () -> planner.createPlan("   "));

        assertEquals(PlanningFailure.EMPTY_QUERY, e.reason());
        verifyNoInteractions(llmService);
    }
}
