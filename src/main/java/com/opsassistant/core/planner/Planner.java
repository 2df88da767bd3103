package com.opsassistant.core.planner;

import com.opsassistant.core.llm.LlmEmptyResponseException;
import com.opsassistant.core.llm.LlmParseException;
import com.opsassistant.core.llm.LlmService;
import com.opsassistant.core.llm.LlmUnavailableException;
import com.opsassistant.core.model.Plan;
import com.opsassistant.core.validation.PlanValidationException;
import com.opsassistant.core.validation.PlanValidator;
import com.opsassistant.core.validation.PlanViolation;
import com.opsassistant.core.validation.ValidationMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Turns a natural-language query into a validated {@link Plan}.
 * <p>
 * The model's response is validated with every rule reported; a rejected
 * response is re-prompted with the violations, up to
 * {@code ops.planner.repair-attempts} times.
 */
@Service
public class Planner {

    private static final Logger log = LoggerFactory.getLogger(Planner.class);

    public static final int MAX_QUERY_LENGTH = 1000;

    private final LlmService llmService;
    private final PlanValidator validator;
    private final ComparisonDetector comparisonDetector;
    private final PlannerPrompts prompts;
    private final PlannerProperties properties;

    public Planner(LlmService llmService, PlanValidator validator, ComparisonDetector comparisonDetector,
                   PlannerPrompts prompts, PlannerProperties properties) {
        this.llmService = llmService;
        this.validator = validator;
        this.comparisonDetector = comparisonDetector;
        this.prompts = prompts;
        this.properties = properties;
    }

    /**
     * Rejects queries the model should not be asked to plan.
     *
     * @return the trimmed query
     * @throws PlanningException with {@link PlanningFailure#EMPTY_QUERY},
     *         {@link PlanningFailure#QUERY_TOO_LONG} or {@link PlanningFailure#INVALID_QUERY}
     */
    public static String checkQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new PlanningException(PlanningFailure.EMPTY_QUERY, "Query must not be empty");
        }
        String trimmed = query.trim();
        if (trimmed.length() > MAX_QUERY_LENGTH) {
            throw new PlanningException(PlanningFailure.QUERY_TOO_LONG,
                    "Query is too long (" + trimmed.length() + " characters); keep it under "
                            + MAX_QUERY_LENGTH + " characters");
        }
        if (trimmed.chars().noneMatch(Character::isLetter)) {
            throw new PlanningException(PlanningFailure.INVALID_QUERY,
                    "Query must contain words, not just numbers or symbols");
        }
        return trimmed;
    }

    public Plan createPlan(String rawQuery) {
        String query = checkQuery(rawQuery);

        ComparisonHint hint = comparisonDetector.detect(query);
        log.info("Planning query ({} chars, comparison hint: {})", query.length(), hint.comparison());

        String systemPrompt = prompts.systemPrompt();
        String userPrompt = prompts.userPrompt(query, hint);
        int attempts = 1 + Math.max(0, properties.getRepairAttempts());
        List<String> problems = List.of();

        for (int attempt = 1; attempt <= attempts; attempt++) {
            Map<String, Object> candidate;
            try {
                candidate = llmService.completeJson(systemPrompt, userPrompt, properties.getMaxTokens());
            } catch (LlmUnavailableException e) {
                throw new PlanningException(PlanningFailure.BACKEND_UNAVAILABLE,
                        "Language model unavailable while planning: " + e.getMessage(), List.of(), e);
            } catch (LlmParseException | LlmEmptyResponseException e) {
                problems = List.of("The response was not a single valid JSON object (" + e.getMessage() + ")");
                log.warn("Plan attempt {}/{} unparseable: {}", attempt, attempts, e.getMessage());
                userPrompt = prompts.repairPrompt(query, hint, problems);
                continue;
            }

            try {
                Plan plan = validator.validate(candidate, ValidationMode.COLLECT_ALL);
                if (hint.comparison() && !plan.comparisonMode()) {
                    log.debug("Comparison hint '{}' not adopted by the plan", hint.trigger());
                }
                log.info("Plan created on attempt {}: intent={}, {} steps, comparison={}",
                        attempt, plan.intent().wireName(), plan.steps().size(), plan.comparisonMode());
                return plan;
            } catch (PlanValidationException e) {
                problems = e.violations().stream().map(PlanViolation::toString).toList();
                log.warn("Plan attempt {}/{} rejected with {} violation(s): {}",
                        attempt, attempts, problems.size(), problems);
                userPrompt = prompts.repairPrompt(query, hint, problems);
            } catch (RuntimeException e) {
                problems = List.of("The plan could not be checked (" + e.getMessage() + ")");
                log.warn("Plan attempt {}/{} could not be validated", attempt, attempts, e);
                userPrompt = prompts.repairPrompt(query, hint, problems);
            }
        }

        throw new PlanningException(PlanningFailure.INVALID_PLAN,
                "Could not produce a valid plan after " + attempts + " attempt(s): " + String.join("; ", problems),
                problems, null);
    }
}
