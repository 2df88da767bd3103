package com.opsassistant.core.verification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsassistant.core.llm.LlmProperties;
import com.opsassistant.core.llm.LlmService;
import com.opsassistant.core.model.ExecutionResult;
import com.opsassistant.core.model.Plan;
import com.opsassistant.core.model.PlanStep;
import com.opsassistant.core.model.StepResult;
import com.opsassistant.core.model.StepStatus;
import com.opsassistant.core.model.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Judges an execution against its plan.
 * <p>
 * Completeness is decided deterministically. Correctness combines the
 * deterministic anomaly checks with a model-assisted quality check; when the
 * model cannot be used, the result degrades to completeness only and is
 * still returned.
 */
@Service
public class Verifier {

    private static final Logger log = LoggerFactory.getLogger(Verifier.class);

    static final double DEGRADED_CONFIDENCE = 0.5;
    static final String SKIPPED_RECOMMENDATION = "Quality assessment was skipped because the language model "
            + "was unavailable; results were checked for completeness only.";

    private static final int MAX_PROMPT_RESULT_CHARS = 12_000;

    private static final String SYSTEM_PROMPT = """
            You are a verification assistant that validates the results of an executed plan.

            Your tasks:
            1. Check that every expected output from the plan is present in the results.
            2. Flag anomalies: physically implausible values (negative counts, temperatures far
               outside the range seen on Earth), contradictory fields, results unrelated to the request.
            3. Format the results in a clear, readable way for the user; for comparisons present
               the entities side by side.
            4. Summarize what was accomplished in one or two sentences.
            5. Suggest follow-up actions or improvements.

            Only list real problems under "issues"; leave it empty when the results look right.
            "confidence_score" is your confidence, between 0.0 and 1.0, that the results answer the request.
            """;

    private final LlmService llmService;
    private final AnomalyDetector anomalyDetector;
    private final ResultFormatter formatter;
    private final int maxTokens;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public Verifier(LlmService llmService, AnomalyDetector anomalyDetector, ResultFormatter formatter,
                    LlmProperties llmProperties) {
        this(llmService, anomalyDetector, formatter, llmProperties.getVerificationMaxTokens());
    }

    Verifier(LlmService llmService, AnomalyDetector anomalyDetector, ResultFormatter formatter, int maxTokens) {
        this.llmService = llmService;
        this.anomalyDetector = anomalyDetector;
        this.formatter = formatter;
        this.maxTokens = maxTokens;
    }

    public VerificationResult verify(Plan plan, ExecutionResult execution) {
        List<String> issues = new ArrayList<>();
        boolean complete = checkCompleteness(plan, execution, issues);
        List<String> anomalies = anomalyDetector.detect(execution);
        issues.addAll(anomalies);
        log.info("Verifying {} results: complete={}, {} issue(s), {} anomaly(ies)",
                execution.results().size(), complete, issues.size() - anomalies.size(), anomalies.size());

        QualityAssessment assessment;
        try {
            assessment = llmService.structuredCall(SYSTEM_PROMPT, userPrompt(plan, execution),
                    QualityAssessment.class, maxTokens);
        } catch (RuntimeException e) {
            log.warn("Quality assessment unavailable, falling back to completeness only: {}", e.getMessage());
            return degraded(plan, execution, complete, issues);
        }

        var allIssues = new LinkedHashSet<>(issues);
        allIssues.addAll(assessment.issues());
        boolean correct = complete && anomalies.isEmpty() && assessment.issues().isEmpty();
        double confidence = clamp(assessment.confidenceScore() != null ? assessment.confidenceScore() : DEGRADED_CONFIDENCE);
        String formatted = assessment.formattedOutput() != null && !assessment.formattedOutput().isBlank()
                ? assessment.formattedOutput()
                : formatter.format(plan, execution);
        String summary = assessment.summary() != null && !assessment.summary().isBlank()
                ? assessment.summary()
                : defaultSummary(plan, execution);

        log.info("Verification complete: complete={}, correct={}, confidence={}", complete, correct, confidence);
        return new VerificationResult(complete, correct, confidence, List.copyOf(allIssues), formatted, summary,
                assessment.recommendations(), true);
    }

    /**
     * Complete when every planned step has a result and no critical step failed.
     * Adds one issue per missing, failed or partial step.
     */
    boolean checkCompleteness(Plan plan, ExecutionResult execution, List<String> issues) {
        boolean complete = execution.results().size() == plan.steps().size();
        for (PlanStep step : plan.steps()) {
            StepResult result = execution.result(step.stepNumber());
            String label = "Step " + step.stepNumber() + " (" + step.action() + ")";
            if (result == null) {
                issues.add(label + " produced no result");
                complete = false;
            } else if (result.status() == StepStatus.FAILED) {
                if (step.critical()) {
                    issues.add(label + " failed: " + result.error());
                    complete = false;
                } else {
                    issues.add(label + " failed (non-critical): " + result.error());
                }
            } else if (result.status() == StepStatus.PARTIAL) {
                issues.add(label + " returned partial data: " + result.error());
            }
        }
        return complete;
    }

    private VerificationResult degraded(Plan plan, ExecutionResult execution, boolean complete, List<String> issues) {
        return new VerificationResult(complete, complete, DEGRADED_CONFIDENCE, issues,
                formatter.format(plan, execution), defaultSummary(plan, execution),
                List.of(SKIPPED_RECOMMENDATION), false);
    }

    private String userPrompt(Plan plan, ExecutionResult execution) {
        var planSummary = new LinkedHashMap<String, Object>();
        planSummary.put("task", plan.taskDescription());
        planSummary.put("intent", plan.intent().wireName());
        planSummary.put("comparison_mode", plan.comparisonMode());
        planSummary.put("entities", plan.entities());
        planSummary.put("steps", plan.steps().stream()
                .map(s -> Map.of("step_number", s.stepNumber(), "action", s.action(),
                        "expected_output", s.expectedOutput()))
                .toList());

        var results = new ArrayList<Map<String, Object>>();
        for (StepResult r : execution.results()) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("step_number", r.stepNumber());
            entry.put("status", r.status().name().toLowerCase());
            entry.put("data", r.data());
            entry.put("error", r.error());
            results.add(entry);
        }

        String resultJson = toJson(Map.of("success", execution.success(),
                "steps_completed", execution.stepsCompleted(),
                "steps_failed", execution.stepsFailed(),
                "results", results));
        if (resultJson.length() > MAX_PROMPT_RESULT_CHARS) {
            resultJson = resultJson.substring(0, MAX_PROMPT_RESULT_CHARS) + " ...(truncated)";
        }
        return "Please verify these execution results.\n\nPLAN:\n" + toJson(planSummary)
                + "\n\nEXECUTION RESULTS:\n" + resultJson;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Step data is not serializable as JSON", e);
        }
    }

    private static String defaultSummary(Plan plan, ExecutionResult execution) {
        return "Completed " + execution.stepsCompleted() + " of " + plan.steps().size() + " step(s) for: "
                + plan.taskDescription();
    }

    static double clamp(double score) {
        if (Double.isNaN(score)) return 0.0;
        return Math.max(0.0, Math.min(1.0, score));
    }
}
