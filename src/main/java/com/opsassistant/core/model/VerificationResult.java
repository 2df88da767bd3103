package com.opsassistant.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Structured judgment over one (plan, execution result) pair.
 *
 * @param isComplete      every planned step produced a result and no critical step failed
 * @param isCorrect       complete and no anomaly was flagged
 * @param confidenceScore 0.0 to 1.0
 * @param issues          human-readable problems, in detection order
 * @param formattedOutput presentation of the results
 * @param summary         short description of what was accomplished
 * @param recommendations suggested follow-ups
 * @param qualityAssessed false when the model-assisted check was skipped
 */
public record VerificationResult(
    boolean isComplete,
    boolean isCorrect,
    double confidenceScore,
    List<String> issues,
    String formattedOutput,
    String summary,
    List<String> recommendations,
    boolean qualityAssessed
) implements Serializable {

    public VerificationResult {
        if (confidenceScore < 0.0 || confidenceScore > 1.0) {
            throw new IllegalArgumentException("confidenceScore must be within [0, 1]: " + confidenceScore);
        }
        issues = issues == null ? List.of() : List.copyOf(issues);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
