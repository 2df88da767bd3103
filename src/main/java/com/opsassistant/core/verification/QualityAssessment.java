package com.opsassistant.core.verification;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The model's judgment of an execution, as returned by the quality check prompt.
 */
public record QualityAssessment(
    @JsonProperty("formatted_output") String formattedOutput,
    @JsonProperty("summary") String summary,
    @JsonProperty("issues") List<String> issues,
    @JsonProperty("recommendations") List<String> recommendations,
    @JsonProperty("confidence_score") Double confidenceScore
) {

    public QualityAssessment {
        issues = issues == null ? List.of() : issues.stream().filter(i -> i != null && !i.isBlank()).toList();
        recommendations = recommendations == null ? List.of()
                : recommendations.stream().filter(r -> r != null && !r.isBlank()).toList();
    }
}
