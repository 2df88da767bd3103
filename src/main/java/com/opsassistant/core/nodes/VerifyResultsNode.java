package com.opsassistant.core.nodes;

import com.opsassistant.core.events.EventBus;
import com.opsassistant.core.events.PipelineEvent;
import com.opsassistant.core.metrics.PipelineMetrics;
import com.opsassistant.core.model.ExecutionResult;
import com.opsassistant.core.model.Plan;
import com.opsassistant.core.model.VerificationResult;
import com.opsassistant.core.state.PipelineState;
import com.opsassistant.core.verification.Verifier;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Final pipeline stage: judges the execution against the plan.
 */
@Component
public class VerifyResultsNode {

    private final Verifier verifier;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;

    public VerifyResultsNode(Verifier verifier, EventBus eventBus, PipelineMetrics metrics) {
        this.verifier = verifier;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(PipelineState state) {
        Plan plan = state.plan().orElseThrow(
                () -> new IllegalStateException("Plan must be present before verification"));
        ExecutionResult execution = state.executionResult().orElseThrow(
                () -> new IllegalStateException("Execution result must be present before verification"));

        VerificationResult result = verifier.verify(plan, execution);
        metrics.recordVerification(result.isComplete(), result.isCorrect(), result.qualityAssessed());
        eventBus.publish(PipelineEvent.of(
                result.qualityAssessed() ? "verification.completed" : "verification.degraded",
                state.queryId(),
                Map.of("complete", result.isComplete(),
                        "correct", result.isCorrect(),
                        "confidence", result.confidenceScore(),
                        "issues", result.issues().size())));
        return Map.of("verificationResult", result);
    }
}
