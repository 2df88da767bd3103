package com.opsassistant.core.model;

import java.io.Serializable;
import java.util.Comparator;
import java.util.List;

/**
 * Aggregated outcome of running a plan.
 * <p>
 * Always holds exactly one {@link StepResult} per planned step, sorted by
 * step number, even when steps failed or were cancelled.
 *
 * @param success        true iff no step failed
 * @param stepsCompleted SUCCESS and PARTIAL results
 * @param stepsFailed    FAILED results
 * @param results        per-step results in planned order
 * @param executionLog   log lines in completion order, each naming its step
 */
public record ExecutionResult(
    boolean success,
    int stepsCompleted,
    int stepsFailed,
    List<StepResult> results,
    List<String> executionLog
) implements Serializable {

    public ExecutionResult {
        results = results == null ? List.of() : List.copyOf(results);
        executionLog = executionLog == null ? List.of() : List.copyOf(executionLog);
        if (stepsCompleted + stepsFailed != results.size()) {
            throw new IllegalArgumentException("Completed (" + stepsCompleted + ") + failed (" + stepsFailed
                    + ") must equal result count " + results.size());
        }
        if (success != (stepsFailed == 0)) {
            throw new IllegalArgumentException("success must be true iff no step failed");
        }
    }

    /**
     * Builds a result from per-step outcomes, sorting them into planned order
     * and deriving the counters.
     */
    public static ExecutionResult of(List<StepResult> results, List<String> executionLog) {
        var ordered = results.stream()
                .sorted(Comparator.comparingInt(StepResult::stepNumber))
                .toList();
        int failed = (int) ordered.stream().filter(StepResult::isFailed).count();
        return new ExecutionResult(failed == 0, ordered.size() - failed, failed, ordered, executionLog);
    }

    public StepResult result(int stepNumber) {
        return results.stream()
                .filter(r -> r.stepNumber() == stepNumber)
                .findFirst()
                .orElse(null);
    }
}
