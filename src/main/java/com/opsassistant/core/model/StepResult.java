package com.opsassistant.core.model;

import com.opsassistant.tools.FaultCode;

import java.io.Serializable;

/**
 * Result of executing one plan step, including all retries.
 *
 * @param stepNumber      the step this result belongs to
 * @param status          outcome
 * @param data            tool output; always null when FAILED
 * @param error           fault description; always null when SUCCESS
 * @param errorCode       fault code for FAILED and PARTIAL results
 * @param attempts        number of tool calls made (0 when the step was never dispatched)
 * @param executionTimeMs wall-clock time across all attempts and backoff sleeps
 */
public record StepResult(
    int stepNumber,
    StepStatus status,
    Object data,
    String error,
    FaultCode errorCode,
    int attempts,
    long executionTimeMs
) implements Serializable {

    public StepResult {
        if (status == StepStatus.FAILED && (data != null || error == null)) {
            throw new IllegalArgumentException("FAILED step " + stepNumber + " must have an error and no data");
        }
        if (status == StepStatus.SUCCESS && (error != null || errorCode != null)) {
            throw new IllegalArgumentException("SUCCESS step " + stepNumber + " must not carry an error");
        }
    }

    public static StepResult success(int stepNumber, Object data, int attempts, long elapsedMs) {
        return new StepResult(stepNumber, StepStatus.SUCCESS, data, null, null, attempts, elapsedMs);
    }

    public static StepResult partial(int stepNumber, Object data, FaultCode code, String message,
                                     int attempts, long elapsedMs) {
        return new StepResult(stepNumber, StepStatus.PARTIAL, data, describe(code, message),
                code, attempts, elapsedMs);
    }

    public static StepResult failed(int stepNumber, FaultCode code, String message,
                                    int attempts, long elapsedMs) {
        return new StepResult(stepNumber, StepStatus.FAILED, null, describe(code, message),
                code, attempts, elapsedMs);
    }

    public boolean isFailed() {
        return status == StepStatus.FAILED;
    }

    private static String describe(FaultCode code, String message) {
        String detail = message == null || message.isBlank() ? "no detail" : message;
        return code == null ? detail : code.name() + ": " + detail;
    }
}
