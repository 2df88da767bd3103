package com.opsassistant.core.planner;

import java.util.List;

/**
 * Thrown when no valid plan can be produced for a query. Fatal to the invocation.
 */
public class PlanningException extends RuntimeException {

    private final PlanningFailure reason;
    private final List<String> details;

    public PlanningException(PlanningFailure reason, String message) {
        this(reason, message, List.of(), null);
    }

    public PlanningException(PlanningFailure reason, String message, List<String> details, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.details = List.copyOf(details);
    }

    public PlanningFailure reason() {
        return reason;
    }

    /** Validation violations or parse errors from the last attempt, if any. */
    public List<String> details() {
        return details;
    }
}
