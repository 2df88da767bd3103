package com.opsassistant.core.model;

/**
 * Outcome of a single executed plan step.
 */
public enum StepStatus {
    SUCCESS,
    FAILED,
    PARTIAL  // some data obtained, but the tool reported a fault for the rest
}
