package com.opsassistant.core.model;

/**
 * How independent plan steps are dispatched.
 */
public enum ExecutionStrategy {
    SEQUENTIAL,
    PARALLEL
}
