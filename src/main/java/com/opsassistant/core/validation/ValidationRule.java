package com.opsassistant.core.validation;

/**
 * Plan validation rules, in the order they are checked.
 */
public enum ValidationRule {
    REQUIRED_FIELDS,
    NON_EMPTY_STEPS,
    CONTIGUOUS_STEP_NUMBERS,
    REGISTERED_TOOL,
    REQUIRED_PARAMETERS,
    COMPARISON_ENTITIES,
    BACKWARD_REFERENCES
}
