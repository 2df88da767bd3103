package com.opsassistant.core.validation;

public enum ValidationMode {
    /** Report every violated rule. */
    COLLECT_ALL,
    /** Stop at the first violation. */
    FIRST_VIOLATION
}
