package com.opsassistant.core.validation;

import java.io.Serializable;

public record PlanViolation(ValidationRule rule, String message) implements Serializable {

    @Override
    public String toString() {
        return rule + ": " + message;
    }
}
