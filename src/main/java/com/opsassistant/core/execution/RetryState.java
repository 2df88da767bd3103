package com.opsassistant.core.execution;

public enum RetryState {
    ATTEMPTING,
    BACKING_OFF,
    SUCCEEDED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == EXHAUSTED;
    }
}
