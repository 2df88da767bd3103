package com.opsassistant.core.execution;

import com.opsassistant.tools.FaultClass;
import com.opsassistant.tools.FaultCode;

import java.time.Duration;

/**
 * Attempt bookkeeping for a single step.
 * <pre>
 * ATTEMPTING --success--------------------------&gt; SUCCEEDED
 * ATTEMPTING --transient fault, retries left----&gt; BACKING_OFF --resume--&gt; ATTEMPTING
 * ATTEMPTING --permanent fault or no retries----&gt; EXHAUSTED
 * BACKING_OFF --abort---------------------------&gt; EXHAUSTED
 * </pre>
 * Not thread-safe; each step execution owns its own instance.
 */
public final class RetryStateMachine {

    private final RetryPolicy policy;
    private RetryState state = RetryState.ATTEMPTING;
    private int attempts;
    private FaultCode lastFault;

    public RetryStateMachine(RetryPolicy policy) {
        this.policy = policy;
    }

    /** Marks the start of an attempt and returns its 1-based number. */
    public int beginAttempt() {
        require(RetryState.ATTEMPTING);
        return ++attempts;
    }

    public void onSuccess() {
        require(RetryState.ATTEMPTING);
        state = RetryState.SUCCEEDED;
    }

    public RetryState onFault(FaultCode code) {
        require(RetryState.ATTEMPTING);
        lastFault = code;
        boolean retriesLeft = attempts < policy.maxAttempts();
        state = RetryPolicy.classifyFault(code) == FaultClass.TRANSIENT && retriesLeft
                ? RetryState.BACKING_OFF
                : RetryState.EXHAUSTED;
        return state;
    }

    /** Delay before the pending retry. */
    public Duration nextDelay() {
        require(RetryState.BACKING_OFF);
        return policy.delayBeforeRetry(attempts);
    }

    public void resume() {
        require(RetryState.BACKING_OFF);
        state = RetryState.ATTEMPTING;
    }

    public void abort(FaultCode code) {
        lastFault = code;
        state = RetryState.EXHAUSTED;
    }

    public RetryState state() {
        return state;
    }

    public int attempts() {
        return attempts;
    }

    public FaultCode lastFault() {
        return lastFault;
    }

    private void require(RetryState expected) {
        if (state != expected) {
            throw new IllegalStateException("Expected state " + expected + " but was " + state);
        }
    }
}
