package com.opsassistant.core.execution;

import com.opsassistant.tools.FaultCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryStateMachineTest {

    private final RetryPolicy policy = new RetryPolicy(2, Duration.ofMillis(100), 2.0, Duration.ofSeconds(1));

    @Test
    @DisplayName("success on first attempt is terminal")
    void successIsTerminal() {
        var machine = new RetryStateMachine(policy);
        assertEquals(1, machine.beginAttempt());
        machine.onSuccess();
        assertEquals(RetryState.SUCCEEDED, machine.state());
        assertTrue(machine.state().isTerminal());
    }

    @Test
    @DisplayName("transient fault backs off while retries remain")
    void transientFaultBacksOff() {
        var machine = new RetryStateMachine(policy);
        machine.beginAttempt();
        assertEquals(RetryState.BACKING_OFF, machine.onFault(FaultCode.RATE_LIMITED));
        assertEquals(Duration.ofMillis(100), machine.nextDelay());
        machine.resume();

        assertEquals(2, machine.beginAttempt());
        assertEquals(RetryState.BACKING_OFF, machine.onFault(FaultCode.TRANSIENT_NETWORK_ERROR));
        assertEquals(Duration.ofMillis(200), machine.nextDelay());
        machine.resume();

        assertEquals(3, machine.beginAttempt());
        assertEquals(RetryState.EXHAUSTED, machine.onFault(FaultCode.TRANSIENT_NETWORK_ERROR));
        assertEquals(3, machine.attempts());
        assertEquals(FaultCode.TRANSIENT_NETWORK_ERROR, machine.lastFault());
    }

    @Test
    @DisplayName("permanent fault exhausts immediately")
    void permanentFaultExhausts() {
        var machine = new RetryStateMachine(policy);
        machine.beginAttempt();
        assertEquals(RetryState.EXHAUSTED, machine.onFault(FaultCode.UNAUTHORIZED));
        assertEquals(1, machine.attempts());
    }

    @Test
    @DisplayName("abort during backoff records the fault")
    void abortDuringBackoff() {
        var machine = new RetryStateMachine(policy);
        machine.beginAttempt();
        machine.onFault(FaultCode.RATE_LIMITED);
        machine.abort(FaultCode.CANCELLED);
        assertEquals(RetryState.EXHAUSTED, machine.state());
        assertEquals(FaultCode.CANCELLED, machine.lastFault());
    }

    @Test
    @DisplayName("illegal transitions are rejected")
    void illegalTransitions() {
        var machine = new RetryStateMachine(policy);
        assertThrows(IllegalStateException.class, machine::nextDelay);
        machine.beginAttempt();
        machine.onSuccess();
        assertThrows(IllegalStateException.class, machine::beginAttempt);
    }
}
