package com.opsassistant.tools;

/**
 * Fault codes recorded on failed or partial step results.
 * <p>
 * The first five are raised by tools; the rest are assigned by the executor.
 */
public enum FaultCode {
    NOT_FOUND(FaultClass.PERMANENT),
    RATE_LIMITED(FaultClass.TRANSIENT),
    UNAUTHORIZED(FaultClass.PERMANENT),
    TRANSIENT_NETWORK_ERROR(FaultClass.TRANSIENT),
    INVALID_PARAMETERS(FaultClass.PERMANENT),
    CANCELLED(FaultClass.PERMANENT),
    DEPENDENCY_FAILED(FaultClass.PERMANENT),
    INTERNAL_ERROR(FaultClass.PERMANENT);

    private final FaultClass faultClass;

    FaultCode(FaultClass faultClass) {
        this.faultClass = faultClass;
    }

    public FaultClass faultClass() {
        return faultClass;
    }
}
