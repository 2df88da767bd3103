package com.opsassistant.tools;

/**
 * Raised by a {@link Tool} when an invocation fails.
 * <p>
 * A fault may carry the data that was obtained before the failure (for
 * example a multi-city weather comparison where one city was not found);
 * the executor then records the step as partial.
 */
public class ToolFaultException extends RuntimeException {

    private final FaultCode code;
    private final transient Object partialData;

    public ToolFaultException(FaultCode code, String message) {
        this(code, message, null, null);
    }

    public ToolFaultException(FaultCode code, String message, Throwable cause) {
        this(code, message, null, cause);
    }

    public ToolFaultException(FaultCode code, String message, Object partialData, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.partialData = partialData;
    }

    public static ToolFaultException partial(FaultCode code, String message, Object partialData) {
        return new ToolFaultException(code, message, partialData, null);
    }

    public FaultCode code() {
        return code;
    }

    public Object partialData() {
        return partialData;
    }

    public boolean hasPartialData() {
        return partialData != null;
    }
}
