package com.opsassistant.core.llm;

/**
 * Thrown when a call to the model backend fails before producing content.
 */
public class LlmUnavailableException extends RuntimeException {

    private final LlmFailure failure;

    public LlmUnavailableException(LlmFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public LlmFailure failure() {
        return failure;
    }
}
