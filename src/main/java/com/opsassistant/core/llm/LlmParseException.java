package com.opsassistant.core.llm;

/**
 * Thrown when the model's response cannot be parsed into the requested shape.
 */
public class LlmParseException extends RuntimeException {

    private final String rawResponse;

    public LlmParseException(String message, String rawResponse, Throwable cause) {
        super(message, cause);
        this.rawResponse = rawResponse;
    }

    public String rawResponse() {
        return rawResponse;
    }
}
