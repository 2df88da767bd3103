package com.opsassistant.core.llm;

/**
 * Thrown when the model returns null or blank content instead of a response.
 */
public class LlmEmptyResponseException extends RuntimeException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
