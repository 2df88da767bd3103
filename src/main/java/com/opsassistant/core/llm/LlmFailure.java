package com.opsassistant.core.llm;

/**
 * Why the model backend could not be reached.
 */
public enum LlmFailure {
    TIMEOUT,
    AUTHENTICATION,
    UNAVAILABLE,
    REJECTED,
    TRANSPORT
}
