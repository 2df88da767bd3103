package com.opsassistant.tools;

/**
 * Whether retrying a failed tool call can help.
 */
public enum FaultClass {
    TRANSIENT,
    PERMANENT
}
