package com.opsassistant.tools;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Typed accessors over the loosely typed parameter maps produced by the planner.
 * Every accessor raises {@link FaultCode#INVALID_PARAMETERS} on bad input.
 */
final class ToolParameters {

    private ToolParameters() {}

    static String requireString(Map<String, Object> parameters, String key) {
        String value = optionalString(parameters, key, null);
        if (value == null || value.isBlank()) {
            throw new ToolFaultException(FaultCode.INVALID_PARAMETERS,
                    "Missing required parameter '" + key + "'");
        }
        return value.trim();
    }

    static String optionalString(Map<String, Object> parameters, String key, String fallback) {
        Object value = parameters.get(key);
        if (value == null) return fallback;
        if (value instanceof Collection<?> || value instanceof Map<?, ?>) {
            throw new ToolFaultException(FaultCode.INVALID_PARAMETERS,
                    "Parameter '" + key + "' must be a string");
        }
        return value.toString();
    }

    static int optionalInt(Map<String, Object> parameters, String key, int fallback) {
        Object value = parameters.get(key);
        if (value == null) return fallback;
        if (value instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ToolFaultException(FaultCode.INVALID_PARAMETERS,
                    "Parameter '" + key + "' must be an integer, got '" + value + "'", e);
        }
    }

    /**
     * Reads a list parameter, accepting either a JSON array or a semicolon separated string.
     */
    static List<String> optionalStringList(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        List<String> values = new ArrayList<>();
        if (value == null) return values;
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item != null && !item.toString().isBlank()) {
                    values.add(item.toString().trim());
                }
            }
        } else {
            for (String part : value.toString().split(";|\\|")) {
                if (!part.isBlank()) values.add(part.trim());
            }
        }
        return values;
    }
}
