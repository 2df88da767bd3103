package com.opsassistant.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * What the user is asking for, as classified by the planner.
 */
public enum Intent {
    SEARCH,
    COMPARE,
    SUMMARIZE,
    MIXED;

    /** Wire name used in model-produced plans, e.g. {@code "compare"}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Intent> fromWireName(String raw) {
        if (raw == null) return Optional.empty();
        for (Intent intent : values()) {
            if (intent.wireName().equals(raw.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(intent);
            }
        }
        return Optional.empty();
    }
}
