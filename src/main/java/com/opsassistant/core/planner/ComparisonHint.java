package com.opsassistant.core.planner;

import java.util.List;

/**
 * Heuristic signal that a query compares several entities.
 *
 * @param comparison whether the query looks like a comparison
 * @param trigger    the keyword or pattern that fired, null when none did
 * @param entities   candidate entity names found in the query, in query order
 */
public record ComparisonHint(boolean comparison, String trigger, List<String> entities) {

    public ComparisonHint {
        entities = List.copyOf(entities);
    }

    public static ComparisonHint none() {
        return new ComparisonHint(false, null, List.of());
    }
}
