package com.opsassistant.core.planner;

public enum PlanningFailure {
    /** The query was null or blank. */
    EMPTY_QUERY,
    /** The query is longer than {@link Planner#MAX_QUERY_LENGTH} characters. */
    QUERY_TOO_LONG,
    /** The query contains no letters, only digits or symbols. */
    INVALID_QUERY,
    /** The language model could not be reached (timeout, authentication, transport). */
    BACKEND_UNAVAILABLE,
    /** The model kept producing plans that fail validation. */
    INVALID_PLAN
}
