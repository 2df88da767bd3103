package com.opsassistant.core.model;

import java.io.Serializable;

/**
 * The plan, execution and verification of a query that could be planned.
 *
 * @param totalTimeMs wall-clock time from accepting the query to the end of verification
 */
public record PipelineResult(
    String queryId,
    Plan plan,
    ExecutionResult execution,
    VerificationResult verification,
    long totalTimeMs
) implements Serializable {}
