package com.opsassistant.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a query moves through the pipeline.
 *
 * @param eventType  e.g. "plan.created", "step.retrying", "verification.degraded"
 * @param queryId    the query this event belongs to
 * @param stepNumber the step this event relates to (nullable for query-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String queryId,
    Integer stepNumber,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static PipelineEvent of(String eventType, String queryId, Map<String, Object> payload) {
        return new PipelineEvent(eventType, queryId, null, payload, Instant.now());
    }

    public static PipelineEvent forStep(String eventType, String queryId, int stepNumber, Map<String, Object> payload) {
        return new PipelineEvent(eventType, queryId, stepNumber, payload, Instant.now());
    }
}
