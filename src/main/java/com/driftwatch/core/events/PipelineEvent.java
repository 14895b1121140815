package com.driftwatch.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a controller or pipeline run.
 *
 * @param eventType event type (e.g. "run.started", "stage.completed", "drift.evaluated")
 * @param runId     the run this event belongs to
 * @param stage     lower-case stage name (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String runId,
    String stage,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static PipelineEvent of(String eventType, String runId, String stage, Map<String, Object> payload) {
        return new PipelineEvent(eventType, runId, stage, payload, Instant.now());
    }
}
