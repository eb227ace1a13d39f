package com.calcifer.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a run executes, consumed by the CLI and any other reporting subscriber.
 *
 * @param eventType event type (e.g. "run.started", "step.started", "task.completed")
 * @param runId     the run this event belongs to
 * @param hostId    the host this event relates to (nullable for run- and step-level events)
 * @param taskName  the task this event relates to (nullable for run- and step-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record CalciferEvent(
    String eventType,
    String runId,
    String hostId,
    String taskName,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String RUN_STARTED = "run.started";
    public static final String STEP_STARTED = "step.started";
    public static final String STEP_EMPTY = "step.empty";
    public static final String TASK_STARTED = "task.started";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String RUN_ABORTED = "run.aborted";
    public static final String RUN_COMPLETED = "run.completed";

    public static CalciferEvent of(String eventType, String runId, Map<String, Object> payload) {
        return new CalciferEvent(eventType, runId, null, null, payload, Instant.now());
    }
}
