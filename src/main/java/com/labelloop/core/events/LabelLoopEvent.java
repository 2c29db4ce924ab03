package com.labelloop.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the labeling engine.
 *
 * @param eventType event type (e.g. "task.created", "consensus.reached", "retraining.batch_ready")
 * @param taskId    the task this event relates to (nullable for batch-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record LabelLoopEvent(
    String eventType,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String TASK_CREATED = "task.created";
    public static final String TASK_ASSIGNED = "task.assigned";
    public static final String TASK_ANNOTATED = "task.annotated";
    public static final String TASK_VOTING = "task.voting";
    public static final String TASK_STALLED = "task.stalled";
    public static final String TASK_REQUEUED = "task.requeued";
    public static final String TASK_MANUAL_REVIEW = "task.manual_review";
    public static final String CONSENSUS_REACHED = "consensus.reached";
    public static final String BATCH_READY = "retraining.batch_ready";
    public static final String BATCH_REOFFERED = "retraining.batch_reoffered";
    public static final String BATCH_ACKNOWLEDGED = "retraining.batch_acknowledged";

    public LabelLoopEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    /** True for the last event a task ever produces. */
    public boolean isTerminal() {
        return CONSENSUS_REACHED.equals(eventType) || TASK_MANUAL_REVIEW.equals(eventType);
    }
}
