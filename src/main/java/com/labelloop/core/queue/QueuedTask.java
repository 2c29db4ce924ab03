package com.labelloop.core.queue;

import com.labelloop.core.model.Task;

import java.time.Instant;

/**
 * The slice of a task the queue needs to order it. Priority is never stored here;
 * it is computed from these fields at read time.
 */
public record QueuedTask(
    String taskId,
    String predictionId,
    double uncertainty,
    double difficulty,
    Instant createdAt
) {
    public static QueuedTask of(Task task) {
        return new QueuedTask(task.id(), task.predictionId(), task.uncertainty(), task.difficulty(), task.createdAt());
    }
}
