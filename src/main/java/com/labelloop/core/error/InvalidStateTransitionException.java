package com.labelloop.core.error;

import com.labelloop.core.model.TaskStatus;

/**
 * Caller logic error: the requested operation is not allowed in the task's current state.
 * Never retried.
 */
public class InvalidStateTransitionException extends LabelLoopException {

    private final String taskId;
    private final TaskStatus current;

    public InvalidStateTransitionException(String taskId, TaskStatus current, TaskStatus target) {
        super("Task " + taskId + " cannot move from " + current + " to " + target);
        this.taskId = taskId;
        this.current = current;
    }

    public InvalidStateTransitionException(String taskId, TaskStatus current, String reason) {
        super("Task " + taskId + " (" + current + "): " + reason);
        this.taskId = taskId;
        this.current = current;
    }

    public String taskId() {
        return taskId;
    }

    public TaskStatus current() {
        return current;
    }
}
