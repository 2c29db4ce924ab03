package com.labelloop.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a review task.
 * <pre>
 * PENDING -> ASSIGNED -> ANNOTATED -> VOTING -> CONSENSUS_REACHED
 * ASSIGNED | ANNOTATED | VOTING -> STALLED -> PENDING | MANUAL_REVIEW
 * </pre>
 */
public enum TaskStatus {
    PENDING,
    ASSIGNED,
    ANNOTATED,
    VOTING,
    CONSENSUS_REACHED,
    STALLED,
    MANUAL_REVIEW;   // retry budget exhausted, handed to a human reviewer outside the loop

    /** Statuses in which the task may still receive assignments. */
    public static final Set<TaskStatus> ASSIGNABLE = EnumSet.of(PENDING, ASSIGNED, ANNOTATED);

    /** Statuses the timeout sweep inspects. */
    public static final Set<TaskStatus> IN_PROGRESS = EnumSet.of(ASSIGNED, ANNOTATED, VOTING);

    public boolean isTerminal() {
        return this == CONSENSUS_REACHED || this == MANUAL_REVIEW;
    }

    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case PENDING -> target == ASSIGNED;
            case ASSIGNED -> target == ANNOTATED || target == VOTING || target == STALLED;
            case ANNOTATED -> target == VOTING || target == STALLED;
            case VOTING -> target == CONSENSUS_REACHED || target == STALLED;
            case STALLED -> target == PENDING || target == MANUAL_REVIEW;
            case CONSENSUS_REACHED, MANUAL_REVIEW -> false;
        };
    }
}
