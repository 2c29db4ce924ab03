package com.labelloop.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One entry in a task's assignment history.
 *
 * @param annotatorId the annotator the event concerns
 * @param kind        what happened to the assignment
 * @param round       review round the event belongs to (starts at 1, incremented on each re-queue)
 * @param at          when it happened
 */
public record AssignmentEvent(
    String annotatorId,
    Kind kind,
    int round,
    Instant at
) implements Serializable {

    public enum Kind {
        ASSIGNED,
        SUBMITTED,
        RELEASED     // assignment dropped by a stall
    }
}
