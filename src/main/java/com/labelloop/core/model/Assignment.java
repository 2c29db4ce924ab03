package com.labelloop.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Outcome of a successful {@code assignNext} call.
 *
 * @param taskId      the task handed out
 * @param annotatorId the annotator who received it
 * @param score       the winning {@code reliability * (1 - load)} score
 * @param priority    task priority at the moment of assignment
 * @param assignedAt  assignment time
 */
public record Assignment(
    String taskId,
    String annotatorId,
    double score,
    double priority,
    Instant assignedAt
) implements Serializable {}
