package com.labelloop.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One annotator's caption for a task. Immutable once submitted; a task may collect many.
 */
public record Annotation(
    String id,
    String taskId,
    String annotatorId,
    String caption,
    Instant submittedAt
) implements Serializable {}
