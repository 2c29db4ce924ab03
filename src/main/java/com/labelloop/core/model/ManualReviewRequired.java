package com.labelloop.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Signal raised when a task exhausts its stall retry budget. It is an expected operational
 * outcome, delivered to the manual-review collaborator rather than thrown.
 *
 * @param taskId       the task leaving the automated loop
 * @param predictionId prediction the task was derived from
 * @param retryCount   stalls recorded, including the last one
 * @param stalledFrom  status the task was in when it stalled for the last time
 * @param raisedAt     when the signal was raised
 */
public record ManualReviewRequired(
    String taskId,
    String predictionId,
    int retryCount,
    TaskStatus stalledFrom,
    Instant raisedAt
) implements Serializable {}
