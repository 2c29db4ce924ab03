package com.labelloop.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A human reviewer and the statistics the engine keeps about them.
 *
 * @param id                    annotator identifier
 * @param reliability           current reliability in [0, 1], always derived from the counts
 * @param openTaskCount         assignments currently held
 * @param maxConcurrentTasks    capacity; an annotator at capacity is never assigned more work
 * @param agreementCount        contributions that matched a consensus outcome
 * @param disagreementCount     contributions that contradicted a consensus outcome
 * @param completedAnnotations  annotations submitted (throughput)
 * @param totalAnnotationMillis summed assignment-to-submission time over completed annotations
 * @param registeredAt          first time the engine saw this annotator
 */
public record Annotator(
    String id,
    double reliability,
    int openTaskCount,
    int maxConcurrentTasks,
    long agreementCount,
    long disagreementCount,
    long completedAnnotations,
    long totalAnnotationMillis,
    Instant registeredAt
) implements Serializable {

    public static Annotator register(String id, int maxConcurrentTasks, double prior, Instant now) {
        return new Annotator(id, prior, 0, requireCapacity(maxConcurrentTasks), 0, 0, 0, 0, now);
    }

    public static int requireCapacity(int maxConcurrentTasks) {
        if (maxConcurrentTasks < 1) {
            throw new IllegalArgumentException("maxConcurrentTasks must be at least 1, was " + maxConcurrentTasks);
        }
        return maxConcurrentTasks;
    }

    /** Changes capacity; open assignments above the new capacity are kept until released. */
    public Annotator withMaxConcurrentTasks(int capacity) {
        return new Annotator(id, reliability, openTaskCount, requireCapacity(capacity), agreementCount,
                disagreementCount, completedAnnotations, totalAnnotationMillis, registeredAt);
    }

    public boolean atCapacity() {
        return openTaskCount >= maxConcurrentTasks;
    }

    public double loadFraction() {
        return (double) openTaskCount / maxConcurrentTasks;
    }

    public Annotator withTaskOpened() {
        return new Annotator(id, reliability, openTaskCount + 1, maxConcurrentTasks, agreementCount,
                disagreementCount, completedAnnotations, totalAnnotationMillis, registeredAt);
    }

    public Annotator withTaskReleased() {
        return new Annotator(id, reliability, Math.max(0, openTaskCount - 1), maxConcurrentTasks,
                agreementCount, disagreementCount, completedAnnotations, totalAnnotationMillis, registeredAt);
    }

    public Annotator withAnnotationCompleted(long elapsedMillis) {
        return new Annotator(id, reliability, Math.max(0, openTaskCount - 1), maxConcurrentTasks,
                agreementCount, disagreementCount, completedAnnotations + 1,
                totalAnnotationMillis + Math.max(0, elapsedMillis), registeredAt);
    }

    public Annotator withCounts(long agreements, long disagreements, double recomputedReliability) {
        return new Annotator(id, recomputedReliability, openTaskCount, maxConcurrentTasks, agreements,
                disagreements, completedAnnotations, totalAnnotationMillis, registeredAt);
    }

    public Annotator withReliability(double recomputedReliability) {
        return withCounts(agreementCount, disagreementCount, recomputedReliability);
    }
}
