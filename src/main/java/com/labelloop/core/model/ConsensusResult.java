package com.labelloop.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * The single accepted caption for a task. Created exactly once per task and never changed.
 *
 * @param taskId                    the finalized task
 * @param predictionId              prediction the task was derived from
 * @param annotationId              the selected annotation
 * @param caption                   accepted caption
 * @param confidence                blend of agreement ratio and agreeing voters' reliability, in [0, 1]
 * @param agreementRatio            agreeing votes on the selected annotation over all votes on the task
 * @param lowConfidence             true when produced because the voting window ran out
 * @param contributingAnnotationIds selected annotation first, then annotations with the same caption
 * @param finalizedAt               when consensus was committed
 */
public record ConsensusResult(
    String taskId,
    String predictionId,
    String annotationId,
    String caption,
    double confidence,
    double agreementRatio,
    boolean lowConfidence,
    List<String> contributingAnnotationIds,
    Instant finalizedAt
) implements Serializable {

    public ConsensusResult {
        contributingAnnotationIds = List.copyOf(contributingAnnotationIds);
    }
}
