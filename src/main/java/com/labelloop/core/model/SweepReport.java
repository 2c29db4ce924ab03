package com.labelloop.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Summary of one timeout sweep.
 *
 * @param stalledTaskIds              tasks that stalled during this sweep
 * @param requeuedTaskIds             stalled tasks returned to the queue
 * @param manualReview                tasks handed to manual review
 * @param lowConfidenceConsensusIds   tasks finalized because their voting window ran out
 * @param emittedBatchIds             retraining batches emitted because the partial batch aged out
 * @param reofferedBatchIds           batches put back on offer after the acknowledgement deadline
 */
public record SweepReport(
    List<String> stalledTaskIds,
    List<String> requeuedTaskIds,
    List<ManualReviewRequired> manualReview,
    List<String> lowConfidenceConsensusIds,
    List<String> emittedBatchIds,
    List<String> reofferedBatchIds
) implements Serializable {

    public SweepReport {
        stalledTaskIds = List.copyOf(stalledTaskIds);
        requeuedTaskIds = List.copyOf(requeuedTaskIds);
        manualReview = List.copyOf(manualReview);
        lowConfidenceConsensusIds = List.copyOf(lowConfidenceConsensusIds);
        emittedBatchIds = List.copyOf(emittedBatchIds);
        reofferedBatchIds = List.copyOf(reofferedBatchIds);
    }

    public boolean isEmpty() {
        return stalledTaskIds.isEmpty() && manualReview.isEmpty() && lowConfidenceConsensusIds.isEmpty()
                && emittedBatchIds.isEmpty() && reofferedBatchIds.isEmpty();
    }
}
