package com.labelloop.core.store;

import com.labelloop.core.model.BatchAccumulator;
import com.labelloop.core.model.BatchStatus;
import com.labelloop.core.model.RetrainingBatch;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Retraining trigger state: the pending-batch accumulator and every emitted batch.
 */
public interface RetrainingStore {

    BatchAccumulator accumulator();

    void saveAccumulator(BatchAccumulator accumulator);

    /**
     * Records that a consensus result has been counted towards a batch. Written only after the
     * accumulator holding the result has been saved.
     */
    void markCounted(String taskId);

    boolean isCounted(String taskId);

    void saveBatch(RetrainingBatch batch);

    Optional<RetrainingBatch> findBatch(String batchId);

    /** Batches with one of the given statuses, oldest emission first. */
    List<RetrainingBatch> findBatches(Set<BatchStatus> statuses);
}
