package com.labelloop.core.retraining;

import com.labelloop.core.config.LabelLoopProperties;
import com.labelloop.core.error.EntityNotFoundException;
import com.labelloop.core.model.BatchAccumulator;
import com.labelloop.core.model.BatchStatus;
import com.labelloop.core.model.BatchTrigger;
import com.labelloop.core.model.ConsensusResult;
import com.labelloop.core.model.RetrainingBatch;
import com.labelloop.core.store.RetrainingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Groups accepted consensus results into retraining batches and tracks their delivery.
 * <p>
 * A batch is emitted when the accumulator reaches the batch size, when a non-empty partial
 * batch grows older than the maximum age, or on manual request. Delivery is at-least-once:
 * {@link #poll()} hands out every pending batch and marks it sent, a sent batch not
 * acknowledged within the timeout goes back to pending, and acknowledgement is idempotent.
 * All state changes run under one trigger-wide lock.
 */
@Service
public class RetrainingTrigger {

    private static final Logger log = LoggerFactory.getLogger(RetrainingTrigger.class);

    private final RetrainingStore store;
    private final Clock clock;
    private final int batchSize;
    private final Duration maxBatchAge;
    private final Duration ackTimeout;
    private final ReentrantLock lock = new ReentrantLock();

    public RetrainingTrigger(RetrainingStore store, LabelLoopProperties properties, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.batchSize = properties.getRetraining().getBatchSize();
        this.maxBatchAge = properties.getRetraining().getMaxBatchAge();
        this.ackTimeout = properties.getRetraining().getAckTimeout();
        if (batchSize < 1) {
            throw new IllegalArgumentException("retraining batch size must be at least 1, was " + batchSize);
        }
    }

    /**
     * Counts a consensus result towards the next batch. A result counted before is not added
     * again, but a full accumulator left behind by a failed emission is still emitted.
     * <p>
     * The accumulator is written before the result is marked counted, so a storage failure at
     * any step leaves the result either pending or still uncounted, and a retry completes it.
     *
     * @return the batch emitted because the accumulator reached the batch size
     */
    public Optional<RetrainingBatch> onConsensus(ConsensusResult result) {
        lock.lock();
        try {
            String taskId = result.taskId();
            BatchAccumulator accumulator = store.accumulator();
            if (store.isCounted(taskId)) {
                log.debug("Consensus for task {} already counted towards a retraining batch", taskId);
            } else {
                if (!accumulator.contains(taskId)) {
                    accumulator = accumulator.plus(taskId, clock.instant());
                    store.saveAccumulator(accumulator);
                }
                store.markCounted(taskId);
                log.debug("Retraining accumulator at {}/{}", accumulator.size(), batchSize);
            }
            if (accumulator.size() >= batchSize) {
                return Optional.of(emit(accumulator, BatchTrigger.SIZE));
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Emits the partial batch if its oldest result has waited at least the maximum batch age.
     */
    public Optional<RetrainingBatch> emitIfAged() {
        lock.lock();
        try {
            BatchAccumulator accumulator = store.accumulator();
            if (accumulator.isEmpty()) {
                return Optional.empty();
            }
            Instant deadline = accumulator.oldestPendingAt().plus(maxBatchAge);
            if (clock.instant().isBefore(deadline)) {
                return Optional.empty();
            }
            return Optional.of(emit(accumulator, BatchTrigger.AGE));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Emits whatever is pending, regardless of size or age.
     *
     * @return the batch, or empty when nothing is pending
     */
    public Optional<RetrainingBatch> flush() {
        lock.lock();
        try {
            BatchAccumulator accumulator = store.accumulator();
            if (accumulator.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(emit(accumulator, BatchTrigger.MANUAL));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hands out every pending batch, oldest first, and marks each as sent.
     */
    public List<RetrainingBatch> poll() {
        lock.lock();
        try {
            Instant now = clock.instant();
            var offered = new ArrayList<RetrainingBatch>();
            for (RetrainingBatch batch : store.findBatches(EnumSet.of(BatchStatus.PENDING))) {
                RetrainingBatch sent = batch.offered(now);
                store.saveBatch(sent);
                offered.add(sent);
            }
            if (!offered.isEmpty()) {
                log.info("Offered {} retraining batch(es) to the training collaborator", offered.size());
            }
            return offered;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Acknowledges a batch. Acknowledging an acknowledged batch returns it unchanged.
     *
     * @throws EntityNotFoundException if no batch has the id
     */
    public RetrainingBatch acknowledge(String batchId) {
        lock.lock();
        try {
            RetrainingBatch batch = batch(batchId);
            if (batch.status() == BatchStatus.ACKNOWLEDGED) {
                log.debug("Batch {} already acknowledged", batchId);
                return batch;
            }
            RetrainingBatch acknowledged = batch.acknowledged(clock.instant());
            store.saveBatch(acknowledged);
            log.info("Retraining batch {} acknowledged after {} offer(s)", batchId, acknowledged.offerCount());
            return acknowledged;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts sent batches whose acknowledgement deadline has passed back on offer.
     *
     * @return the batches returned to pending
     */
    public List<RetrainingBatch> reofferExpired() {
        lock.lock();
        try {
            Instant now = clock.instant();
            var reoffered = new ArrayList<RetrainingBatch>();
            for (RetrainingBatch batch : store.findBatches(EnumSet.of(BatchStatus.SENT))) {
                if (isOverdue(batch, now)) {
                    RetrainingBatch pending = batch.reoffer();
                    store.saveBatch(pending);
                    reoffered.add(pending);
                    log.warn("Retraining batch {} not acknowledged within {}, offering again", batch.id(), ackTimeout);
                }
            }
            return reoffered;
        } finally {
            lock.unlock();
        }
    }

    public RetrainingBatch batch(String batchId) {
        return store.findBatch(batchId).orElseThrow(() -> new EntityNotFoundException("RetrainingBatch", batchId));
    }

    public int pendingCount() {
        return store.accumulator().size();
    }

    /** Sent batches past their acknowledgement deadline that the sweep has not re-offered yet. */
    public long overdueCount() {
        Instant now = clock.instant();
        return store.findBatches(EnumSet.of(BatchStatus.SENT)).stream()
                .filter(b -> isOverdue(b, now))
                .count();
    }

    public List<RetrainingBatch> unacknowledged() {
        return store.findBatches(EnumSet.of(BatchStatus.PENDING, BatchStatus.SENT));
    }

    private boolean isOverdue(RetrainingBatch batch, Instant now) {
        return batch.lastOfferedAt() != null && !now.isBefore(batch.lastOfferedAt().plus(ackTimeout));
    }

    private RetrainingBatch emit(BatchAccumulator accumulator, BatchTrigger trigger) {
        RetrainingBatch batch = RetrainingBatch.emit(UUID.randomUUID().toString(),
                accumulator.consensusTaskIds(), trigger, clock.instant());
        store.saveBatch(batch);
        store.saveAccumulator(BatchAccumulator.EMPTY);
        log.info("Retraining batch {} emitted ({}, {} result(s))", batch.id(), trigger, batch.size());
        return batch;
    }
}
