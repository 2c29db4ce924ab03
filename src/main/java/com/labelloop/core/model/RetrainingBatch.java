package com.labelloop.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Consensus results accepted since the previous batch, offered to the training collaborator
 * until acknowledged.
 *
 * @param id               batch identifier; acknowledgement is idempotent on it
 * @param consensusTaskIds task ids of the included consensus results, in acceptance order
 * @param trigger          what caused the batch to be emitted
 * @param status           delivery status
 * @param triggeredAt      emission time
 * @param offerCount       how many times the batch has been handed out by a poll
 * @param lastOfferedAt    time of the most recent offer, null before the first
 * @param acknowledgedAt   acknowledgement time, null until acknowledged
 */
public record RetrainingBatch(
    String id,
    List<String> consensusTaskIds,
    BatchTrigger trigger,
    BatchStatus status,
    Instant triggeredAt,
    int offerCount,
    Instant lastOfferedAt,
    Instant acknowledgedAt
) implements Serializable {

    public RetrainingBatch {
        consensusTaskIds = List.copyOf(consensusTaskIds);
    }

    public static RetrainingBatch emit(String id, List<String> consensusTaskIds, BatchTrigger trigger, Instant now) {
        return new RetrainingBatch(id, consensusTaskIds, trigger, BatchStatus.PENDING, now, 0, null, null);
    }

    public int size() {
        return consensusTaskIds.size();
    }

    public RetrainingBatch offered(Instant now) {
        return new RetrainingBatch(id, consensusTaskIds, trigger, BatchStatus.SENT, triggeredAt,
                offerCount + 1, now, null);
    }

    public RetrainingBatch reoffer() {
        return new RetrainingBatch(id, consensusTaskIds, trigger, BatchStatus.PENDING, triggeredAt,
                offerCount, lastOfferedAt, null);
    }

    public RetrainingBatch acknowledged(Instant now) {
        return new RetrainingBatch(id, consensusTaskIds, trigger, BatchStatus.ACKNOWLEDGED, triggeredAt,
                offerCount, lastOfferedAt, now);
    }
}
