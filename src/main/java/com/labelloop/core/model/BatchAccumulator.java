package com.labelloop.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Consensus results accepted since the last retraining batch.
 *
 * @param consensusTaskIds pending task ids in acceptance order
 * @param oldestPendingAt  acceptance time of the first pending result, null when empty
 */
public record BatchAccumulator(List<String> consensusTaskIds, Instant oldestPendingAt) implements Serializable {

    public static final BatchAccumulator EMPTY = new BatchAccumulator(List.of(), null);

    public BatchAccumulator {
        consensusTaskIds = List.copyOf(consensusTaskIds);
    }

    public int size() {
        return consensusTaskIds.size();
    }

    public boolean isEmpty() {
        return consensusTaskIds.isEmpty();
    }

    public boolean contains(String taskId) {
        return consensusTaskIds.contains(taskId);
    }

    public BatchAccumulator plus(String taskId, Instant acceptedAt) {
        var ids = new ArrayList<>(consensusTaskIds);
        ids.add(taskId);
        return new BatchAccumulator(ids, oldestPendingAt != null ? oldestPendingAt : acceptedAt);
    }
}
