package com.labelloop.core.store.memory;

import com.labelloop.core.model.BatchAccumulator;
import com.labelloop.core.model.BatchStatus;
import com.labelloop.core.model.RetrainingBatch;
import com.labelloop.core.store.RetrainingStore;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link RetrainingStore} kept in memory. Not durable across restarts.
 */
public class InMemoryRetrainingStore implements RetrainingStore {

    private final AtomicReference<BatchAccumulator> accumulator = new AtomicReference<>(BatchAccumulator.EMPTY);
    private final Set<String> counted = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<String, RetrainingBatch> batches = new ConcurrentHashMap<>();

    @Override
    public BatchAccumulator accumulator() {
        return accumulator.get();
    }

    @Override
    public void saveAccumulator(BatchAccumulator updated) {
        accumulator.set(updated);
    }

    @Override
    public void markCounted(String taskId) {
        counted.add(taskId);
    }

    @Override
    public boolean isCounted(String taskId) {
        return counted.contains(taskId);
    }

    @Override
    public void saveBatch(RetrainingBatch batch) {
        batches.put(batch.id(), batch);
    }

    @Override
    public Optional<RetrainingBatch> findBatch(String batchId) {
        return Optional.ofNullable(batches.get(batchId));
    }

    @Override
    public List<RetrainingBatch> findBatches(Set<BatchStatus> statuses) {
        return batches.values().stream()
                .filter(b -> statuses.contains(b.status()))
                .sorted(Comparator.comparing(RetrainingBatch::triggeredAt).thenComparing(RetrainingBatch::id))
                .toList();
    }

    public void close() {
        accumulator.set(BatchAccumulator.EMPTY);
        counted.clear();
        batches.clear();
    }
}
