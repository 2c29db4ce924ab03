package com.labelloop.core.store.memory;

import com.labelloop.core.model.ConsensusResult;
import com.labelloop.core.model.EvaluationReport;
import com.labelloop.core.store.ConsensusStore;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ConsensusStore} backed by concurrent maps. Not durable across restarts.
 */
public class InMemoryConsensusStore implements ConsensusStore {

    private final ConcurrentHashMap<String, ConsensusResult> results = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<EvaluationReport>> evaluations =
            new ConcurrentHashMap<>();

    @Override
    public ConsensusResult putIfAbsent(ConsensusResult result) {
        ConsensusResult existing = results.putIfAbsent(result.taskId(), result);
        return existing != null ? existing : result;
    }

    @Override
    public Optional<ConsensusResult> find(String taskId) {
        return Optional.ofNullable(results.get(taskId));
    }

    @Override
    public List<ConsensusResult> findAll() {
        return results.values().stream()
                .sorted(Comparator.comparing(ConsensusResult::finalizedAt).thenComparing(ConsensusResult::taskId))
                .toList();
    }

    @Override
    public void appendEvaluation(EvaluationReport report) {
        evaluations.computeIfAbsent(report.taskId(), k -> new CopyOnWriteArrayList<>()).add(report);
    }

    @Override
    public List<EvaluationReport> evaluationsFor(String taskId) {
        var list = evaluations.get(taskId);
        return list == null ? List.of() : List.copyOf(list);
    }

    public void close() {
        results.clear();
        evaluations.clear();
    }
}
