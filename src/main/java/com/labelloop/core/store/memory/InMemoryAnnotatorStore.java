package com.labelloop.core.store.memory;

import com.labelloop.core.error.EntityNotFoundException;
import com.labelloop.core.model.Annotator;
import com.labelloop.core.store.AnnotatorStore;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link AnnotatorStore} backed by concurrent maps. Not durable across restarts.
 */
public class InMemoryAnnotatorStore implements AnnotatorStore {

    private final ConcurrentHashMap<String, Annotator> annotators = new ConcurrentHashMap<>();
    private final Set<String> appliedConsensus = ConcurrentHashMap.newKeySet();
    private final Set<Contribution> appliedContributions = ConcurrentHashMap.newKeySet();

    private record Contribution(String taskId, String annotatorId) {}

    @Override
    public Optional<Annotator> find(String annotatorId) {
        return Optional.ofNullable(annotators.get(annotatorId));
    }

    @Override
    public Annotator insertIfAbsent(Annotator annotator) {
        Annotator existing = annotators.putIfAbsent(annotator.id(), annotator);
        return existing != null ? existing : annotator;
    }

    @Override
    public void save(Annotator annotator) {
        if (annotators.replace(annotator.id(), annotator) == null) {
            throw new EntityNotFoundException("Annotator", annotator.id());
        }
    }

    @Override
    public List<Annotator> findAll() {
        return annotators.values().stream()
                .sorted(Comparator.comparing(Annotator::id))
                .toList();
    }

    @Override
    public synchronized void saveContribution(String taskId, Annotator annotator) {
        save(annotator);
        appliedContributions.add(new Contribution(taskId, annotator.id()));
    }

    @Override
    public boolean isContributionApplied(String taskId, String annotatorId) {
        return appliedContributions.contains(new Contribution(taskId, annotatorId));
    }

    @Override
    public boolean markConsensusApplied(String taskId) {
        return appliedConsensus.add(taskId);
    }

    @Override
    public boolean isConsensusApplied(String taskId) {
        return appliedConsensus.contains(taskId);
    }

    public void close() {
        annotators.clear();
        appliedConsensus.clear();
        appliedContributions.clear();
    }
}
