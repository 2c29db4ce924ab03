package com.labelloop.core.store.memory;

import com.labelloop.core.model.Annotation;
import com.labelloop.core.model.Vote;
import com.labelloop.core.store.LedgerStore;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only {@link LedgerStore} kept in memory. Not durable across restarts.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final ConcurrentHashMap<String, Annotation> annotations = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Annotation>> annotationsByTask =
            new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Vote>> votesByTask = new ConcurrentHashMap<>();

    @Override
    public void appendAnnotation(Annotation annotation) {
        annotations.put(annotation.id(), annotation);
        annotationsByTask.computeIfAbsent(annotation.taskId(), k -> new CopyOnWriteArrayList<>()).add(annotation);
    }

    @Override
    public void appendVote(Vote vote) {
        votesByTask.computeIfAbsent(vote.taskId(), k -> new CopyOnWriteArrayList<>()).add(vote);
    }

    @Override
    public Optional<Annotation> findAnnotation(String annotationId) {
        return Optional.ofNullable(annotations.get(annotationId));
    }

    @Override
    public List<Annotation> annotationsForTask(String taskId) {
        var list = annotationsByTask.get(taskId);
        return list == null ? List.of() : List.copyOf(list);
    }

    @Override
    public List<Vote> votesForTask(String taskId) {
        var list = votesByTask.get(taskId);
        return list == null ? List.of() : List.copyOf(list);
    }

    public void close() {
        annotations.clear();
        annotationsByTask.clear();
        votesByTask.clear();
    }
}
