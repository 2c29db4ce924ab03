package com.labelloop.core.store;

import com.labelloop.core.model.Annotation;
import com.labelloop.core.model.Vote;

import java.util.List;
import java.util.Optional;

/**
 * Append-only storage for annotations and votes. Nothing is ever overwritten or removed.
 */
public interface LedgerStore {

    void appendAnnotation(Annotation annotation);

    void appendVote(Vote vote);

    Optional<Annotation> findAnnotation(String annotationId);

    /** Annotations of a task in append order. */
    List<Annotation> annotationsForTask(String taskId);

    /** Votes on any annotation of a task in append order. */
    List<Vote> votesForTask(String taskId);
}
