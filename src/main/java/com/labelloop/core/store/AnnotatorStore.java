package com.labelloop.core.store;

import com.labelloop.core.model.Annotator;

import java.util.List;
import java.util.Optional;

/**
 * Durable table of annotators plus the set of consensus results already folded into their counts.
 */
public interface AnnotatorStore {

    Optional<Annotator> find(String annotatorId);

    /** Stores the annotator unless one with the same id exists; returns whichever is stored. */
    Annotator insertIfAbsent(Annotator annotator);

    void save(Annotator annotator);

    List<Annotator> findAll();

    /**
     * Saves an annotator whose counts now include its contribution to the task's consensus,
     * and records that contribution as applied, in one write.
     */
    void saveContribution(String taskId, Annotator annotator);

    boolean isContributionApplied(String taskId, String annotatorId);

    /**
     * Records that the consensus result of a task has been applied to every contributor.
     *
     * @return true if this call recorded it, false if it had been recorded before
     */
    boolean markConsensusApplied(String taskId);

    boolean isConsensusApplied(String taskId);
}
