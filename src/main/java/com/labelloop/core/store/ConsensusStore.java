package com.labelloop.core.store;

import com.labelloop.core.model.ConsensusResult;
import com.labelloop.core.model.EvaluationReport;

import java.util.List;
import java.util.Optional;

/**
 * Durable table of consensus results keyed by task id, and the evaluation reports recorded
 * against them.
 */
public interface ConsensusStore {

    /**
     * Stores the result unless the task already has one.
     *
     * @return the stored result, which is the earlier one if the task was already finalized
     */
    ConsensusResult putIfAbsent(ConsensusResult result);

    Optional<ConsensusResult> find(String taskId);

    List<ConsensusResult> findAll();

    void appendEvaluation(EvaluationReport report);

    List<EvaluationReport> evaluationsFor(String taskId);
}
