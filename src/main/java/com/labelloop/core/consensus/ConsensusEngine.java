package com.labelloop.core.consensus;

import com.labelloop.core.concurrency.EntityLocks;
import com.labelloop.core.config.LabelLoopProperties;
import com.labelloop.core.error.EntityNotFoundException;
import com.labelloop.core.error.InvalidStateTransitionException;
import com.labelloop.core.ledger.AnnotationLedger;
import com.labelloop.core.ledger.Captions;
import com.labelloop.core.ledger.VoteTally;
import com.labelloop.core.model.Annotation;
import com.labelloop.core.model.ConsensusResult;
import com.labelloop.core.model.Task;
import com.labelloop.core.model.TaskStatus;
import com.labelloop.core.reliability.AnnotatorRegistry;
import com.labelloop.core.store.ConsensusStore;
import com.labelloop.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides when a task in voting has reached consensus and produces its single result.
 * <p>
 * Consensus is reached when the task has at least {@code minVotes} votes and the agreement
 * ratio meets the threshold, or when the voting window has run out and some annotation has
 * an agreeing vote; the latter result is flagged low-confidence. The result is written
 * before the task status, both under the task lock. A stored result is authoritative: a
 * later call returns it and repairs the task status if that write was lost.
 */
@Service
public class ConsensusEngine {

    private static final Logger log = LoggerFactory.getLogger(ConsensusEngine.class);

    /**
     * A consensus result and whether this call created it.
     */
    public record ConsensusOutcome(ConsensusResult result, boolean created) {}

    /**
     * Current view of a task's votes against the trigger.
     *
     * @param tally          the votes
     * @param thresholdMet   enough votes and a high enough agreement ratio
     * @param windowElapsed  the voting window has run out
     */
    public record Evaluation(VoteTally tally, boolean thresholdMet, boolean windowElapsed) {
        public boolean ready() {
            return tally.leader().isPresent() && (thresholdMet || windowElapsed);
        }
    }

    private final EntityLocks locks;
    private final TaskStore taskStore;
    private final ConsensusStore consensusStore;
    private final AnnotationLedger ledger;
    private final AnnotatorRegistry registry;
    private final Clock clock;
    private final int minVotes;
    private final double agreementThreshold;
    private final Duration maxVotingWindow;
    private final double agreementWeight;

    public ConsensusEngine(EntityLocks locks, TaskStore taskStore, ConsensusStore consensusStore,
                           AnnotationLedger ledger, AnnotatorRegistry registry,
                           LabelLoopProperties properties, Clock clock) {
        this.locks = locks;
        this.taskStore = taskStore;
        this.consensusStore = consensusStore;
        this.ledger = ledger;
        this.registry = registry;
        this.clock = clock;
        LabelLoopProperties.Consensus consensus = properties.getConsensus();
        this.minVotes = consensus.getMinVotes();
        this.agreementThreshold = consensus.getAgreementThreshold();
        this.maxVotingWindow = consensus.getMaxVotingWindow();
        this.agreementWeight = consensus.getAgreementWeight();
    }

    /**
     * Finalizes the task if its trigger holds.
     *
     * @return the outcome, or empty when the task is not ready yet
     */
    public Optional<ConsensusOutcome> tryFinalize(String taskId) {
        return locks.tasks().withLock(taskId, () -> finalizeLocked(taskId, false));
    }

    /**
     * Finalizes the task, returning the existing result when it was finalized before.
     *
     * @throws InvalidStateTransitionException if the task is not in voting or its trigger does not hold
     * @throws EntityNotFoundException          if the task does not exist
     */
    public ConsensusOutcome finalizeConsensus(String taskId) {
        return locks.tasks().withLock(taskId, () -> finalizeLocked(taskId, true)).orElseThrow();
    }

    public Optional<ConsensusResult> result(String taskId) {
        return consensusStore.find(taskId);
    }

    /**
     * Evaluates the trigger for a task without finalizing it.
     */
    public Evaluation evaluate(Task task) {
        VoteTally tally = ledger.tally(task.id());
        Instant now = clock.instant();
        boolean thresholdMet = tally.totalVotes() >= minVotes && tally.agreementRatio() >= agreementThreshold;
        boolean windowElapsed = task.status() == TaskStatus.VOTING
                && !now.isBefore(task.statusChangedAt().plus(maxVotingWindow));
        return new Evaluation(tally, thresholdMet, windowElapsed);
    }

    /**
     * Confidence of a consensus: {@code w * ratio + (1 - w) * mean reliability} of the distinct
     * voters who agreed with the selected annotation.
     */
    public double confidence(VoteTally tally, String annotationId) {
        Set<String> voters = tally.agreeingVoters(annotationId);
        double meanReliability = voters.stream()
                .mapToDouble(id -> registry.getOrRegister(id).reliability())
                .average()
                .orElse(0.0);
        double blended = agreementWeight * tally.agreementRatio() + (1.0 - agreementWeight) * meanReliability;
        return Math.max(0.0, Math.min(1.0, blended));
    }

    private Optional<ConsensusOutcome> finalizeLocked(String taskId, boolean explicit) {
        Task task = taskStore.find(taskId).orElseThrow(() -> new EntityNotFoundException("Task", taskId));

        Optional<ConsensusResult> existing = consensusStore.find(taskId);
        if (existing.isPresent()) {
            repairStatus(task, existing.get());
            return Optional.of(new ConsensusOutcome(existing.get(), false));
        }
        if (task.status() != TaskStatus.VOTING) {
            if (explicit) {
                throw new InvalidStateTransitionException(taskId, task.status(), TaskStatus.CONSENSUS_REACHED);
            }
            return Optional.empty();
        }

        Evaluation evaluation = evaluate(task);
        if (!evaluation.ready()) {
            if (explicit) {
                throw new InvalidStateTransitionException(taskId, task.status(),
                        "consensus not reached: " + evaluation.tally().totalVotes() + " vote(s), agreement "
                                + String.format("%.3f", evaluation.tally().agreementRatio()));
            }
            return Optional.empty();
        }

        VoteTally tally = evaluation.tally();
        Annotation selected = tally.leader().orElseThrow().annotation();
        Instant now = clock.instant();
        var result = new ConsensusResult(
                taskId,
                task.predictionId(),
                selected.id(),
                selected.caption(),
                confidence(tally, selected.id()),
                tally.agreementRatio(),
                !evaluation.thresholdMet(),
                contributing(tally, selected),
                now);

        ConsensusResult stored = consensusStore.putIfAbsent(result);
        taskStore.save(task.withStatus(TaskStatus.CONSENSUS_REACHED, now));
        log.info("Consensus reached on task {}: \"{}\" (ratio {}, confidence {}{})",
                taskId, stored.caption(), String.format("%.3f", stored.agreementRatio()),
                String.format("%.3f", stored.confidence()), stored.lowConfidence() ? ", low confidence" : "");
        return Optional.of(new ConsensusOutcome(stored, stored == result));
    }

    private void repairStatus(Task task, ConsensusResult result) {
        if (task.status() == TaskStatus.CONSENSUS_REACHED) {
            return;
        }
        log.warn("Task {} has a consensus result but status {}; repairing", task.id(), task.status());
        Task repaired = new Task(task.id(), task.prediction(), task.difficulty(), TaskStatus.CONSENSUS_REACHED,
                task.createdAt(), result.finalizedAt(), task.round(), task.requiredAssignments(),
                task.retryCount(), task.annotationCount(), task.assignments());
        taskStore.save(repaired);
    }

    private static List<String> contributing(VoteTally tally, Annotation selected) {
        var ids = new ArrayList<String>();
        ids.add(selected.id());
        for (Annotation annotation : tally.annotations()) {
            if (!annotation.id().equals(selected.id()) && Captions.sameCaption(annotation.caption(), selected.caption())) {
                ids.add(annotation.id());
            }
        }
        return ids;
    }
}
