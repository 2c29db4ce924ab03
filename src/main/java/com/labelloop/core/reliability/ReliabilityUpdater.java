package com.labelloop.core.reliability;

import com.labelloop.core.concurrency.EntityLocks;
import com.labelloop.core.ledger.AnnotationLedger;
import com.labelloop.core.ledger.Captions;
import com.labelloop.core.ledger.VoteTally;
import com.labelloop.core.model.Annotation;
import com.labelloop.core.model.Annotator;
import com.labelloop.core.model.ConsensusResult;
import com.labelloop.core.model.Vote;
import com.labelloop.core.store.AnnotatorStore;
import com.labelloop.core.store.ConsensusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds consensus outcomes into annotator agreement counts.
 * <p>
 * Every annotation and every vote on a finalized task is one contribution. An author's
 * contribution matches when their caption normalizes to the accepted caption; a voter's
 * matches when they agreed with a matching annotation or disagreed with a non-matching one.
 * Each contribution is applied once, tracked per task and annotator in the {@link AnnotatorStore}
 * together with the counts it changed, so a replay after a partial failure only applies what
 * is missing.
 */
@Service
public class ReliabilityUpdater {

    private static final Logger log = LoggerFactory.getLogger(ReliabilityUpdater.class);

    /** Agreement and disagreement deltas for one annotator. */
    public record Contribution(long agreements, long disagreements) {
        Contribution plus(boolean matched) {
            return matched ? new Contribution(agreements + 1, disagreements)
                    : new Contribution(agreements, disagreements + 1);
        }
    }

    private final AnnotatorRegistry registry;
    private final AnnotatorStore annotatorStore;
    private final ConsensusStore consensusStore;
    private final AnnotationLedger ledger;
    private final EntityLocks locks;

    public ReliabilityUpdater(AnnotatorRegistry registry, AnnotatorStore annotatorStore,
                              ConsensusStore consensusStore, AnnotationLedger ledger, EntityLocks locks) {
        this.registry = registry;
        this.locks = locks;
        this.annotatorStore = annotatorStore;
        this.consensusStore = consensusStore;
        this.ledger = ledger;
    }

    /**
     * Applies a consensus result to every author and voter of its task.
     *
     * @return the applied deltas keyed by annotator id; empty if the result was applied before
     */
    public Map<String, Contribution> apply(ConsensusResult result) {
        return locks.tasks().withLock(result.taskId(), () -> applyLocked(result));
    }

    private Map<String, Contribution> applyLocked(ConsensusResult result) {
        if (annotatorStore.isConsensusApplied(result.taskId())) {
            log.debug("Consensus for task {} already applied to reliability", result.taskId());
            return Map.of();
        }
        Map<String, Contribution> deltas = contributions(result, ledger.tally(result.taskId()));
        var applied = new TreeMap<String, Contribution>();
        deltas.forEach((annotatorId, delta) -> {
            registry.getOrRegister(annotatorId);
            registry.recordOutcomes(result.taskId(), annotatorId, delta.agreements(), delta.disagreements())
                    .ifPresentOrElse(updated -> {
                        applied.put(annotatorId, delta);
                        log.info("Reliability of {} now {} ({} agreed / {} disagreed) after task {}",
                                annotatorId, String.format("%.3f", updated.reliability()),
                                updated.agreementCount(), updated.disagreementCount(), result.taskId());
                    }, () -> log.debug("Contribution of {} to task {} already applied", annotatorId, result.taskId()));
        });
        // contributions are marked one by one; this only short-circuits later replays
        annotatorStore.markConsensusApplied(result.taskId());
        return applied;
    }

    /**
     * Applies every stored consensus result not applied yet, then recomputes every
     * annotator's reliability from the stored counts.
     *
     * @return number of consensus results applied by this call
     */
    public int reconcile() {
        int applied = 0;
        for (ConsensusResult result : consensusStore.findAll()) {
            if (!annotatorStore.isConsensusApplied(result.taskId())) {
                apply(result);
                applied++;
            }
        }
        for (Annotator annotator : registry.all()) {
            registry.recompute(annotator.id());
        }
        log.info("Reliability reconciliation applied {} pending consensus result(s)", applied);
        return applied;
    }

    static Map<String, Contribution> contributions(ConsensusResult result, VoteTally tally) {
        var matching = new HashMap<String, Boolean>();
        var deltas = new TreeMap<String, Contribution>();
        for (Annotation annotation : tally.annotations()) {
            boolean matches = annotation.id().equals(result.annotationId())
                    || Captions.sameCaption(annotation.caption(), result.caption());
            matching.put(annotation.id(), matches);
            deltas.merge(annotation.annotatorId(), new Contribution(0, 0).plus(matches), ReliabilityUpdater::sum);
        }
        for (Vote vote : tally.votes()) {
            boolean annotationMatches = matching.getOrDefault(vote.annotationId(), false);
            boolean matched = vote.agree() == annotationMatches;
            deltas.merge(vote.voterId(), new Contribution(0, 0).plus(matched), ReliabilityUpdater::sum);
        }
        return deltas;
    }

    private static Contribution sum(Contribution a, Contribution b) {
        return new Contribution(a.agreements() + b.agreements(), a.disagreements() + b.disagreements());
    }
}
