package com.labelloop.core.ledger;

import com.labelloop.core.error.DuplicateVoteException;
import com.labelloop.core.error.EntityNotFoundException;
import com.labelloop.core.error.SelfVoteException;
import com.labelloop.core.model.Annotation;
import com.labelloop.core.model.Vote;
import com.labelloop.core.store.LedgerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only record of captions and review votes per task.
 * <p>
 * Concurrent submissions for one task are all kept. Callers serialise writes per task
 * (the engine holds the task lock) so the self-vote and duplicate-vote checks see a
 * consistent ledger.
 */
@Service
public class AnnotationLedger {

    private static final Logger log = LoggerFactory.getLogger(AnnotationLedger.class);

    private final LedgerStore store;

    public AnnotationLedger(LedgerStore store) {
        this.store = store;
    }

    public Annotation appendAnnotation(String taskId, String annotatorId, String caption, Instant now) {
        if (caption == null || caption.isBlank()) {
            throw new IllegalArgumentException("caption must not be blank");
        }
        var annotation = new Annotation(UUID.randomUUID().toString(), taskId, annotatorId, caption.trim(), now);
        store.appendAnnotation(annotation);
        log.debug("Ledger: annotation {} by {} on task {}", annotation.id(), annotatorId, taskId);
        return annotation;
    }

    /**
     * Appends a vote on an existing annotation.
     *
     * @throws SelfVoteException      if the voter authored the annotation
     * @throws DuplicateVoteException if the voter already judged this annotation
     */
    public Vote appendVote(Annotation annotation, String voterId, boolean agree, Instant now) {
        if (annotation.annotatorId().equals(voterId)) {
            throw new SelfVoteException(annotation.id(), voterId);
        }
        boolean alreadyVoted = store.votesForTask(annotation.taskId()).stream()
                .anyMatch(v -> v.annotationId().equals(annotation.id()) && v.voterId().equals(voterId));
        if (alreadyVoted) {
            throw new DuplicateVoteException(annotation.id(), voterId);
        }
        var vote = new Vote(UUID.randomUUID().toString(), annotation.id(), annotation.taskId(), voterId, agree, now);
        store.appendVote(vote);
        log.debug("Ledger: vote {} by {} on annotation {} (agree={})", vote.id(), voterId, annotation.id(), agree);
        return vote;
    }

    public Annotation annotation(String annotationId) {
        return store.findAnnotation(annotationId)
                .orElseThrow(() -> new EntityNotFoundException("Annotation", annotationId));
    }

    public List<Annotation> annotationsFor(String taskId) {
        return store.annotationsForTask(taskId);
    }

    public VoteTally tally(String taskId) {
        return new VoteTally(store.annotationsForTask(taskId), store.votesForTask(taskId));
    }

    /** Agreeing votes on the leading annotation over all votes on the task. */
    public double agreementRatio(String taskId) {
        return tally(taskId).agreementRatio();
    }
}
