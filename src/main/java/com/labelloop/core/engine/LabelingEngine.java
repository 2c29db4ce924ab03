package com.labelloop.core.engine;

import com.labelloop.core.assignment.AssignmentEngine;
import com.labelloop.core.concurrency.EntityLocks;
import com.labelloop.core.config.LabelLoopProperties;
import com.labelloop.core.consensus.ConsensusEngine;
import com.labelloop.core.consensus.ConsensusEngine.ConsensusOutcome;
import com.labelloop.core.error.DuplicateTaskException;
import com.labelloop.core.error.EntityNotFoundException;
import com.labelloop.core.error.InvalidStateTransitionException;
import com.labelloop.core.error.NoEligibleAnnotatorException;
import com.labelloop.core.events.EventBus;
import com.labelloop.core.events.LabelLoopEvent;
import com.labelloop.core.ledger.AnnotationLedger;
import com.labelloop.core.ledger.Captions;
import com.labelloop.core.logging.MdcContext;
import com.labelloop.core.metrics.LabelLoopMetrics;
import com.labelloop.core.model.Annotation;
import com.labelloop.core.model.Annotator;
import com.labelloop.core.model.AnnotatorMetrics;
import com.labelloop.core.model.Assignment;
import com.labelloop.core.model.ConsensusResult;
import com.labelloop.core.model.EvaluationReport;
import com.labelloop.core.model.ManualReviewRequired;
import com.labelloop.core.model.Prediction;
import com.labelloop.core.model.PrioritizedTask;
import com.labelloop.core.model.RetrainingBatch;
import com.labelloop.core.model.SweepReport;
import com.labelloop.core.model.Task;
import com.labelloop.core.model.TaskStatus;
import com.labelloop.core.model.Vote;
import com.labelloop.core.queue.TaskPriorityQueue;
import com.labelloop.core.reliability.AnnotatorRegistry;
import com.labelloop.core.reliability.ReliabilityUpdater;
import com.labelloop.core.retraining.RetrainingPayloadWriter;
import com.labelloop.core.retraining.RetrainingTrigger;
import com.labelloop.core.store.ConsensusStore;
import com.labelloop.core.store.TaskStore;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Entry point of the labeling loop: every operation the service layer calls goes through here.
 * <p>
 * The engine ties the components together. Predictions become queued tasks, tasks are handed
 * to annotators, captions and votes go to the ledger, consensus results update annotator
 * reliability and feed retraining batches, and a periodic {@link #sweep()} handles timeouts.
 * Task-scoped writes run under the task's lock; the stores are the source of truth and the
 * queue is rebuilt from them on startup.
 */
@Service
public class LabelingEngine {

    private static final Logger log = LoggerFactory.getLogger(LabelingEngine.class);

    private final TaskStore taskStore;
    private final ConsensusStore consensusStore;
    private final TaskPriorityQueue queue;
    private final AssignmentEngine assignmentEngine;
    private final AnnotationLedger ledger;
    private final ConsensusEngine consensusEngine;
    private final AnnotatorRegistry registry;
    private final ReliabilityUpdater reliabilityUpdater;
    private final RetrainingTrigger retrainingTrigger;
    private final RetrainingPayloadWriter payloadWriter;
    private final StallHandler stallHandler;
    private final EntityLocks locks;
    private final EventBus eventBus;
    private final LabelLoopMetrics metrics;
    private final Clock clock;
    private final LabelLoopProperties properties;

    public LabelingEngine(TaskStore taskStore, ConsensusStore consensusStore, TaskPriorityQueue queue,
                          AssignmentEngine assignmentEngine, AnnotationLedger ledger, ConsensusEngine consensusEngine,
                          AnnotatorRegistry registry, ReliabilityUpdater reliabilityUpdater,
                          RetrainingTrigger retrainingTrigger, RetrainingPayloadWriter payloadWriter,
                          StallHandler stallHandler, EntityLocks locks, EventBus eventBus, LabelLoopMetrics metrics,
                          LabelLoopProperties properties, Clock clock) {
        this.taskStore = taskStore;
        this.consensusStore = consensusStore;
        this.queue = queue;
        this.assignmentEngine = assignmentEngine;
        this.ledger = ledger;
        this.consensusEngine = consensusEngine;
        this.registry = registry;
        this.reliabilityUpdater = reliabilityUpdater;
        this.retrainingTrigger = retrainingTrigger;
        this.payloadWriter = payloadWriter;
        this.stallHandler = stallHandler;
        this.locks = locks;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        queue.rebuild(taskStore.findAll());
        metrics.registerQueueDepth(queue::size);
    }

    // ---- ingestion ----

    /**
     * Creates the review task for a prediction, using the default difficulty.
     *
     * @return the task id; the existing one when the prediction was ingested before
     */
    public String ingestPrediction(Prediction prediction) {
        return ingestPrediction(prediction, properties.getQueue().getDefaultDifficulty());
    }

    public String ingestPrediction(Prediction prediction, double difficulty) {
        Optional<Task> existing = taskStore.findByPredictionId(prediction.id());
        if (existing.isPresent()) {
            log.debug("Prediction {} already has task {}", prediction.id(), existing.get().id());
            return existing.get().id();
        }
        Task task = Task.create(UUID.randomUUID().toString(), prediction, difficulty,
                properties.getConsensus().getMinAnnotations(), clock.instant());
        try {
            taskStore.insert(task);
        } catch (DuplicateTaskException e) {
            log.debug("Prediction {} ingested concurrently, returning task {}", prediction.id(), e.existingTaskId());
            return e.existingTaskId();
        }
        MdcContext.setTask(task.id());
        try {
            queue.enqueue(task);
            metrics.recordTaskIngested();
            log.info("Ingested prediction {} as task {} (uncertainty {}, difficulty {})",
                    prediction.id(), task.id(), prediction.uncertainty(), difficulty);
            eventBus.publish(new LabelLoopEvent(LabelLoopEvent.TASK_CREATED, task.id(),
                    Map.of("predictionId", prediction.id(),
                            "uncertainty", prediction.uncertainty(),
                            "difficulty", difficulty),
                    task.createdAt()));
            return task.id();
        } finally {
            MdcContext.clear();
        }
    }

    // ---- assignment ----

    /**
     * Hands the best waiting task to the best annotator of the pool.
     *
     * @return the assignment, or empty when no task is waiting
     * @throws NoEligibleAnnotatorException if tasks are waiting but nobody in the pool can take one
     */
    public Optional<Assignment> assignNext(Collection<String> pool) {
        Optional<Assignment> assignment;
        try {
            assignment = assignmentEngine.assignNext(pool);
        } catch (NoEligibleAnnotatorException e) {
            metrics.recordAssignment("no_eligible_annotator");
            log.warn("Assignment rejected: {}", e.getMessage());
            throw e;
        }
        if (assignment.isEmpty()) {
            metrics.recordAssignment("empty_queue");
            return assignment;
        }
        Assignment a = assignment.get();
        MdcContext.setAssignment(a.taskId(), a.annotatorId());
        try {
            metrics.recordAssignment("assigned");
            eventBus.publish(new LabelLoopEvent(LabelLoopEvent.TASK_ASSIGNED, a.taskId(),
                    Map.of("annotatorId", a.annotatorId(), "score", a.score(), "priority", a.priority()),
                    a.assignedAt()));
        } finally {
            MdcContext.clear();
        }
        return assignment;
    }

    /** Assignment for a single annotator asking for work. */
    public Optional<Assignment> assignNext(String annotatorId) {
        return assignNext(List.of(annotatorId));
    }

    // ---- ledger ----

    /**
     * Records the caption of an annotator holding an open assignment on the task.
     *
     * @return the annotation id
     * @throws InvalidStateTransitionException if the task does not accept annotations or the
     *                                         annotator holds no open assignment on it
     */
    public String submitAnnotation(String taskId, String annotatorId, String caption) {
        if (caption == null || caption.isBlank()) {
            throw new IllegalArgumentException("caption must not be blank");
        }
        MdcContext.setAssignment(taskId, annotatorId);
        try {
            return locks.tasks().withLock(taskId, () -> submitAnnotationLocked(taskId, annotatorId, caption));
        } finally {
            MdcContext.clear();
        }
    }

    private String submitAnnotationLocked(String taskId, String annotatorId, String caption) {
        Task task = task(taskId);
        if (task.status() != TaskStatus.ASSIGNED && task.status() != TaskStatus.ANNOTATED) {
            log.warn("Rejected annotation by {} on task {} in status {}", annotatorId, taskId, task.status());
            throw new InvalidStateTransitionException(taskId, task.status(), "annotations are accepted only while assigned");
        }
        if (!task.hasOpenAssignment(annotatorId)) {
            log.warn("Rejected annotation by {} on task {}: no open assignment", annotatorId, taskId);
            throw new InvalidStateTransitionException(taskId, task.status(),
                    "annotator " + annotatorId + " holds no open assignment");
        }

        Instant now = clock.instant();
        Annotation annotation = ledger.appendAnnotation(taskId, annotatorId, caption, now);
        Duration timeOnTask = task.assignedAt(annotatorId)
                .map(at -> Duration.between(at, now))
                .orElse(Duration.ZERO);

        Task updated = task.withSubmission(annotatorId, now);
        if (updated.status() == TaskStatus.ASSIGNED) {
            updated = updated.withStatus(TaskStatus.ANNOTATED, now);
        }
        boolean startVoting = updated.annotationCount() >= properties.getConsensus().getMinAnnotations()
                && updated.openAssignees().isEmpty()
                && !updated.needsAssignment();
        if (startVoting) {
            updated = updated.withStatus(TaskStatus.VOTING, now);
        }
        // commit point
        taskStore.save(updated);
        registry.update(annotatorId, a -> a.withAnnotationCompleted(timeOnTask.toMillis()));
        if (!updated.needsAssignment()) {
            queue.remove(taskId);
        }

        metrics.recordAnnotation(timeOnTask);
        log.info("Annotation {} by {} on task {} ({}/{} annotations)", annotation.id(), annotatorId, taskId,
                updated.annotationCount(), properties.getConsensus().getMinAnnotations());
        eventBus.publish(new LabelLoopEvent(LabelLoopEvent.TASK_ANNOTATED, taskId,
                Map.of("annotationId", annotation.id(), "annotatorId", annotatorId), now));
        if (startVoting) {
            log.info("Task {} open for voting", taskId);
            eventBus.publish(new LabelLoopEvent(LabelLoopEvent.TASK_VOTING, taskId,
                    Map.of("annotationCount", updated.annotationCount()), now));
        }
        return annotation.id();
    }

    /**
     * Records a vote on an annotation and finalizes consensus when the vote completes it.
     *
     * @throws InvalidStateTransitionException if the task is not in voting
     */
    public Vote submitVote(String annotationId, String voterId, boolean agree) {
        Annotation annotation = ledger.annotation(annotationId);
        String taskId = annotation.taskId();
        MdcContext.setAssignment(taskId, voterId);
        try {
            Vote vote = locks.tasks().withLock(taskId, () -> {
                Task task = task(taskId);
                if (task.status() != TaskStatus.VOTING) {
                    log.warn("Rejected vote by {} on task {} in status {}", voterId, taskId, task.status());
                    throw new InvalidStateTransitionException(taskId, task.status(), "votes are accepted only while voting");
                }
                registry.getOrRegister(voterId);
                return ledger.appendVote(annotation, voterId, agree, clock.instant());
            });
            metrics.recordVote(agree);
            consensusEngine.tryFinalize(taskId).ifPresent(this::afterConsensus);
            return vote;
        } finally {
            MdcContext.clear();
        }
    }

    // ---- consensus ----

    /**
     * Finalizes consensus for a task. Calling it again returns the stored result.
     *
     * @throws InvalidStateTransitionException if the task is not ready for consensus
     */
    public ConsensusResult finalizeConsensus(String taskId) {
        MdcContext.setTask(taskId);
        try {
            ConsensusOutcome outcome = consensusEngine.finalizeConsensus(taskId);
            afterConsensus(outcome);
            return outcome.result();
        } finally {
            MdcContext.clear();
        }
    }

    public Optional<ConsensusResult> consensusResult(String taskId) {
        return consensusStore.find(taskId);
    }

    public double agreementRatio(String taskId) {
        task(taskId);
        return ledger.agreementRatio(taskId);
    }

    /**
     * Applies reliability and batch accounting for a consensus result. Both steps are
     * idempotent per task, so replaying an existing result completes an interrupted finalize.
     */
    private void afterConsensus(ConsensusOutcome outcome) {
        ConsensusResult result = outcome.result();
        if (outcome.created()) {
            queue.remove(result.taskId());
            metrics.recordConsensus(result.confidence(), result.lowConfidence());
            eventBus.publish(new LabelLoopEvent(LabelLoopEvent.CONSENSUS_REACHED, result.taskId(),
                    Map.of("annotationId", result.annotationId(),
                            "caption", result.caption(),
                            "confidence", result.confidence(),
                            "lowConfidence", result.lowConfidence()),
                    result.finalizedAt()));
        }
        reliabilityUpdater.apply(result);
        retrainingTrigger.onConsensus(result).ifPresent(this::announceBatch);
        locks.tasks().discard(result.taskId());
    }

    // ---- annotators ----

    public Annotator registerAnnotator(String annotatorId, int maxConcurrentTasks) {
        return registry.register(annotatorId, maxConcurrentTasks);
    }

    /**
     * @throws EntityNotFoundException if the annotator is unknown
     */
    public AnnotatorMetrics annotatorMetrics(String annotatorId) {
        return AnnotatorMetrics.of(registry.get(annotatorId));
    }

    /** Metrics for every known annotator, keyed by id. */
    public Map<String, AnnotatorMetrics> dashboard() {
        var dashboard = new TreeMap<String, AnnotatorMetrics>();
        for (Annotator annotator : registry.all()) {
            dashboard.put(annotator.id(), AnnotatorMetrics.of(annotator));
        }
        return dashboard;
    }

    /**
     * Applies any consensus result whose reliability update was interrupted and recomputes
     * every score from the stored counts.
     */
    public int reconcileReliability() {
        return reliabilityUpdater.reconcile();
    }

    // ---- tasks ----

    public Task task(String taskId) {
        return taskStore.find(taskId).orElseThrow(() -> new EntityNotFoundException("Task", taskId));
    }

    /** All tasks with their current priority, highest first. */
    public List<PrioritizedTask> listTasks() {
        return queue.rank(taskStore.findAll());
    }

    // ---- retraining ----

    /** Hands out every batch waiting for the training collaborator and marks it sent. */
    public List<RetrainingBatch> pollRetrainingBatches() {
        return retrainingTrigger.poll();
    }

    /**
     * Acknowledges a batch; repeated acknowledgements are no-ops.
     *
     * @throws EntityNotFoundException if no batch has the id
     */
    public RetrainingBatch ackBatch(String batchId) {
        MdcContext.setBatch(batchId);
        try {
            RetrainingBatch before = retrainingTrigger.batch(batchId);
            RetrainingBatch acknowledged = retrainingTrigger.acknowledge(batchId);
            if (before.status() != acknowledged.status()) {
                eventBus.publish(new LabelLoopEvent(LabelLoopEvent.BATCH_ACKNOWLEDGED, null,
                        Map.of("batchId", batchId, "offerCount", acknowledged.offerCount()),
                        acknowledged.acknowledgedAt()));
            }
            return acknowledged;
        } finally {
            MdcContext.clear();
        }
    }

    /** Emits the pending consensus results as a batch right away. */
    public Optional<RetrainingBatch> triggerRetraining() {
        Optional<RetrainingBatch> batch = retrainingTrigger.flush();
        batch.ifPresentOrElse(this::announceBatch, () -> log.info("Manual retraining trigger: nothing pending"));
        return batch;
    }

    /** The webhook JSON document for a batch. */
    public String renderBatchPayload(String batchId) {
        return payloadWriter.render(retrainingTrigger.batch(batchId));
    }

    private void announceBatch(RetrainingBatch batch) {
        MdcContext.setBatch(batch.id());
        try {
            metrics.recordBatchEmitted(batch.trigger().name().toLowerCase(), batch.size());
            eventBus.publish(new LabelLoopEvent(LabelLoopEvent.BATCH_READY, null,
                    Map.of("batchId", batch.id(), "trigger", batch.trigger().name(), "size", batch.size()),
                    batch.triggeredAt()));
        } finally {
            MdcContext.clearBatch();
        }
    }

    // ---- evaluation ----

    /**
     * Records how a retrained model's caption for a finalized task compares with the consensus
     * caption and with the caption originally predicted.
     *
     * @throws InvalidStateTransitionException if the task has no consensus yet
     */
    public EvaluationReport recordEvaluation(String taskId, String modelVersion, String retrainedCaption) {
        Task task = task(taskId);
        ConsensusResult result = consensusStore.find(taskId)
                .orElseThrow(() -> new InvalidStateTransitionException(taskId, task.status(),
                        "evaluation needs a consensus result"));
        String original = task.prediction().caption();
        var report = new EvaluationReport(taskId, modelVersion, original, result.caption(), retrainedCaption,
                Captions.tokenOverlap(retrainedCaption, result.caption()),
                Captions.tokenOverlap(retrainedCaption, original),
                clock.instant());
        consensusStore.appendEvaluation(report);
        log.info("Evaluation of model {} on task {}: {} overlap with consensus, {} with original",
                modelVersion, taskId, String.format("%.2f", report.agreementWithConsensus()),
                String.format("%.2f", report.agreementWithOriginal()));
        return report;
    }

    public List<EvaluationReport> evaluations(String taskId) {
        return consensusStore.evaluationsFor(taskId);
    }

    // ---- timeouts ----

    /**
     * Handles every wall-clock deadline once: stalls tasks with expired assignments, closes
     * voting windows, emits an aged partial batch and re-offers unacknowledged batches.
     */
    public SweepReport sweep() {
        Instant now = clock.instant();
        Duration assignmentTimeout = properties.getAssignment().getTimeout();
        var stalled = new ArrayList<String>();
        var requeued = new ArrayList<String>();
        var manualReview = new ArrayList<ManualReviewRequired>();
        var lowConfidence = new ArrayList<String>();
        var emitted = new ArrayList<String>();
        var reoffered = new ArrayList<String>();

        for (Task task : taskStore.findByStatus(EnumSet.of(TaskStatus.ASSIGNED, TaskStatus.ANNOTATED))) {
            if (!assignmentExpired(task, now, assignmentTimeout)) {
                continue;
            }
            MdcContext.setTask(task.id());
            try {
                stallHandler.stall(task.id(),
                                t -> TaskStatus.ASSIGNABLE.contains(t.status()) && assignmentExpired(t, now, assignmentTimeout),
                                "assignment timeout")
                        .ifPresent(outcome -> collect(outcome, stalled, requeued, manualReview));
            } finally {
                MdcContext.clear();
            }
        }

        for (Task task : taskStore.findByStatus(EnumSet.of(TaskStatus.VOTING))) {
            if (!consensusEngine.evaluate(task).windowElapsed()) {
                continue;
            }
            MdcContext.setTask(task.id());
            try {
                Optional<ConsensusOutcome> outcome = consensusEngine.tryFinalize(task.id());
                if (outcome.isPresent()) {
                    afterConsensus(outcome.get());
                    if (outcome.get().created() && outcome.get().result().lowConfidence()) {
                        lowConfidence.add(task.id());
                    }
                    continue;
                }
                stallHandler.stall(task.id(),
                                t -> t.status() == TaskStatus.VOTING && consensusEngine.evaluate(t).windowElapsed(),
                                "voting window elapsed without an agreeing vote")
                        .ifPresent(stall -> collect(stall, stalled, requeued, manualReview));
            } finally {
                MdcContext.clear();
            }
        }

        retrainingTrigger.emitIfAged().ifPresent(batch -> {
            announceBatch(batch);
            emitted.add(batch.id());
        });
        for (RetrainingBatch batch : retrainingTrigger.reofferExpired()) {
            metrics.recordBatchReoffered();
            eventBus.publish(new LabelLoopEvent(LabelLoopEvent.BATCH_REOFFERED, null,
                    Map.of("batchId", batch.id(), "offerCount", batch.offerCount()), now));
            reoffered.add(batch.id());
        }

        var report = new SweepReport(stalled, requeued, manualReview, lowConfidence, emitted, reoffered);
        if (!report.isEmpty()) {
            log.info("Sweep: {} stalled ({} re-queued, {} to manual review), {} low-confidence consensus, "
                            + "{} batch(es) emitted, {} re-offered",
                    stalled.size(), requeued.size(), manualReview.size(), lowConfidence.size(),
                    emitted.size(), reoffered.size());
        }
        return report;
    }

    private static boolean assignmentExpired(Task task, Instant now, Duration timeout) {
        return task.oldestOpenAssignmentAt()
                .map(at -> !now.isBefore(at.plus(timeout)))
                .orElse(false);
    }

    private void collect(StallHandler.StallOutcome outcome, List<String> stalled, List<String> requeued,
                         List<ManualReviewRequired> manualReview) {
        stalled.add(outcome.task().id());
        if (outcome.requeued()) {
            requeued.add(outcome.task().id());
        }
        outcome.manualReview().ifPresent(signal -> {
            manualReview.add(signal);
            locks.tasks().discard(signal.taskId());
        });
    }
}
