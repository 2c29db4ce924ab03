package com.labelloop.core.engine;

import com.labelloop.core.concurrency.EntityLocks;
import com.labelloop.core.config.LabelLoopProperties;
import com.labelloop.core.events.EventBus;
import com.labelloop.core.events.LabelLoopEvent;
import com.labelloop.core.metrics.LabelLoopMetrics;
import com.labelloop.core.model.Annotator;
import com.labelloop.core.model.ManualReviewRequired;
import com.labelloop.core.model.Task;
import com.labelloop.core.model.TaskStatus;
import com.labelloop.core.queue.TaskPriorityQueue;
import com.labelloop.core.reliability.AnnotatorRegistry;
import com.labelloop.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Moves timed-out tasks through {@code stalled}.
 * <p>
 * Stalling releases every open assignment and records a retry. Within the retry budget the
 * task returns to {@code pending} and the queue with a new round that asks for the
 * annotations still missing (at least one); past the budget it ends in {@code manual_review}
 * and the {@link ManualReviewGateway} is told. The task keeps its creation time, so its
 * priority continues to grow after a re-queue. The final status is written once.
 */
@Service
public class StallHandler {

    private static final Logger log = LoggerFactory.getLogger(StallHandler.class);

    /**
     * Result of stalling one task.
     *
     * @param task         the task as stored afterwards
     * @param stalledFrom  status the task stalled from
     * @param manualReview the signal sent, when the retry budget ran out
     */
    public record StallOutcome(Task task, TaskStatus stalledFrom, Optional<ManualReviewRequired> manualReview) {
        public boolean requeued() {
            return task.status() == TaskStatus.PENDING;
        }
    }

    private final EntityLocks locks;
    private final TaskStore taskStore;
    private final TaskPriorityQueue queue;
    private final AnnotatorRegistry registry;
    private final ManualReviewGateway gateway;
    private final EventBus eventBus;
    private final LabelLoopMetrics metrics;
    private final Clock clock;
    private final int maxRetries;
    private final int minAnnotations;

    public StallHandler(EntityLocks locks, TaskStore taskStore, TaskPriorityQueue queue, AnnotatorRegistry registry,
                        ManualReviewGateway gateway, EventBus eventBus, LabelLoopMetrics metrics,
                        LabelLoopProperties properties, Clock clock) {
        this.locks = locks;
        this.taskStore = taskStore;
        this.queue = queue;
        this.registry = registry;
        this.gateway = gateway;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.maxRetries = properties.getStall().getMaxRetries();
        this.minAnnotations = properties.getConsensus().getMinAnnotations();
    }

    /**
     * Stalls the task if it is still in progress and {@code stillTimedOut} holds for its
     * current state. Both are re-checked under the task lock, so a task that progressed since
     * the sweep looked at it is left alone.
     *
     * @return the outcome, or empty when the task was left alone
     */
    public Optional<StallOutcome> stall(String taskId, Predicate<Task> stillTimedOut, String reason) {
        return locks.tasks().withLock(taskId, () -> {
            Optional<Task> found = taskStore.find(taskId);
            if (found.isEmpty() || !TaskStatus.IN_PROGRESS.contains(found.get().status())
                    || !stillTimedOut.test(found.get())) {
                return Optional.empty();
            }
            return Optional.of(stallLocked(found.get(), reason));
        });
    }

    private StallOutcome stallLocked(Task task, String reason) {
        Instant now = clock.instant();
        TaskStatus from = task.status();
        Set<String> released = task.openAssignees();

        Task stalled = task.withOpenAssignmentsReleased(now)
                .withRetryRecorded()
                .withStatus(TaskStatus.STALLED, now);
        metrics.recordStall(from.name().toLowerCase());
        log.warn("Task {} stalled in {} ({}), retry {}/{}", task.id(), from, reason, stalled.retryCount(), maxRetries);
        eventBus.publish(new LabelLoopEvent(LabelLoopEvent.TASK_STALLED, task.id(),
                Map.of("from", from.name(), "reason", reason, "retryCount", stalled.retryCount()), now));

        Optional<ManualReviewRequired> signal = Optional.empty();
        Task next;
        if (stalled.retryCount() > maxRetries) {
            next = stalled.withStatus(TaskStatus.MANUAL_REVIEW, now);
            signal = Optional.of(new ManualReviewRequired(task.id(), task.predictionId(), next.retryCount(), from, now));
        } else {
            int missing = Math.max(1, minAnnotations - stalled.annotationCount());
            next = stalled.withStatus(TaskStatus.PENDING, now).withNextRound(missing);
        }

        // commit point
        taskStore.save(next);
        for (String annotatorId : released) {
            registry.update(annotatorId, Annotator::withTaskReleased);
            log.debug("Released assignment of {} on stalled task {}", annotatorId, task.id());
        }

        if (signal.isPresent()) {
            queue.remove(task.id());
            metrics.recordManualReview();
            gateway.requestReview(signal.get());
        } else {
            queue.enqueue(next);
            log.info("Task {} re-queued for round {} needing {} annotation(s)",
                    task.id(), next.round(), next.requiredAssignments());
            eventBus.publish(new LabelLoopEvent(LabelLoopEvent.TASK_REQUEUED, task.id(),
                    Map.of("round", next.round(), "required", next.requiredAssignments()), now));
        }
        return new StallOutcome(next, from, signal);
    }
}
