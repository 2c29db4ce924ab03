package com.labelloop.core.assignment;

import com.labelloop.core.concurrency.EntityLocks;
import com.labelloop.core.config.LabelLoopProperties;
import com.labelloop.core.error.NoEligibleAnnotatorException;
import com.labelloop.core.model.Annotator;
import com.labelloop.core.model.Assignment;
import com.labelloop.core.model.Task;
import com.labelloop.core.queue.QueuedTask;
import com.labelloop.core.queue.TaskPriorityQueue;
import com.labelloop.core.reliability.AnnotatorRegistry;
import com.labelloop.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Matches queued tasks to annotators.
 * <p>
 * For the highest-priority task that has at least one eligible annotator in the pool, the
 * annotator maximising {@code reliability * (1 - openTasks / maxConcurrentTasks)} wins; ties
 * go to the lower open-task count, then to the lexicographically smaller id. An annotator is
 * eligible when below capacity and neither holding an open assignment on the task nor having
 * already annotated it.
 * <p>
 * A task is claimed in the queue before its lock is taken, and the assignment commits with a
 * single task write. A task that stalled or filled up in between is skipped, not corrupted.
 */
@Service
public class AssignmentEngine {

    private static final Logger log = LoggerFactory.getLogger(AssignmentEngine.class);

    /** Orders candidates best first. */
    static final Comparator<Candidate> BEST_FIRST =
            Comparator.comparingDouble(Candidate::score).reversed()
                    .thenComparingInt(c -> c.annotator().openTaskCount())
                    .thenComparing(c -> c.annotator().id());

    /**
     * An annotator together with its assignment score.
     */
    public record Candidate(Annotator annotator, double score) {}

    private final TaskPriorityQueue queue;
    private final TaskStore taskStore;
    private final AnnotatorRegistry registry;
    private final EntityLocks locks;
    private final Clock clock;
    private final int maxClaimAttempts;

    public AssignmentEngine(TaskPriorityQueue queue, TaskStore taskStore, AnnotatorRegistry registry,
                            EntityLocks locks, LabelLoopProperties properties, Clock clock) {
        this.queue = queue;
        this.taskStore = taskStore;
        this.registry = registry;
        this.locks = locks;
        this.clock = clock;
        this.maxClaimAttempts = properties.getAssignment().getMaxClaimAttempts();
    }

    /**
     * Assigns the next task to the best annotator of the pool.
     *
     * @param pool annotator ids available for work; unknown ids are registered with defaults
     * @return the assignment, or empty when no task is waiting
     * @throws NoEligibleAnnotatorException if the pool is empty or no annotator in it can take any queued task
     */
    public Optional<Assignment> assignNext(Collection<String> pool) {
        if (pool == null || pool.isEmpty()) {
            throw new NoEligibleAnnotatorException("Annotator pool is empty");
        }
        List<String> annotatorIds = List.copyOf(new LinkedHashSet<>(pool));
        annotatorIds.forEach(registry::getOrRegister);

        if (queue.size() == 0) {
            log.debug("assignNext: queue empty, nothing to assign to {}", annotatorIds);
            return Optional.empty();
        }

        for (int attempt = 1; attempt <= maxClaimAttempts; attempt++) {
            Optional<QueuedTask> next = queue.peekNext(q -> hasEligibleAnnotator(q.taskId(), annotatorIds));
            if (next.isEmpty()) {
                if (queue.claimedCount() == 0) {
                    break;
                }
                // tasks claimed by concurrent callers may come back when they release
                Thread.yield();
                continue;
            }
            String taskId = next.get().taskId();
            if (!queue.tryClaim(taskId)) {
                log.debug("assignNext: task {} claimed concurrently (attempt {})", taskId, attempt);
                continue;
            }
            try {
                Optional<Assignment> assignment = commit(taskId, annotatorIds);
                if (assignment.isPresent()) {
                    return assignment;
                }
            } finally {
                queue.release(taskId);
            }
        }
        throw new NoEligibleAnnotatorException(
                "No annotator in pool " + annotatorIds + " is eligible for any of " + queue.size() + " queued task(s)");
    }

    /**
     * Ranks the pool for a task, best candidate first. Ineligible annotators are left out.
     */
    public List<Candidate> rankCandidates(Task task, Collection<String> annotatorIds) {
        return annotatorIds.stream()
                .map(registry::find)
                .flatMap(Optional::stream)
                .filter(a -> isEligible(task, a))
                .map(a -> new Candidate(a, score(a)))
                .sorted(BEST_FIRST)
                .toList();
    }

    public static double score(Annotator annotator) {
        return annotator.reliability() * (1.0 - annotator.loadFraction());
    }

    public static boolean isEligible(Task task, Annotator annotator) {
        return !annotator.atCapacity()
                && !task.hasOpenAssignment(annotator.id())
                && !task.hasSubmitted(annotator.id());
    }

    private boolean hasEligibleAnnotator(String taskId, List<String> annotatorIds) {
        Optional<Task> task = taskStore.find(taskId);
        return task.isPresent() && task.get().needsAssignment()
                && !rankCandidates(task.get(), annotatorIds).isEmpty();
    }

    private Optional<Assignment> commit(String taskId, List<String> annotatorIds) {
        return locks.tasks().withLock(taskId, () -> {
            Optional<Task> found = taskStore.find(taskId);
            if (found.isEmpty() || !found.get().needsAssignment()) {
                // stalled, finalized or filled up since it was peeked
                queue.remove(taskId);
                return Optional.empty();
            }
            Task task = found.get();
            for (Candidate candidate : rankCandidates(task, annotatorIds)) {
                Optional<Assignment> assigned = tryAssign(task, candidate);
                if (assigned.isPresent()) {
                    return assigned;
                }
            }
            return Optional.empty();
        });
    }

    private Optional<Assignment> tryAssign(Task task, Candidate candidate) {
        String annotatorId = candidate.annotator().id();
        return locks.annotators().withLock(annotatorId, () -> {
            Annotator current = registry.get(annotatorId);
            if (!isEligible(task, current)) {
                log.debug("Annotator {} filled up concurrently, trying next candidate", annotatorId);
                return Optional.empty();
            }
            Instant now = clock.instant();
            double priority = queue.priorityOf(task);
            Task assigned = task.withAssignment(annotatorId, now);
            // commit point: the task row
            taskStore.save(assigned);
            registry.update(annotatorId, Annotator::withTaskOpened);
            if (!assigned.needsAssignment()) {
                queue.remove(task.id());
            }
            log.info("Assigned task {} to {} (score {}, priority {}, round {} {}/{})",
                    task.id(), annotatorId, String.format("%.3f", score(current)), String.format("%.3f", priority),
                    assigned.round(), assigned.assignmentsInRound(), assigned.requiredAssignments());
            return Optional.of(new Assignment(task.id(), annotatorId, score(current), priority, now));
        });
    }
}
