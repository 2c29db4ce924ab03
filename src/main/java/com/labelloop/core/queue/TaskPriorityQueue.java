package com.labelloop.core.queue;

import com.labelloop.core.config.LabelLoopProperties;
import com.labelloop.core.error.DuplicateTaskException;
import com.labelloop.core.model.PrioritizedTask;
import com.labelloop.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Tasks waiting for annotators, ordered by
 * {@code uncertainty * difficulty * freshness_decay(wait_time)}.
 * <p>
 * Priority is recomputed on every read from the task's creation time, so waiting tasks
 * keep rising without any background job. Callers that intend to act on a task first
 * {@link #tryClaim(String) claim} it; a claimed task is invisible to {@link #peekNext}
 * until it is {@link #release(String) released} or {@link #remove(String) removed}, which
 * keeps two concurrent assignments from picking the same task.
 * <p>
 * Mutations run under one queue-level lock; scoring is in-memory and bounded by
 * the queue size.
 */
@Service
public class TaskPriorityQueue {

    private static final Logger log = LoggerFactory.getLogger(TaskPriorityQueue.class);

    private final FreshnessDecay decay;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, QueuedTask> queued = new LinkedHashMap<>();
    private final Set<String> claimed = new HashSet<>();

    /** predictionId -> taskId for every task ever enqueued. */
    private final Map<String, String> predictionOwners = new HashMap<>();

    @Autowired
    public TaskPriorityQueue(LabelLoopProperties properties, Clock clock) {
        this(new FreshnessDecay(properties.getQueue().getMaxFreshnessBoost(),
                properties.getQueue().getFreshnessTimeConstant()), clock);
    }

    public TaskPriorityQueue(FreshnessDecay decay, Clock clock) {
        this.decay = decay;
        this.clock = clock;
    }

    /**
     * Inserts a task. Enqueueing a task that is already queued is a no-op, which lets a
     * stalled task be re-queued under its original identity.
     *
     * @throws DuplicateTaskException if a different task was already enqueued for the same prediction
     */
    public void enqueue(Task task) {
        lock.lock();
        try {
            String owner = predictionOwners.putIfAbsent(task.predictionId(), task.id());
            if (owner != null && !owner.equals(task.id())) {
                throw new DuplicateTaskException(task.predictionId(), owner);
            }
            if (queued.putIfAbsent(task.id(), QueuedTask.of(task)) == null) {
                log.debug("Enqueued task {} (prediction {}), depth {}", task.id(), task.predictionId(), queued.size());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the highest-priority unclaimed task satisfying {@code eligible}.
     * Ties are broken by creation time, then task id.
     */
    public Optional<QueuedTask> peekNext(Predicate<QueuedTask> eligible) {
        Instant now = clock.instant();
        List<QueuedTask> candidates;
        lock.lock();
        try {
            candidates = queued.values().stream()
                    .filter(q -> !claimed.contains(q.taskId()))
                    .sorted(byPriority(now))
                    .toList();
        } finally {
            lock.unlock();
        }
        // the predicate may read the stores, so it runs outside the queue lock;
        // callers re-validate through tryClaim
        return candidates.stream().filter(eligible).findFirst();
    }

    /**
     * Claims a queued task for the calling assignment attempt.
     *
     * @return false if the task is not queued or another caller holds the claim
     */
    public boolean tryClaim(String taskId) {
        lock.lock();
        try {
            return queued.containsKey(taskId) && claimed.add(taskId);
        } finally {
            lock.unlock();
        }
    }

    /** Gives up a claim; the task becomes visible to {@link #peekNext} again. */
    public void release(String taskId) {
        lock.lock();
        try {
            claimed.remove(taskId);
        } finally {
            lock.unlock();
        }
    }

    /** Takes a task out of the queue when it leaves the waiting set. */
    public boolean remove(String taskId) {
        lock.lock();
        try {
            claimed.remove(taskId);
            boolean removed = queued.remove(taskId) != null;
            if (removed) {
                log.debug("Removed task {} from queue, depth {}", taskId, queued.size());
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String taskId) {
        lock.lock();
        try {
            return queued.containsKey(taskId);
        } finally {
            lock.unlock();
        }
    }

    /** Tasks currently claimed by an assignment attempt. */
    public int claimedCount() {
        lock.lock();
        try {
            return claimed.size();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queued.size();
        } finally {
            lock.unlock();
        }
    }

    /** Current priority of any task, queued or not. */
    public double priorityOf(Task task) {
        return priority(QueuedTask.of(task), clock.instant());
    }

    /** Orders tasks by their current priority, highest first. */
    public List<PrioritizedTask> rank(Collection<Task> tasks) {
        Instant now = clock.instant();
        return tasks.stream()
                .map(t -> new PrioritizedTask(t, priority(QueuedTask.of(t), now)))
                .sorted(Comparator.comparingDouble(PrioritizedTask::priority).reversed()
                        .thenComparing(p -> p.task().createdAt())
                        .thenComparing(p -> p.task().id()))
                .toList();
    }

    /**
     * Replaces the queue content with the tasks that still need annotators and records
     * prediction ownership for every task. Used at startup, the stores being the source of truth.
     */
    public void rebuild(Collection<Task> tasks) {
        lock.lock();
        try {
            queued.clear();
            claimed.clear();
            predictionOwners.clear();
            for (Task task : tasks) {
                predictionOwners.putIfAbsent(task.predictionId(), task.id());
                if (task.needsAssignment()) {
                    queued.put(task.id(), QueuedTask.of(task));
                }
            }
            log.info("Priority queue rebuilt: {} of {} tasks waiting for annotators", queued.size(), tasks.size());
        } finally {
            lock.unlock();
        }
    }

    private Comparator<QueuedTask> byPriority(Instant now) {
        return Comparator.comparingDouble((QueuedTask q) -> priority(q, now)).reversed()
                .thenComparing(QueuedTask::createdAt)
                .thenComparing(QueuedTask::taskId);
    }

    private double priority(QueuedTask q, Instant now) {
        return decay.priority(q.uncertainty(), q.difficulty(), Duration.between(q.createdAt(), now));
    }
}
