package com.labelloop.core.model;

import com.labelloop.core.error.InvalidStateTransitionException;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A unit of human-review work derived from exactly one {@link Prediction}.
 * <p>
 * Instances are immutable; every mutation returns a copy and goes through the
 * {@code with*} methods so that status changes are validated against
 * {@link TaskStatus#canTransitionTo(TaskStatus)}.
 *
 * @param id                  unique task identifier
 * @param prediction          the prediction this task reviews
 * @param difficulty          difficulty score in (0, 1]
 * @param status              current lifecycle status
 * @param createdAt           creation time; wait time for prioritisation is measured from here
 * @param statusChangedAt     when the current status was entered
 * @param round               current review round (1-based)
 * @param requiredAssignments assignments the current round needs before the task leaves the queue
 * @param retryCount          number of stalls so far
 * @param annotationCount     annotations submitted across all rounds
 * @param assignments         ordered assignment history
 */
public record Task(
    String id,
    Prediction prediction,
    double difficulty,
    TaskStatus status,
    Instant createdAt,
    Instant statusChangedAt,
    int round,
    int requiredAssignments,
    int retryCount,
    int annotationCount,
    List<AssignmentEvent> assignments
) implements Serializable {

    public Task {
        assignments = List.copyOf(assignments);
    }

    public static Task create(String id, Prediction prediction, double difficulty,
                              int requiredAssignments, Instant now) {
        if (Double.isNaN(difficulty) || difficulty <= 0.0 || difficulty > 1.0) {
            throw new IllegalArgumentException("difficulty must be within (0, 1], was " + difficulty);
        }
        return new Task(id, prediction, difficulty, TaskStatus.PENDING, now, now,
                1, requiredAssignments, 0, 0, List.of());
    }

    public String predictionId() {
        return prediction.id();
    }

    public double uncertainty() {
        return prediction.uncertainty();
    }

    /** Annotators holding an assignment that has been neither submitted nor released. */
    public Set<String> openAssignees() {
        var open = new LinkedHashSet<String>();
        for (var event : assignments) {
            if (event.kind() == AssignmentEvent.Kind.ASSIGNED) {
                open.add(event.annotatorId());
            } else {
                open.remove(event.annotatorId());
            }
        }
        return open;
    }

    public boolean hasOpenAssignment(String annotatorId) {
        return openAssignees().contains(annotatorId);
    }

    public boolean hasSubmitted(String annotatorId) {
        return assignments.stream().anyMatch(e ->
                e.kind() == AssignmentEvent.Kind.SUBMITTED && e.annotatorId().equals(annotatorId));
    }

    public int assignmentsInRound() {
        return (int) assignments.stream()
                .filter(e -> e.kind() == AssignmentEvent.Kind.ASSIGNED && e.round() == round)
                .count();
    }

    /** True while the task sits in the priority queue waiting for more annotators. */
    public boolean needsAssignment() {
        return TaskStatus.ASSIGNABLE.contains(status) && assignmentsInRound() < requiredAssignments;
    }

    /** Time the oldest still-open assignment was handed out, if any. */
    public Optional<Instant> oldestOpenAssignmentAt() {
        Set<String> open = openAssignees();
        return assignments.stream()
                .filter(e -> e.kind() == AssignmentEvent.Kind.ASSIGNED && open.contains(e.annotatorId()))
                .map(AssignmentEvent::at)
                .min(Instant::compareTo);
    }

    public Optional<Instant> assignedAt(String annotatorId) {
        Instant last = null;
        for (var event : assignments) {
            if (event.kind() == AssignmentEvent.Kind.ASSIGNED && event.annotatorId().equals(annotatorId)) {
                last = event.at();
            }
        }
        return Optional.ofNullable(last);
    }

    public Task withStatus(TaskStatus target, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(id, status, target);
        }
        return new Task(id, prediction, difficulty, target, createdAt, now, round,
                requiredAssignments, retryCount, annotationCount, assignments);
    }

    public Task withAssignment(String annotatorId, Instant now) {
        var history = appended(new AssignmentEvent(annotatorId, AssignmentEvent.Kind.ASSIGNED, round, now));
        TaskStatus next = status == TaskStatus.PENDING ? TaskStatus.ASSIGNED : status;
        Instant changedAt = next != status ? now : statusChangedAt;
        return new Task(id, prediction, difficulty, next, createdAt, changedAt, round,
                requiredAssignments, retryCount, annotationCount, history);
    }

    public Task withSubmission(String annotatorId, Instant now) {
        var history = appended(new AssignmentEvent(annotatorId, AssignmentEvent.Kind.SUBMITTED, round, now));
        return new Task(id, prediction, difficulty, status, createdAt, statusChangedAt, round,
                requiredAssignments, retryCount, annotationCount + 1, history);
    }

    /** Releases every open assignment; used when the task stalls. */
    public Task withOpenAssignmentsReleased(Instant now) {
        var history = new ArrayList<>(assignments);
        for (String annotatorId : openAssignees()) {
            history.add(new AssignmentEvent(annotatorId, AssignmentEvent.Kind.RELEASED, round, now));
        }
        return new Task(id, prediction, difficulty, status, createdAt, statusChangedAt, round,
                requiredAssignments, retryCount, annotationCount, history);
    }

    public Task withRetryRecorded() {
        return new Task(id, prediction, difficulty, status, createdAt, statusChangedAt, round,
                requiredAssignments, retryCount + 1, annotationCount, assignments);
    }

    /** Starts a new review round requiring {@code required} further assignments. */
    public Task withNextRound(int required) {
        return new Task(id, prediction, difficulty, status, createdAt, statusChangedAt, round + 1,
                required, retryCount, annotationCount, assignments);
    }

    private List<AssignmentEvent> appended(AssignmentEvent event) {
        var history = new ArrayList<>(assignments);
        history.add(event);
        return history;
    }
}
