package com.labelloop.core.store;

import com.labelloop.core.model.Task;
import com.labelloop.core.model.TaskStatus;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable table of tasks keyed by task id, with a unique index on prediction id.
 * Implementations throw {@link com.labelloop.core.error.StorageUnavailableException} when the
 * backing store cannot be reached.
 */
public interface TaskStore {

    /**
     * Inserts a new task.
     *
     * @throws com.labelloop.core.error.DuplicateTaskException if the prediction already has a task
     */
    Task insert(Task task);

    /** Replaces the stored copy of an existing task. */
    void save(Task task);

    Optional<Task> find(String taskId);

    Optional<Task> findByPredictionId(String predictionId);

    List<Task> findByStatus(Set<TaskStatus> statuses);

    List<Task> findAll();
}
