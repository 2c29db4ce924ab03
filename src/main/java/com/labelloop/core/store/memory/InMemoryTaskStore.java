package com.labelloop.core.store.memory;

import com.labelloop.core.error.DuplicateTaskException;
import com.labelloop.core.error.EntityNotFoundException;
import com.labelloop.core.model.Task;
import com.labelloop.core.model.TaskStatus;
import com.labelloop.core.store.TaskStore;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link TaskStore} backed by concurrent maps. Not durable across restarts.
 */
public class InMemoryTaskStore implements TaskStore {

    private static final Comparator<Task> CREATION_ORDER =
            Comparator.comparing(Task::createdAt).thenComparing(Task::id);

    private final ConcurrentHashMap<String, Task> tasks = new ConcurrentHashMap<>();

    /** predictionId -> taskId; claimed before the task row is written. */
    private final ConcurrentHashMap<String, String> predictionIndex = new ConcurrentHashMap<>();

    @Override
    public Task insert(Task task) {
        String existing = predictionIndex.putIfAbsent(task.predictionId(), task.id());
        if (existing != null) {
            throw new DuplicateTaskException(task.predictionId(), existing);
        }
        tasks.put(task.id(), task);
        return task;
    }

    @Override
    public void save(Task task) {
        if (tasks.replace(task.id(), task) == null) {
            throw new EntityNotFoundException("Task", task.id());
        }
    }

    @Override
    public Optional<Task> find(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public Optional<Task> findByPredictionId(String predictionId) {
        String taskId = predictionIndex.get(predictionId);
        return taskId == null ? Optional.empty() : find(taskId);
    }

    @Override
    public List<Task> findByStatus(Set<TaskStatus> statuses) {
        return tasks.values().stream()
                .filter(t -> statuses.contains(t.status()))
                .sorted(CREATION_ORDER)
                .toList();
    }

    @Override
    public List<Task> findAll() {
        return tasks.values().stream().sorted(CREATION_ORDER).toList();
    }

    public void close() {
        tasks.clear();
        predictionIndex.clear();
    }
}
