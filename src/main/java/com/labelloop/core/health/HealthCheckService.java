package com.labelloop.core.health;

import com.labelloop.core.model.TaskStatus;
import com.labelloop.core.queue.TaskPriorityQueue;
import com.labelloop.core.retraining.RetrainingTrigger;
import com.labelloop.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final TaskStore taskStore;
    private final TaskPriorityQueue queue;
    private final RetrainingTrigger retrainingTrigger;

    public HealthCheckService(TaskStore taskStore, TaskPriorityQueue queue, RetrainingTrigger retrainingTrigger) {
        this.taskStore = taskStore;
        this.queue = queue;
        this.retrainingTrigger = retrainingTrigger;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkQueue());
        results.add(checkRetraining());
        results.add(checkManualReview());
        return results;
    }

    public HealthStatus.Status overallStatus() {
        return HealthStatus.overall(checkAll());
    }

    private HealthStatus checkStore() {
        try {
            int tasks = taskStore.findAll().size();
            return HealthStatus.up("store", "Task store reachable", Map.of("tasks", String.valueOf(tasks)));
        } catch (RuntimeException e) {
            log.warn("Store health check failed: {}", e.getMessage());
            return HealthStatus.down("store", e);
        }
    }

    private HealthStatus checkQueue() {
        int depth = queue.size();
        return HealthStatus.up("queue", depth + " task(s) waiting for annotators",
                Map.of("depth", String.valueOf(depth), "claimed", String.valueOf(queue.claimedCount())));
    }

    private HealthStatus checkRetraining() {
        try {
            long overdue = retrainingTrigger.overdueCount();
            var metadata = Map.of(
                    "pendingResults", String.valueOf(retrainingTrigger.pendingCount()),
                    "unacknowledgedBatches", String.valueOf(retrainingTrigger.unacknowledged().size()),
                    "overdueBatches", String.valueOf(overdue));
            if (overdue > 0) {
                return HealthStatus.degraded("retraining",
                        overdue + " batch(es) past the acknowledgement deadline", metadata);
            }
            return HealthStatus.up("retraining", "Batches acknowledged on time", metadata);
        } catch (RuntimeException e) {
            log.warn("Retraining health check failed: {}", e.getMessage());
            return HealthStatus.down("retraining", e);
        }
    }

    private HealthStatus checkManualReview() {
        try {
            int waiting = taskStore.findByStatus(EnumSet.of(TaskStatus.MANUAL_REVIEW)).size();
            var metadata = Map.of("tasks", String.valueOf(waiting));
            String detail = waiting + " task(s) awaiting manual review";
            return waiting > 0
                    ? HealthStatus.degraded("manualReview", detail, metadata)
                    : HealthStatus.up("manualReview", detail, metadata);
        } catch (RuntimeException e) {
            log.warn("Manual review health check failed: {}", e.getMessage());
            return HealthStatus.down("manualReview", e);
        }
    }
}
