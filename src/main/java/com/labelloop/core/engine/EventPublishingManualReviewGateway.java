package com.labelloop.core.engine;

import com.labelloop.core.events.EventBus;
import com.labelloop.core.events.LabelLoopEvent;
import com.labelloop.core.model.ManualReviewRequired;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Default {@link ManualReviewGateway}: announces the task on the {@link EventBus} for whoever
 * runs the manual review queue.
 */
public class EventPublishingManualReviewGateway implements ManualReviewGateway {

    private static final Logger log = LoggerFactory.getLogger(EventPublishingManualReviewGateway.class);

    private final EventBus eventBus;

    public EventPublishingManualReviewGateway(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void requestReview(ManualReviewRequired signal) {
        log.warn("Task {} needs manual review after {} stall(s), last from {}",
                signal.taskId(), signal.retryCount(), signal.stalledFrom());
        eventBus.publish(new LabelLoopEvent(LabelLoopEvent.TASK_MANUAL_REVIEW, signal.taskId(),
                Map.of("predictionId", signal.predictionId(),
                        "retryCount", signal.retryCount(),
                        "stalledFrom", signal.stalledFrom().name()),
                signal.raisedAt()));
    }
}
