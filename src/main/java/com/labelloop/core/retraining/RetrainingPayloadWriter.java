package com.labelloop.core.retraining;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.labelloop.core.error.LabelLoopException;
import com.labelloop.core.model.ConsensusResult;
import com.labelloop.core.model.RetrainingBatch;
import com.labelloop.core.store.ConsensusStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Renders a retraining batch as the JSON document posted to the training webhook:
 * <pre>
 * {"event": "retraining.triggered", "timestamp": "...",
 *  "payload": {"batch_id": "...", "trigger": "SIZE", "offer_count": 1,
 *              "labeled_tasks": [{"task_id": "...", "prediction_id": "...", "caption": "...",
 *                                 "confidence": 0.83, "low_confidence": false}]}}
 * </pre>
 */
@Component
public class RetrainingPayloadWriter {

    private static final Logger log = LoggerFactory.getLogger(RetrainingPayloadWriter.class);

    public static final String EVENT = "retraining.triggered";

    private final ConsensusStore consensusStore;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public RetrainingPayloadWriter(ConsensusStore consensusStore, Clock clock) {
        this.consensusStore = consensusStore;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String render(RetrainingBatch batch) {
        var labeledTasks = new ArrayList<Map<String, Object>>();
        for (String taskId : batch.consensusTaskIds()) {
            Optional<ConsensusResult> result = consensusStore.find(taskId);
            if (result.isEmpty()) {
                log.warn("Batch {} references task {} without a consensus result; skipped", batch.id(), taskId);
                continue;
            }
            labeledTasks.add(labeledTask(result.get()));
        }

        var payload = new LinkedHashMap<String, Object>();
        payload.put("batch_id", batch.id());
        payload.put("trigger", batch.trigger().name());
        payload.put("offer_count", batch.offerCount());
        payload.put("labeled_tasks", labeledTasks);

        var document = new LinkedHashMap<String, Object>();
        document.put("event", EVENT);
        document.put("timestamp", clock.instant());
        document.put("payload", payload);

        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new LabelLoopException("Failed to render retraining batch " + batch.id(), e);
        }
    }

    private static Map<String, Object> labeledTask(ConsensusResult result) {
        var task = new LinkedHashMap<String, Object>();
        task.put("task_id", result.taskId());
        task.put("prediction_id", result.predictionId());
        task.put("caption", result.caption());
        task.put("confidence", result.confidence());
        task.put("low_confidence", result.lowConfidence());
        return task;
    }
}
