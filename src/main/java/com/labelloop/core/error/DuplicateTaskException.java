package com.labelloop.core.error;

/**
 * Thrown when a task already exists for a prediction. Ingestion recovers from it by
 * returning the existing task.
 */
public class DuplicateTaskException extends LabelLoopException {

    private final String predictionId;
    private final String existingTaskId;

    public DuplicateTaskException(String predictionId, String existingTaskId) {
        super("Prediction " + predictionId + " already has task " + existingTaskId);
        this.predictionId = predictionId;
        this.existingTaskId = existingTaskId;
    }

    public String predictionId() {
        return predictionId;
    }

    public String existingTaskId() {
        return existingTaskId;
    }
}
