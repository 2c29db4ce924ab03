package com.labelloop.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A model-generated candidate caption for a video segment. Immutable once recorded.
 *
 * @param id           unique prediction identifier; at most one task is ever created per id
 * @param videoId      the video clip the caption describes
 * @param caption      the caption the model predicted
 * @param uncertainty  model uncertainty in [0, 1]; higher means the model is less sure
 * @param modelVersion version of the model that produced the prediction
 * @param recordedAt   when the prediction was produced
 */
public record Prediction(
    String id,
    String videoId,
    String caption,
    double uncertainty,
    String modelVersion,
    Instant recordedAt
) implements Serializable {

    public Prediction {
        Objects.requireNonNull(id, "prediction id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("prediction id must not be blank");
        }
        if (Double.isNaN(uncertainty) || uncertainty < 0.0 || uncertainty > 1.0) {
            throw new IllegalArgumentException("uncertainty must be within [0, 1], was " + uncertainty);
        }
    }
}
