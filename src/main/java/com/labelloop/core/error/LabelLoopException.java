package com.labelloop.core.error;

/**
 * Base type for every error the labeling engine raises.
 */
public class LabelLoopException extends RuntimeException {
    public LabelLoopException(String message) {
        super(message);
    }

    public LabelLoopException(String message, Throwable cause) {
        super(message, cause);
    }
}
