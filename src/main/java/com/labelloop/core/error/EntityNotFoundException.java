package com.labelloop.core.error;

/**
 * Thrown when an operation names a task, annotation or batch the engine does not know.
 */
public class EntityNotFoundException extends LabelLoopException {
    public EntityNotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
