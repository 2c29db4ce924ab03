package com.labelloop.core.error;

/**
 * Thrown when a voter judges the same annotation a second time.
 */
public class DuplicateVoteException extends LabelLoopException {
    public DuplicateVoteException(String annotationId, String voterId) {
        super("Annotator " + voterId + " already voted on annotation " + annotationId);
    }
}
