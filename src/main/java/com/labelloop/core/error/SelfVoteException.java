package com.labelloop.core.error;

/**
 * Thrown when an annotator votes on their own annotation.
 */
public class SelfVoteException extends LabelLoopException {
    public SelfVoteException(String annotationId, String voterId) {
        super("Annotator " + voterId + " cannot vote on own annotation " + annotationId);
    }
}
