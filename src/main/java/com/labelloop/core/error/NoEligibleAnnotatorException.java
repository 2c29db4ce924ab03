package com.labelloop.core.error;

/**
 * Transient: no annotator in the offered pool can take any queued task. Reported to the
 * caller, which decides whether and when to poll again.
 */
public class NoEligibleAnnotatorException extends LabelLoopException {
    public NoEligibleAnnotatorException(String message) {
        super(message);
    }
}
