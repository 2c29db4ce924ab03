package com.labelloop.core.error;

/**
 * The backing store could not complete a read or write. Fatal to the calling request;
 * the engine never drops the write silently.
 */
public class StorageUnavailableException extends LabelLoopException {
    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
