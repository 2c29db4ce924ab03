package com.labelloop.core.model;

/**
 * Delivery status of a retraining batch.
 */
public enum BatchStatus {
    PENDING,        // ready to be offered (again)
    SENT,           // offered, awaiting acknowledgement
    ACKNOWLEDGED
}
