package com.labelloop.core.model;

/**
 * Why a retraining batch was emitted.
 */
public enum BatchTrigger {
    SIZE,
    AGE,
    MANUAL
}
