package com.labelloop.core.concurrency;

import org.springframework.stereotype.Component;

/**
 * The engine's two lock tables. Lock order is always task, then annotator.
 */
@Component
public class EntityLocks {

    private final KeyedLocks tasks = new KeyedLocks("tasks");
    private final KeyedLocks annotators = new KeyedLocks("annotators");

    public KeyedLocks tasks() {
        return tasks;
    }

    public KeyedLocks annotators() {
        return annotators;
    }
}
