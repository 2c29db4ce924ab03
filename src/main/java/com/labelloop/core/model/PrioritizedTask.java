package com.labelloop.core.model;

import java.io.Serializable;

/**
 * A task paired with its priority as computed at read time.
 */
public record PrioritizedTask(Task task, double priority) implements Serializable {}
