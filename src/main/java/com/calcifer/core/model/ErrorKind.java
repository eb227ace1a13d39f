package com.calcifer.core.model;

/**
 * Classifies why a task result is not clean.
 */
public enum ErrorKind {
    TASK_EXECUTION,
    CONNECTION,
    TIMEOUT,
    IDEMPOTENCY_VIOLATION
}
