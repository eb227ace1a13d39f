package com.calcifer.core.model;

/**
 * Outcome of one task on one host.
 */
public enum TaskStatus {
    OK,       // desired state already held
    CHANGED,  // state was changed to reach the desired state
    WARNING,
    FAILED,
    SKIPPED
}
