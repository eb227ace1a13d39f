package com.calcifer.backend;

import com.calcifer.core.model.ErrorKind;
import com.calcifer.core.model.TaskOutcome;

/**
 * What a backend reports for one task invocation: either the task's own outcome,
 * or a failure that prevented the task from running.
 */
public record BackendOutcome(TaskOutcome outcome, ErrorKind errorKind, String error) {

    public static BackendOutcome completed(TaskOutcome outcome) {
        return new BackendOutcome(outcome, null, null);
    }

    public static BackendOutcome connectionFailure(String error) {
        return new BackendOutcome(null, ErrorKind.CONNECTION, error);
    }

    public boolean isCompleted() {
        return outcome != null;
    }
}
