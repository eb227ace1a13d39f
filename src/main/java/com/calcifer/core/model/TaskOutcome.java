package com.calcifer.core.model;

import java.util.Objects;

/**
 * Value returned by a task body.
 *
 * @param status  reported status
 * @param message human-readable summary
 * @param changed whether the task modified system state
 */
public record TaskOutcome(TaskStatus status, String message, boolean changed) {

    public TaskOutcome {
        Objects.requireNonNull(status, "status");
        message = message != null ? message : "";
        if (status == TaskStatus.CHANGED) {
            changed = true;
        }
    }

    public static TaskOutcome ok(String message) {
        return new TaskOutcome(TaskStatus.OK, message, false);
    }

    public static TaskOutcome changed(String message) {
        return new TaskOutcome(TaskStatus.CHANGED, message, true);
    }

    public static TaskOutcome warning(String message) {
        return new TaskOutcome(TaskStatus.WARNING, message, false);
    }

    public static TaskOutcome failed(String message) {
        return new TaskOutcome(TaskStatus.FAILED, message, false);
    }

    public static TaskOutcome skipped(String message) {
        return new TaskOutcome(TaskStatus.SKIPPED, message, false);
    }
}
