package com.calcifer.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one task on one host, as recorded in the run report.
 *
 * @param hostId     the host the task ran against
 * @param taskName   the task name
 * @param status     final status
 * @param message    summary for the operator
 * @param changed    whether system state was modified
 * @param errorKind  error classification, null when the task did not error
 * @param startedAt  when the harness started the task
 * @param finishedAt when the harness finished the task
 */
public record TaskResult(
    String hostId,
    String taskName,
    TaskStatus status,
    String message,
    boolean changed,
    ErrorKind errorKind,
    Instant startedAt,
    Instant finishedAt
) {

    public static TaskResult failure(String hostId, String taskName, ErrorKind kind, String message,
                                     Instant startedAt, Instant finishedAt) {
        return new TaskResult(hostId, taskName, TaskStatus.FAILED, message, false, kind, startedAt, finishedAt);
    }

    public boolean failed() {
        return status == TaskStatus.FAILED;
    }

    public Duration duration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }
}
