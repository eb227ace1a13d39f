package com.calcifer.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Sealed outcome of one goal execution.
 *
 * @param runId       unique run identifier
 * @param goal        the goal that was run
 * @param results     task results in completion order
 * @param status      rollup over {@code results}
 * @param startedAt   run start
 * @param finishedAt  run end
 * @param aborted     true when the run stopped before finishing its plan
 * @param abortReason why the run stopped, null when not aborted
 */
public record RunReport(
    String runId,
    Goal goal,
    List<TaskResult> results,
    RunStatus status,
    Instant startedAt,
    Instant finishedAt,
    boolean aborted,
    String abortReason
) {

    public RunReport {
        results = List.copyOf(results);
    }

    public List<TaskResult> resultsForHost(String hostId) {
        return results.stream().filter(r -> r.hostId().equals(hostId)).toList();
    }

    public List<TaskResult> resultsForTask(String taskName) {
        return results.stream().filter(r -> r.taskName().equals(taskName)).toList();
    }

    public List<TaskResult> failures() {
        return results.stream().filter(TaskResult::failed).toList();
    }

    public long countByStatus(TaskStatus taskStatus) {
        return results.stream().filter(r -> r.status() == taskStatus).count();
    }

    public long changedCount() {
        return results.stream().filter(TaskResult::changed).count();
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    /**
     * Process exit code for callers: 0 when the rollup is OK, 1 otherwise.
     */
    public int exitCode() {
        return status == RunStatus.OK ? 0 : 1;
    }
}
