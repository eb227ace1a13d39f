package com.calcifer.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable side of a {@link RunReport}. Worker lanes append concurrently;
 * the engine seals it exactly once when the run ends.
 */
public class RunReportRecorder {

    private final String runId;
    private final Goal goal;
    private final Instant startedAt;
    private final List<TaskResult> results = new ArrayList<>();
    private RunReport sealed;

    public RunReportRecorder(String runId, Goal goal, Instant startedAt) {
        this.runId = runId;
        this.goal = goal;
        this.startedAt = startedAt;
    }

    public synchronized void append(TaskResult result) {
        if (sealed != null) {
            throw new IllegalStateException("Run report " + runId + " is sealed");
        }
        results.add(result);
    }

    public synchronized List<TaskResult> snapshot() {
        return List.copyOf(results);
    }

    public synchronized boolean isSealed() {
        return sealed != null;
    }

    public synchronized RunReport seal(Instant finishedAt, String abortReason) {
        if (sealed != null) {
            throw new IllegalStateException("Run report " + runId + " is already sealed");
        }
        sealed = new RunReport(runId, goal, results, RunStatus.rollup(results), startedAt, finishedAt,
                abortReason != null, abortReason);
        return sealed;
    }
}
