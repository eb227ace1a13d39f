package com.calcifer.core.task;

import com.calcifer.backend.ExecutionBackend;
import com.calcifer.core.engine.RunContext;
import com.calcifer.core.model.Host;
import com.calcifer.core.model.TaskResult;

/**
 * A task bound to the harness. Running it never throws; every outcome is a {@link TaskResult}.
 */
public final class HarnessedTask {

    private final Task task;
    private final TaskHarness harness;

    HarnessedTask(Task task, TaskHarness harness) {
        this.task = task;
        this.harness = harness;
    }

    public Task task() {
        return task;
    }

    public String name() {
        return task.name();
    }

    public TaskResult run(Host host, ExecutionBackend backend, RunContext run) {
        return harness.invoke(task, host, backend, run);
    }
}
