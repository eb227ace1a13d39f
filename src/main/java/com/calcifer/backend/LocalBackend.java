package com.calcifer.backend;

import com.calcifer.core.engine.RunContext;
import com.calcifer.core.model.Host;
import com.calcifer.core.task.Task;
import com.calcifer.core.task.TaskContext;

import java.time.Duration;

/**
 * Runs tasks in-process on the control machine.
 */
public class LocalBackend implements ExecutionBackend {

    private final Duration commandTimeout;

    public LocalBackend(Duration commandTimeout) {
        this.commandTimeout = commandTimeout;
    }

    @Override
    public BackendOutcome execute(Task task, Host host, RunContext run) throws Exception {
        LocalShell shell = new LocalShell(host, commandTimeout);
        try {
            return BackendOutcome.completed(task.execute(host, TaskContext.of(host, shell, run)));
        } finally {
            shell.removeStagedFiles();
        }
    }
}
