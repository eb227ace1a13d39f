package com.calcifer.backend;

import com.calcifer.core.engine.RunContext;
import com.calcifer.core.model.Host;
import com.calcifer.core.task.Task;

/**
 * Runs one task against one host. Exceptions thrown by the task body propagate
 * to the caller; the task harness turns them into results.
 */
public interface ExecutionBackend {

    BackendOutcome execute(Task task, Host host, RunContext run) throws Exception;
}
