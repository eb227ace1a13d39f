package com.calcifer.backend;

import com.calcifer.backend.ssh.ConnectionException;
import com.calcifer.backend.ssh.SessionLease;
import com.calcifer.core.engine.RunContext;
import com.calcifer.core.model.Host;
import com.calcifer.core.task.Task;
import com.calcifer.core.task.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Runs tasks against a remote host through the run's pooled session.
 */
public class RemoteBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(RemoteBackend.class);

    private final Duration commandTimeout;

    public RemoteBackend(Duration commandTimeout) {
        this.commandTimeout = commandTimeout;
    }

    @Override
    public BackendOutcome execute(Task task, Host host, RunContext run) throws Exception {
        SessionLease lease;
        try {
            lease = run.sessions().acquire(host);
        } catch (ConnectionException e) {
            log.error("Connection to {} failed: {}", host.name(), e.getMessage());
            return BackendOutcome.connectionFailure(e.getMessage());
        }
        try (lease) {
            RemoteShell shell = new RemoteShell(host, lease.session(), run.sessions(), commandTimeout);
            try {
                return BackendOutcome.completed(task.execute(host, TaskContext.of(host, shell, run)));
            } finally {
                int leftover = shell.removeStagedFiles();
                if (leftover > 0) {
                    log.warn("{} staged file(s) could not be removed from {}", leftover, host.name());
                }
            }
        }
    }
}
