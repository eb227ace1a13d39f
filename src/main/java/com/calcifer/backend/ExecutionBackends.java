package com.calcifer.backend;

import com.calcifer.core.model.Host;

/**
 * Chooses the backend for a host: local for the control machine, remote otherwise.
 */
public class ExecutionBackends {

    private final ExecutionBackend local;
    private final ExecutionBackend remote;

    public ExecutionBackends(ExecutionBackend local, ExecutionBackend remote) {
        this.local = local;
        this.remote = remote;
    }

    public ExecutionBackend forHost(Host host) {
        return host.local() ? local : remote;
    }
}
