package com.calcifer.backend.ssh;

import com.calcifer.core.model.Host;

/**
 * Opens authenticated sessions to remote hosts.
 */
@FunctionalInterface
public interface SessionFactory {

    RemoteSession open(Host host) throws ConnectionException;
}
