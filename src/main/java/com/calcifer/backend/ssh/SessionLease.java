package com.calcifer.backend.ssh;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive use of a pooled session for the duration of one task.
 * Closing the lease releases the host lock; the session itself stays open.
 */
public final class SessionLease implements AutoCloseable {

    private final RemoteSession session;
    private final ReentrantLock lock;
    private boolean released;

    SessionLease(RemoteSession session, ReentrantLock lock) {
        this.session = session;
        this.lock = lock;
    }

    public RemoteSession session() {
        return session;
    }

    @Override
    public void close() {
        if (!released) {
            released = true;
            lock.unlock();
        }
    }
}
