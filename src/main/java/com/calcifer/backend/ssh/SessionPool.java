package com.calcifer.backend.ssh;

import com.calcifer.core.model.Host;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-run cache of remote sessions, one per host.
 * <p>
 * Sessions are opened lazily on first {@link #acquire(Host)} and reused by every later task
 * on that host. {@link #close()} runs pending retrievals and disconnects everything; the
 * engine calls it on completion and on abort.
 */
public class SessionPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionPool.class);

    private static final Duration CLEANUP_TIMEOUT = Duration.ofSeconds(30);

    private final SessionFactory factory;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public SessionPool(SessionFactory factory) {
        this.factory = factory;
    }

    /**
     * Leases the host's session, opening it if needed. Blocks while another task holds it;
     * the wait ends early when the calling thread is interrupted or the pool has closed meanwhile.
     *
     * @throws ConnectionException if the session cannot be opened or authenticated
     * @throws InterruptedException if the caller was interrupted while waiting for the lease
     */
    public SessionLease acquire(Host host) throws ConnectionException, InterruptedException {
        if (closed) {
            throw new IllegalStateException("Session pool is closed");
        }
        Entry entry = entries.computeIfAbsent(host.name(), k -> new Entry(host));
        entry.lock.lockInterruptibly();
        try {
            if (closed) {
                throw new IllegalStateException("Session pool is closed");
            }
            if (entry.session == null) {
                log.info("Opening session to {} ({}:{})", host.name(), host.address(), host.port());
                entry.session = factory.open(host);
            } else if (!entry.session.isOpen()) {
                log.warn("Session to {} was closed, reopening", host.name());
                closeQuietly(entry.session);
                entry.session = null;
                entry.session = factory.open(host);
            }
            return new SessionLease(entry.session, entry.lock);
        } catch (ConnectionException | RuntimeException e) {
            entry.lock.unlock();
            throw e;
        }
    }

    /**
     * Registers a file to copy from the host when the pool closes. The host copy is
     * deleted after the transfer.
     */
    public void retrieveOnClose(Host host, String remotePath, Path localPath) {
        Entry entry = entries.computeIfAbsent(host.name(), k -> new Entry(host));
        synchronized (entry.retrievals) {
            entry.retrievals.add(new Retrieval(remotePath, localPath));
        }
    }

    public int openSessions() {
        return (int) entries.values().stream()
                .filter(e -> e.session != null && e.session.isOpen())
                .count();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Performs pending retrievals and disconnects every session. Failures on one host are
     * logged and do not prevent closing the others. Safe to call more than once.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Entry entry : entries.values()) {
            boolean locked = lockForCleanup(entry);
            try {
                runRetrievals(entry);
                if (entry.session != null) {
                    closeQuietly(entry.session);
                    entry.session = null;
                }
            } finally {
                if (locked) {
                    entry.lock.unlock();
                }
            }
        }
        log.info("Session pool closed ({} hosts)", entries.size());
    }

    private void runRetrievals(Entry entry) {
        List<Retrieval> pending;
        synchronized (entry.retrievals) {
            pending = new ArrayList<>(entry.retrievals);
            entry.retrievals.clear();
        }
        if (pending.isEmpty()) {
            return;
        }
        if (entry.session == null || !entry.session.isOpen()) {
            log.warn("Cannot retrieve {} file(s) from {}: no open session", pending.size(), entry.host.name());
            return;
        }
        for (Retrieval retrieval : pending) {
            try {
                Path parent = retrieval.localPath().toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                entry.session.download(retrieval.remotePath(), retrieval.localPath());
                log.info("Retrieved {}:{} to {}", entry.host.name(), retrieval.remotePath(), retrieval.localPath());
            } catch (IOException e) {
                log.warn("Retrieval of {} from {} failed: {}", retrieval.remotePath(), entry.host.name(), e.getMessage());
            }
            try {
                entry.session.exec("rm -f '" + retrieval.remotePath().replace("'", "'\\''") + "'", CLEANUP_TIMEOUT);
            } catch (IOException e) {
                log.warn("Could not delete {} on {}: {}", retrieval.remotePath(), entry.host.name(), e.getMessage());
            }
        }
    }

    /**
     * A task that outlived its timeout may still hold the lease; its session is closed regardless
     * once the cleanup timeout expires, which also ends the stuck command.
     */
    private static boolean lockForCleanup(Entry entry) {
        try {
            if (entry.lock.tryLock(CLEANUP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            log.warn("Session to {} still busy after {}s, closing it anyway",
                    entry.host.name(), CLEANUP_TIMEOUT.toSeconds());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for session to {}, closing it anyway", entry.host.name());
        }
        return false;
    }

    private static void closeQuietly(RemoteSession session) {
        try {
            session.close();
        } catch (IOException | RuntimeException e) {
            log.warn("Error closing session to {}: {}", session.hostId(), e.getMessage());
        }
    }

    private record Retrieval(String remotePath, Path localPath) {}

    private static final class Entry {
        private final Host host;
        private final ReentrantLock lock = new ReentrantLock();
        private final List<Retrieval> retrievals = new ArrayList<>();
        private volatile RemoteSession session;

        private Entry(Host host) {
            this.host = host;
        }
    }
}
