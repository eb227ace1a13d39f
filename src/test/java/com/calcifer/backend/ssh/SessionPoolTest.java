package com.calcifer.backend.ssh;

import com.calcifer.core.model.Host;
import com.calcifer.core.model.HostGroup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SessionPoolTest {

    private final Host cp1 = Host.remote("cp1", "10.0.0.10", "ubuntu", HostGroup.CONTROL_PLANE);
    private final Host w1 = Host.remote("w1", "10.0.0.11", "ubuntu", HostGroup.WORKERS);
    private final List<FakeRemoteSession> opened = new CopyOnWriteArrayList<>();
    private final AtomicInteger opens = new AtomicInteger();

    private final SessionFactory factory = host -> {
        opens.incrementAndGet();
        FakeRemoteSession session = new FakeRemoteSession(host.name());
        opened.add(session);
        return session;
    };

    @Nested
    @DisplayName("acquire")
    class AcquireTests {

        @Test
        @DisplayName("opens one session per host and reuses it")
        void reusesSession() throws Exception {
            var pool = new SessionPool(factory);

            RemoteSession first;
            try (SessionLease lease = pool.acquire(cp1)) {
                first = lease.session();
            }
            try (SessionLease lease = pool.acquire(cp1)) {
                assertSame(first, lease.session());
            }
            try (SessionLease ignored = pool.acquire(w1)) {
                assertEquals(2, pool.openSessions());
            }
            assertEquals(2, opens.get());
        }

        @Test
        @DisplayName("reopens a session that was closed underneath")
        void reopensClosedSession() throws Exception {
            var pool = new SessionPool(factory);
            try (SessionLease lease = pool.acquire(cp1)) {
                ((FakeRemoteSession) lease.session()).breakConnection();
            }

            try (SessionLease lease = pool.acquire(cp1)) {
                assertTrue(lease.session().isOpen());
            }
            assertEquals(2, opens.get());
        }

        @Test
        @DisplayName("a failed open releases the host lock")
        void failedOpenReleasesLock() throws Exception {
            AtomicBoolean fail = new AtomicBoolean(true);
            var pool = new SessionPool(host -> {
                if (fail.get()) {
                    throw new ConnectionException(host.name(), "Connection refused");
                }
                return factory.open(host);
            });

            assertThrows(ConnectionException.class, () -> pool.acquire(cp1));
            fail.set(false);
            try (SessionLease lease = pool.acquire(cp1)) {
                assertTrue(lease.session().isOpen());
            }
        }

        @Test
        @DisplayName("leases on the same host are exclusive")
        void leasesAreExclusive() throws Exception {
            var pool = new SessionPool(factory);
            CountDownLatch acquired = new CountDownLatch(1);

            SessionLease held = pool.acquire(cp1);
            Thread other = new Thread(() -> {
                try (SessionLease ignored = pool.acquire(cp1)) {
                    acquired.countDown();
                } catch (ConnectionException | InterruptedException e) {
                    throw new IllegalStateException(e);
                }
            });
            other.start();

            assertFalse(acquired.await(200, TimeUnit.MILLISECONDS));
            held.close();
            assertTrue(acquired.await(5, TimeUnit.SECONDS));
            other.join(5000);
        }

        @Test
        @DisplayName("a waiter interrupted while the host is leased gives up without opening a session")
        void interruptedWaiterGivesUp() throws Exception {
            var pool = new SessionPool(factory);
            SessionLease held = pool.acquire(cp1);
            AtomicBoolean interrupted = new AtomicBoolean();
            AtomicBoolean leased = new AtomicBoolean();
            Thread waiter = new Thread(() -> {
                try (SessionLease ignored = pool.acquire(cp1)) {
                    leased.set(true);
                } catch (InterruptedException e) {
                    interrupted.set(true);
                } catch (ConnectionException e) {
                    throw new IllegalStateException(e);
                }
            });
            waiter.start();
            Thread.sleep(100);

            waiter.interrupt();
            waiter.join(5000);

            assertFalse(waiter.isAlive());
            assertTrue(interrupted.get());
            assertFalse(leased.get());
            assertEquals(1, opens.get());
            held.close();
        }

        @Test
        @DisplayName("a waiter that gets the lock after the pool closed is refused")
        void waiterAfterCloseIsRefused() throws Exception {
            var pool = new SessionPool(factory);
            SessionLease held = pool.acquire(cp1);
            AtomicReference<Throwable> failure = new AtomicReference<>();
            CountDownLatch waiting = new CountDownLatch(1);
            Thread waiter = new Thread(() -> {
                waiting.countDown();
                try (SessionLease ignored = pool.acquire(cp1)) {
                    failure.set(new AssertionError("lease granted on a closed pool"));
                } catch (Exception e) {
                    failure.set(e);
                }
            });
            waiter.start();
            assertTrue(waiting.await(5, TimeUnit.SECONDS));
            Thread.sleep(100);

            Thread closer = new Thread(pool::close);
            closer.start();
            Thread.sleep(100);
            held.close();
            closer.join(5000);
            waiter.join(5000);

            assertFalse(waiter.isAlive());
            assertInstanceOf(IllegalStateException.class, failure.get());
            assertEquals(1, opens.get());
            assertTrue(opened.get(0).isClosed());
        }

        @Test
        @DisplayName("closing a lease twice releases the lock once")
        void doubleCloseIsSafe() throws Exception {
            var pool = new SessionPool(factory);
            SessionLease lease = pool.acquire(cp1);
            lease.close();
            assertDoesNotThrow(lease::close);
        }
    }

    @Nested
    @DisplayName("close")
    class CloseTests {

        @Test
        @DisplayName("closes every session and rejects later acquires")
        void closesEverything() throws Exception {
            var pool = new SessionPool(factory);
            pool.acquire(cp1).close();
            pool.acquire(w1).close();

            pool.close();
            pool.close();

            assertTrue(pool.isClosed());
            assertTrue(opened.stream().allMatch(FakeRemoteSession::isClosed));
            assertThrows(IllegalStateException.class, () -> pool.acquire(cp1));
        }

        @Test
        @DisplayName("retrieves registered files and deletes the remote copies")
        void retrievesFiles(@TempDir Path tmp) throws Exception {
            var pool = new SessionPool(factory);
            try (SessionLease lease = pool.acquire(cp1)) {
                ((FakeRemoteSession) lease.session()).putFile("/tmp/calcifer_admin", "clusters: []");
            }
            Path local = tmp.resolve("nested/admin.yaml");
            pool.retrieveOnClose(cp1, "/tmp/calcifer_admin", local);

            pool.close();

            assertEquals("clusters: []", Files.readString(local));
            assertTrue(opened.get(0).files().isEmpty());
        }

        @Test
        @DisplayName("a failed retrieval does not prevent closing")
        void failedRetrieval(@TempDir Path tmp) throws Exception {
            var pool = new SessionPool(factory);
            pool.acquire(cp1).close();
            pool.retrieveOnClose(cp1, "/tmp/missing", tmp.resolve("missing.yaml"));

            assertDoesNotThrow(pool::close);
            assertTrue(opened.get(0).isClosed());
            assertFalse(Files.exists(tmp.resolve("missing.yaml")));
        }
    }
}
