package com.calcifer.backend;

import com.calcifer.backend.ssh.ConnectionException;
import com.calcifer.backend.ssh.FakeRemoteSession;
import com.calcifer.backend.ssh.SessionPool;
import com.calcifer.core.engine.AbortSignal;
import com.calcifer.core.engine.RunContext;
import com.calcifer.core.engine.RunFacts;
import com.calcifer.core.engine.RunOptions;
import com.calcifer.core.model.ErrorKind;
import com.calcifer.core.model.Goal;
import com.calcifer.core.model.Host;
import com.calcifer.core.model.HostGroup;
import com.calcifer.core.model.Inventory;
import com.calcifer.core.model.TaskOutcome;
import com.calcifer.core.model.TaskStatus;
import com.calcifer.core.task.ScriptedTask;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RemoteBackendTest {

    private final Host w1 = Host.remote("w1", "10.0.0.11", "ubuntu", HostGroup.WORKERS);
    private final RemoteBackend backend = new RemoteBackend(Duration.ofSeconds(5));

    private RunContext run(SessionPool pool) {
        return new RunContext("run-1", Goal.INIT, Inventory.of(w1), RunOptions.defaults(), pool,
                new RunFacts(), new AbortSignal());
    }

    @Test
    @DisplayName("connection failures are returned as outcomes and the task never runs")
    void connectionFailure() throws Exception {
        var task = ScriptedTask.returning("prepare", TaskOutcome.ok("ok"));
        var pool = new SessionPool(h -> { throw new ConnectionException(h.name(), "Auth failed"); });

        BackendOutcome outcome = backend.execute(task, w1, run(pool));

        assertFalse(outcome.isCompleted());
        assertEquals(ErrorKind.CONNECTION, outcome.errorKind());
        assertEquals("Auth failed", outcome.error());
        assertTrue(task.invocations().isEmpty());
    }

    @Test
    @DisplayName("the task sees a shell bound to the host session")
    void runsTaskThroughSession() throws Exception {
        var session = new FakeRemoteSession("w1").onCommand(cmd -> new CommandResult(0, "w1\n", ""));
        var task = new ScriptedTask("hostname", (h, c) -> TaskOutcome.ok(c.shell().run("hostname").output()));

        BackendOutcome outcome = backend.execute(task, w1, run(new SessionPool(h -> session)));

        assertTrue(outcome.isCompleted());
        assertEquals(TaskStatus.OK, outcome.outcome().status());
        assertEquals("w1", outcome.outcome().message());
    }

    @Test
    @DisplayName("staged files are removed and the lease released when the task throws")
    void cleanupWhenTaskThrows() throws Exception {
        var session = new FakeRemoteSession("w1");
        var pool = new SessionPool(h -> session);
        var task = new ScriptedTask("flux", (h, c) -> {
            c.shell().stage("private key");
            throw new IllegalStateException("bootstrap failed");
        });

        assertThrows(IllegalStateException.class, () -> backend.execute(task, w1, run(pool)));

        assertTrue(session.files().isEmpty());
        // lease released, so another thread can acquire the host
        Thread other = new Thread(() -> {
            try {
                pool.acquire(w1).close();
            } catch (ConnectionException | InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        other.start();
        other.join(5000);
        assertFalse(other.isAlive());
    }
}
