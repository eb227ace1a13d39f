package com.calcifer.tasks;

import com.calcifer.backend.FakeHostShell;
import com.calcifer.core.model.TaskOutcome;
import com.calcifer.core.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.calcifer.backend.FakeHostShell.fail;
import static com.calcifer.backend.FakeHostShell.ok;
import static com.calcifer.tasks.TaskContexts.WORKER1;
import static com.calcifer.tasks.TaskContexts.context;
import static org.junit.jupiter.api.Assertions.*;

class SetHostnameTaskTest {

    private final SetHostnameTask task = new SetHostnameTask();
    private final FakeHostShell shell = new FakeHostShell(WORKER1);

    @Test
    @DisplayName("a configured node is left alone")
    void alreadySet() {
        shell.respond("hostnamectl", ok(""));
        shell.respond("hostname", ok("worker1\n"));
        shell.respond("cat '/etc/hosts'", ok("127.0.0.1 localhost\n127.0.1.1 worker1\n10.0.0.10 cp1\n"));

        TaskOutcome outcome = task.execute(WORKER1, context(WORKER1, shell));

        assertEquals(TaskStatus.OK, outcome.status());
        assertEquals("Hostname and /etc/hosts already set for worker1", outcome.message());
        assertFalse(shell.ran("hostnamectl"));
        assertTrue(shell.stagedContents().isEmpty());
    }

    @Test
    @DisplayName("renames the node and adds its own and peer entries")
    void configures() {
        shell.respond("hostnamectl", ok(""));
        shell.respond("hostname", ok("ubuntu-vm\n"));
        shell.respond("cat '/etc/hosts'", ok("127.0.0.1 localhost\n"));

        TaskOutcome outcome = task.execute(WORKER1, context(WORKER1, shell));

        assertEquals(TaskStatus.CHANGED, outcome.status());
        assertEquals("Updated hostname ubuntu-vm -> worker1, 127.0.1.1 entry, peer cp1", outcome.message());
        assertTrue(shell.ran("hostnamectl set-hostname '\\''worker1'\\''"));
        assertEquals(List.of(
                "127.0.0.1 localhost\n127.0.1.1 worker1\n",
                "127.0.0.1 localhost\n10.0.0.10 cp1\n"), shell.stagedContents());
    }

    @Test
    @DisplayName("a rejected rename fails the task")
    void renameFails() {
        shell.respond("hostnamectl", fail(1, "Could not set static hostname: Access denied"));
        shell.respond("hostname", ok("ubuntu-vm"));

        TaskOutcome outcome = task.execute(WORKER1, context(WORKER1, shell));

        assertEquals(TaskStatus.FAILED, outcome.status());
        assertEquals("Failed to set hostname: Could not set static hostname: Access denied", outcome.message());
    }
}
