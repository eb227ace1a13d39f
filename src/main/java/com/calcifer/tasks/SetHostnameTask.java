package com.calcifer.tasks;

import com.calcifer.backend.CommandResult;
import com.calcifer.backend.HostShell;
import com.calcifer.core.model.Host;
import com.calcifer.core.model.TaskOutcome;
import com.calcifer.core.task.Task;
import com.calcifer.core.task.TaskContext;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static com.calcifer.backend.AbstractHostShell.quote;

/**
 * Sets the system hostname to the inventory name and keeps {@code /etc/hosts} consistent:
 * localhost, the node's own name, and the addresses of the other cluster nodes.
 */
public class SetHostnameTask implements Task {

    static final String HOSTS_FILE = "/etc/hosts";

    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    @Override
    public String name() {
        return "set-hostname";
    }

    @Override
    public String description() {
        return "Configure system hostname and /etc/hosts";
    }

    @Override
    public TaskOutcome execute(Host host, TaskContext context) {
        HostShell shell = context.shell();
        String target = host.name();
        List<String> changes = new ArrayList<>();

        CommandResult current = shell.run("hostname");
        if (!current.succeeded()) {
            return TaskOutcome.failed("Failed to read hostname");
        }
        if (!current.output().equals(target)) {
            CommandResult set = shell.sudo("hostnamectl set-hostname " + quote(target));
            if (!set.succeeded()) {
                return TaskOutcome.failed("Failed to set hostname: " + set.errorSummary());
            }
            changes.add("hostname " + current.output() + " -> " + target);
        }

        if (FileOperations.ensureLine(shell, HOSTS_FILE, "127.0.0.1 localhost",
                Pattern.compile("^127\\.0\\.0\\.1\\s+localhost(\\s|$)"))) {
            changes.add("localhost entry");
        }
        if (FileOperations.ensureLine(shell, HOSTS_FILE, "127.0.1.1 " + target,
                Pattern.compile("^127\\.0\\.1\\.1\\s+"))) {
            changes.add("127.0.1.1 entry");
        }
        for (Host peer : context.inventory().hosts()) {
            if (peer.local() || peer.name().equals(target) || peer.address() == null
                    || !IPV4.matcher(peer.address()).matches()) {
                continue;
            }
            if (FileOperations.ensureLine(shell, HOSTS_FILE, peer.address() + " " + peer.name(),
                    Pattern.compile("^\\S+\\s+" + Pattern.quote(peer.name()) + "(\\s|$)"))) {
                changes.add("peer " + peer.name());
            }
        }

        if (changes.isEmpty()) {
            return TaskOutcome.ok("Hostname and /etc/hosts already set for " + target);
        }
        return TaskOutcome.changed("Updated " + String.join(", ", changes));
    }
}
