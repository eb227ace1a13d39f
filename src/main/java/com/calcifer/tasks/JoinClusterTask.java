package com.calcifer.tasks;

import com.calcifer.backend.CommandResult;
import com.calcifer.backend.HostShell;
import com.calcifer.core.engine.RunFacts;
import com.calcifer.core.model.Host;
import com.calcifer.core.model.TaskOutcome;
import com.calcifer.core.task.Task;
import com.calcifer.core.task.TaskContext;

import java.util.Optional;

import static com.calcifer.backend.AbstractHostShell.quote;

/**
 * Joins a worker to the cluster with the join command published by the control plane.
 */
public class JoinClusterTask implements Task {

    static final String KUBELET_CONF = "/etc/kubernetes/kubelet.conf";

    @Override
    public String name() {
        return "join-cluster";
    }

    @Override
    public String description() {
        return "Join worker node to the cluster";
    }

    @Override
    public TaskOutcome execute(Host host, TaskContext context) {
        HostShell shell = context.shell();
        if (shell.sudo("test -f " + KUBELET_CONF).succeeded()) {
            return TaskOutcome.ok("Node already joined");
        }
        Optional<String> join = context.facts().shared(RunFacts.JOIN_COMMAND);
        if (join.isEmpty()) {
            return TaskOutcome.failed("No join command available; the control plane must be initialised in this run");
        }
        if (!join.get().startsWith("kubeadm join ")) {
            return TaskOutcome.failed("Published join command is not a kubeadm join command");
        }
        CommandResult result = shell.sudo(join.get() + " --node-name " + quote(host.name()));
        if (!result.succeeded()) {
            return TaskOutcome.failed("kubeadm join failed: " + result.errorSummary());
        }
        return TaskOutcome.changed("Joined cluster as " + host.name());
    }
}
