package com.calcifer.tasks;

import com.calcifer.backend.CommandResult;
import com.calcifer.backend.HostShell;
import com.calcifer.core.model.Host;
import com.calcifer.core.model.TaskOutcome;
import com.calcifer.core.task.Task;
import com.calcifer.core.task.TaskContext;

/**
 * Tears a node out of the cluster with {@code kubeadm reset}.
 */
public class ResetNodeTask implements Task {

    @Override
    public String name() {
        return "reset-node";
    }

    @Override
    public String description() {
        return "Reset Kubernetes node";
    }

    @Override
    public TaskOutcome execute(Host host, TaskContext context) {
        HostShell shell = context.shell();
        boolean member = shell.sudo("test -f /etc/kubernetes/kubelet.conf || test -f /etc/kubernetes/admin.conf")
                .succeeded();
        if (!member) {
            return TaskOutcome.ok("Node is not part of a cluster");
        }
        CommandResult reset = shell.sudo("kubeadm reset -f && rm -rf /etc/cni/net.d /var/lib/calcifer/flux_bootstrapped");
        if (!reset.succeeded()) {
            return TaskOutcome.failed("kubeadm reset failed: " + reset.errorSummary());
        }
        shell.run("rm -f $HOME/.kube/config");
        return TaskOutcome.changed("Node reset");
    }
}
