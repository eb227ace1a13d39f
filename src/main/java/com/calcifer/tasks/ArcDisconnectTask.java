package com.calcifer.tasks;

import com.calcifer.backend.CommandResult;
import com.calcifer.config.RunSettings;
import com.calcifer.core.model.Host;
import com.calcifer.core.model.TaskOutcome;
import com.calcifer.core.task.Task;
import com.calcifer.core.task.TaskContext;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static com.calcifer.backend.AbstractHostShell.quote;

/**
 * Removes the cluster's Azure Arc projection.
 */
public class ArcDisconnectTask implements Task {

    @Override
    public String name() {
        return "arc-disconnect";
    }

    @Override
    public String description() {
        return "Disconnect cluster from Azure Arc";
    }

    @Override
    public TaskOutcome execute(Host host, TaskContext context) {
        Optional<AzureArc.Target> target = AzureArc.target(context.settings());
        if (target.isEmpty()) {
            return TaskOutcome.skipped(AzureArc.MISSING_TARGET);
        }
        if (!context.shell().run("az account show -o none").succeeded()) {
            return TaskOutcome.warning("Not authenticated to Azure; Arc resource left in place");
        }
        if (AzureArc.connectionStatus(context.shell(), target.get()).isEmpty()) {
            return TaskOutcome.ok("Cluster is not connected to Azure Arc");
        }
        Path kubeconfig = Path.of(context.settings().getOrDefault(RunSettings.LOCAL_KUBECONFIG,
                "inventory/kubeconfig_admin.yaml")).toAbsolutePath();
        String env = Files.isRegularFile(kubeconfig) ? "KUBECONFIG=" + quote(kubeconfig.toString()) + " " : "";
        CommandResult delete = context.shell().run(env + "az connectedk8s delete " + target.get().args() + " --yes");
        if (!delete.succeeded()) {
            return TaskOutcome.failed("Arc disconnect failed: " + delete.errorSummary());
        }
        return TaskOutcome.changed("Cluster " + target.get().clusterName() + " removed from Azure Arc");
    }
}
