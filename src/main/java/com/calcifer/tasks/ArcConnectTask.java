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
 * Projects the cluster into Azure Arc from the control machine, using the kubeconfig
 * retrieved during initialisation.
 */
public class ArcConnectTask implements Task {

    @Override
    public String name() {
        return "arc-connect";
    }

    @Override
    public String description() {
        return "Connect cluster to Azure Arc";
    }

    @Override
    public TaskOutcome execute(Host host, TaskContext context) {
        Optional<AzureArc.Target> target = AzureArc.target(context.settings());
        if (target.isEmpty()) {
            return TaskOutcome.failed(AzureArc.MISSING_TARGET);
        }
        Optional<String> status = AzureArc.connectionStatus(context.shell(), target.get());
        if (status.isPresent()) {
            return TaskOutcome.ok("Already connected (status: " + status.get() + ")");
        }

        Path kubeconfig = Path.of(context.settings().getOrDefault(RunSettings.LOCAL_KUBECONFIG,
                "inventory/kubeconfig_admin.yaml")).toAbsolutePath();
        if (!Files.isRegularFile(kubeconfig)) {
            return TaskOutcome.failed("Local kubeconfig not found at " + kubeconfig + "; run init first");
        }
        CommandResult connect = context.shell().run("KUBECONFIG=" + quote(kubeconfig.toString())
                + " az connectedk8s connect " + target.get().args()
                + " --location " + quote(target.get().location())
                + " --yes --correlation-id calcifer-automation");
        if (!connect.succeeded()) {
            return TaskOutcome.failed("Arc connection failed: " + connect.errorSummary());
        }
        return TaskOutcome.changed("Cluster " + target.get().clusterName() + " connected to Azure Arc");
    }
}
