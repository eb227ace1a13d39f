package com.calcifer.tasks;

import com.calcifer.core.model.Goal;
import com.calcifer.core.model.HostGroup;
import com.calcifer.core.registry.TaskRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The built-in goal table. Groups run local machine first, then the control plane,
 * then the workers; DESTROY removes workers before the control plane.
 */
@Configuration
public class RegistryConfig {

    @Bean
    public TaskRegistry taskRegistry() {
        return defaultRegistry();
    }

    public static TaskRegistry defaultRegistry() {
        CheckConnectivityTask connectivity = new CheckConnectivityTask();
        GatherFactsTask facts = new GatherFactsTask();
        SetHostnameTask hostname = new SetHostnameTask();
        CommandTask prepareNode = NodeTasks.prepareNode();
        CommandTask containerd = NodeTasks.installContainerd();
        CommandTask kubeTools = NodeTasks.installKubeTools();
        CommandTask azureCli = NodeTasks.ensureAzureCli();
        AzureLoginTask azureLogin = new AzureLoginTask(false);
        ResetNodeTask reset = new ResetNodeTask();

        return TaskRegistry.builder()
                .register(Goal.VERIFY, HostGroup.LOCAL_MACHINE,
                        connectivity, NodeTasks.verifyAzureCli(), new AzureLoginTask(true))
                .register(Goal.VERIFY, HostGroup.CONTROL_PLANE,
                        connectivity, facts, NodeTasks.verifyKubeTools())
                .register(Goal.VERIFY, HostGroup.WORKERS,
                        connectivity, facts)

                .register(Goal.INIT, HostGroup.LOCAL_MACHINE,
                        connectivity, azureCli, azureLogin)
                .register(Goal.INIT, HostGroup.CONTROL_PLANE,
                        connectivity, facts, hostname, prepareNode, containerd, kubeTools,
                        new InitControlPlaneTask(), new FluxBootstrapTask())
                .register(Goal.INIT, HostGroup.WORKERS,
                        connectivity, facts, hostname, prepareNode, containerd, kubeTools,
                        new JoinClusterTask())

                .register(Goal.ARC_CONNECT, HostGroup.LOCAL_MACHINE,
                        connectivity, azureCli, azureLogin, new ArcConnectTask())

                .register(Goal.DESTROY, HostGroup.LOCAL_MACHINE, new ArcDisconnectTask())
                .register(Goal.DESTROY, HostGroup.WORKERS, reset)
                .register(Goal.DESTROY, HostGroup.CONTROL_PLANE, reset)
                .build();
    }
}
