package com.calcifer.tasks;

import com.calcifer.backend.CommandResult;
import com.calcifer.backend.HostShell;
import com.calcifer.config.RunSettings;
import com.calcifer.core.engine.RunFacts;
import com.calcifer.core.model.Host;
import com.calcifer.core.model.TaskOutcome;
import com.calcifer.core.model.TaskStatus;
import com.calcifer.core.task.Task;
import com.calcifer.core.task.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.calcifer.backend.AbstractHostShell.quote;

/**
 * Initialises the Kubernetes control plane with kubeadm and leaves the cluster usable:
 * user kubeconfig, CNI, schedulable control plane, a published worker join command and
 * a copy of {@code admin.conf} on the control machine.
 */
public class InitControlPlaneTask implements Task {

    private static final Logger log = LoggerFactory.getLogger(InitControlPlaneTask.class);

    static final String ADMIN_CONF = "/etc/kubernetes/admin.conf";
    static final String CONTROL_PLANE_TAINT = "node-role.kubernetes.io/control-plane:NoSchedule";

    @Override
    public String name() {
        return "init-control-plane";
    }

    @Override
    public String description() {
        return "Initialise Kubernetes control plane";
    }

    @Override
    public TaskOutcome execute(Host host, TaskContext context) {
        HostShell shell = context.shell();
        RunSettings settings = context.settings();
        List<String> changes = new ArrayList<>();

        if (!shell.sudo("test -f " + ADMIN_CONF).succeeded()) {
            String config = kubeadmConfig(host, settings.getOrDefault(RunSettings.POD_NETWORK_CIDR, "10.244.0.0/16"));
            String staged = shell.stage(config);
            log.info("Running kubeadm init on {}", host.name());
            CommandResult init = shell.sudo("kubeadm init --config " + quote(staged) + " --upload-certs");
            if (!init.succeeded()) {
                return TaskOutcome.failed("kubeadm init failed: " + tail(init.errorSummary()));
            }
            changes.add("kubeadm init");
        }

        if (!shell.run("test -f $HOME/.kube/config").succeeded()) {
            CommandResult kubeconfig = shell.run("mkdir -p $HOME/.kube"
                    + " && sudo -n cp " + ADMIN_CONF + " $HOME/.kube/config"
                    + " && sudo -n chown $(id -u):$(id -g) $HOME/.kube/config");
            if (!kubeconfig.succeeded()) {
                return new TaskOutcome(TaskStatus.FAILED,
                        "Failed to set up user kubeconfig: " + kubeconfig.errorSummary(), !changes.isEmpty());
            }
            changes.add("user kubeconfig");
        }

        String cni = settings.get(RunSettings.CNI_MANIFEST_URL).orElse(null);
        if (cni != null && !shell.run("kubectl get -f " + quote(cni) + " >/dev/null 2>&1").succeeded()) {
            CommandResult apply = shell.run("kubectl apply -f " + quote(cni));
            if (!apply.succeeded()) {
                return new TaskOutcome(TaskStatus.FAILED,
                        "Failed to apply CNI manifest: " + apply.errorSummary(), !changes.isEmpty());
            }
            changes.add("CNI");
        }

        CommandResult taints = shell.run("kubectl get node " + quote(host.name()) + " -o jsonpath='{.spec.taints}'");
        if (taints.succeeded() && taints.stdout().contains("node-role.kubernetes.io/control-plane")) {
            CommandResult untaint = shell.run("kubectl taint nodes " + quote(host.name()) + " " + CONTROL_PLANE_TAINT + "-");
            if (!untaint.succeeded() && !untaint.errorSummary().contains("not found")) {
                return new TaskOutcome(TaskStatus.FAILED,
                        "Failed to untaint control plane: " + untaint.errorSummary(), !changes.isEmpty());
            }
            changes.add("untaint");
        }

        CommandResult join = shell.sudo("kubeadm token create --print-join-command");
        if (!join.succeeded() || join.output().isEmpty()) {
            return new TaskOutcome(TaskStatus.FAILED,
                    "Could not create worker join command: " + join.errorSummary(), !changes.isEmpty());
        }
        context.facts().putShared(RunFacts.JOIN_COMMAND, join.output());

        String handoff = "/tmp/calcifer_kubeconfig_" + UUID.randomUUID().toString().replace("-", "");
        CommandResult copy = shell.run("sudo -n install -m 600 -o $(id -u) -g $(id -g) "
                + ADMIN_CONF + " " + handoff);
        if (copy.succeeded()) {
            Path local = Path.of(settings.getOrDefault(RunSettings.LOCAL_KUBECONFIG, "inventory/kubeconfig_admin.yaml"));
            shell.retrieveOnClose(handoff, local);
        } else {
            log.warn("Could not prepare admin.conf for retrieval from {}: {}", host.name(), copy.errorSummary());
        }

        if (changes.isEmpty()) {
            return TaskOutcome.ok("Control plane already initialised");
        }
        return TaskOutcome.changed("Control plane ready (" + String.join(", ", changes) + ")");
    }

    static String kubeadmConfig(Host host, String podCidr) {
        return """
                apiVersion: kubeadm.k8s.io/v1beta3
                kind: InitConfiguration
                nodeRegistration:
                  name: "%s"
                  kubeletExtraArgs:
                    node-ip: "%s"
                ---
                apiVersion: kubeadm.k8s.io/v1beta3
                kind: ClusterConfiguration
                networking:
                  podSubnet: "%s"
                """.formatted(host.name(), host.address(), podCidr);
    }

    private static String tail(String text) {
        return text.length() > 200 ? text.substring(text.length() - 200) : text;
    }
}
