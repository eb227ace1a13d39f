package com.calcifer.tasks;

import com.calcifer.core.model.TaskStatus;

/**
 * Declarative node and tooling tasks built from check/apply command pairs.
 */
public final class NodeTasks {

    private NodeTasks() {}

    public static CommandTask prepareNode() {
        return CommandTask.builder("prepare-node")
                .description("Prepare OS for Kubernetes (modules, sysctl, swap)")
                .ensureAsRoot("kernel modules persisted",
                        "grep -qx overlay /etc/modules-load.d/k8s.conf && grep -qx br_netfilter /etc/modules-load.d/k8s.conf",
                        "printf 'overlay\\nbr_netfilter\\n' > /etc/modules-load.d/k8s.conf")
                .ensureAsRoot("kernel modules loaded",
                        "lsmod | grep -q '^overlay' && lsmod | grep -q '^br_netfilter'",
                        "modprobe overlay && modprobe br_netfilter")
                .ensureAsRoot("sysctl parameters",
                        "test \"$(sysctl -n net.ipv4.ip_forward)\" = 1"
                                + " && test \"$(sysctl -n net.bridge.bridge-nf-call-iptables)\" = 1",
                        "printf 'net.bridge.bridge-nf-call-iptables = 1\\nnet.bridge.bridge-nf-call-ip6tables = 1\\n"
                                + "net.ipv4.ip_forward = 1\\n' > /etc/sysctl.d/k8s.conf && sysctl --system")
                .ensureAsRoot("swap disabled",
                        "test -z \"$(swapon --noheadings)\" && ! grep -qE '^[^#].*\\sswap\\s' /etc/fstab",
                        "swapoff -a && sed -i -E 's/^([^#].*\\sswap\\s.*)$/# \\1 # disabled by calcifer/' /etc/fstab")
                .build();
    }

    public static CommandTask installContainerd() {
        return CommandTask.builder("install-containerd")
                .description("Install and configure containerd")
                .ensureAsRoot("docker apt key",
                        "test -f /etc/apt/keyrings/docker.gpg",
                        "install -m 0755 -d /etc/apt/keyrings"
                                + " && curl -fsSL https://download.docker.com/linux/${fact.os.id}/gpg"
                                + " | gpg --dearmor -o /etc/apt/keyrings/docker.gpg")
                .ensureAsRoot("docker apt repository",
                        "grep -qs 'download.docker.com/linux/${fact.os.id} ${fact.os.codename}' /etc/apt/sources.list.d/docker.list",
                        "echo 'deb [arch=${fact.os.arch} signed-by=/etc/apt/keyrings/docker.gpg]"
                                + " https://download.docker.com/linux/${fact.os.id} ${fact.os.codename} stable'"
                                + " > /etc/apt/sources.list.d/docker.list")
                .ensureAsRoot("containerd.io package",
                        "dpkg -s containerd.io >/dev/null 2>&1",
                        "apt-get update -qq && DEBIAN_FRONTEND=noninteractive apt-get install -y -qq containerd.io")
                .ensureAsRoot("SystemdCgroup enabled",
                        "grep -qs 'SystemdCgroup = true' /etc/containerd/config.toml",
                        "mkdir -p /etc/containerd && containerd config default"
                                + " | sed -e 's/SystemdCgroup = false/SystemdCgroup = true/'"
                                + " -e '/disabled_plugins/ s/\"cri\"//' > /etc/containerd/config.toml"
                                + " && systemctl restart containerd")
                .ensureAsRoot("containerd service",
                        "systemctl is-active --quiet containerd && systemctl is-enabled --quiet containerd",
                        "systemctl enable --now containerd")
                .build();
    }

    public static CommandTask installKubeTools() {
        return CommandTask.builder("install-kube-tools")
                .description("Install kubelet, kubeadm and kubectl")
                .ensureAsRoot("kubernetes apt key",
                        "test -f /etc/apt/keyrings/kubernetes-apt-keyring.gpg",
                        "install -m 0755 -d /etc/apt/keyrings"
                                + " && curl -fsSL https://pkgs.k8s.io/core:/stable:/${k8s.minor}/deb/Release.key"
                                + " | gpg --dearmor -o /etc/apt/keyrings/kubernetes-apt-keyring.gpg")
                .ensureAsRoot("kubernetes apt repository",
                        "grep -qs 'stable:/${k8s.minor}/deb' /etc/apt/sources.list.d/kubernetes.list",
                        "echo 'deb [arch=${fact.os.arch} signed-by=/etc/apt/keyrings/kubernetes-apt-keyring.gpg]"
                                + " https://pkgs.k8s.io/core:/stable:/${k8s.minor}/deb/ /'"
                                + " > /etc/apt/sources.list.d/kubernetes.list")
                .ensureAsRoot("kube packages",
                        "dpkg -s kubelet kubeadm kubectl >/dev/null 2>&1",
                        "apt-get update -qq && DEBIAN_FRONTEND=noninteractive apt-get install -y -qq kubelet kubeadm kubectl")
                .ensureAsRoot("package versions held",
                        "test \"$(apt-mark showhold | grep -cE '^(kubelet|kubeadm|kubectl)$')\" = 3",
                        "apt-mark hold kubelet kubeadm kubectl")
                .ensureAsRoot("kubelet enabled",
                        "systemctl is-enabled --quiet kubelet",
                        "systemctl enable kubelet")
                .build();
    }

    public static CommandTask verifyKubeTools() {
        return CommandTask.builder("verify-kube-tools")
                .description("Verify Kubernetes tooling")
                .verifyOnly(TaskStatus.WARNING)
                .check("kubeadm", "command -v kubeadm")
                .check("kubelet", "command -v kubelet")
                .check("kubectl", "command -v kubectl")
                .check("containerd", "systemctl is-active --quiet containerd")
                .build();
    }

    public static CommandTask ensureAzureCli() {
        return CommandTask.builder("ensure-azure-cli")
                .description("Ensure Azure CLI installation")
                .ensure("azure cli",
                        "command -v az",
                        "curl -sL https://aka.ms/InstallAzureCLIDeb | sudo -n bash")
                .ensure("connectedk8s extension",
                        "az extension show --name connectedk8s >/dev/null 2>&1",
                        "az extension add --name connectedk8s --yes")
                .build();
    }

    public static CommandTask verifyAzureCli() {
        return CommandTask.builder("verify-azure-cli")
                .description("Verify Azure CLI installation")
                .verifyOnly(TaskStatus.FAILED)
                .check("azure cli", "command -v az")
                .check("connectedk8s extension", "az extension show --name connectedk8s >/dev/null 2>&1")
                .build();
    }
}
