package com.calcifer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "calcifer")
public class CalciferProperties {

    private Engine engine = new Engine();
    private Ssh ssh = new Ssh();
    private InventorySource inventory = new InventorySource();
    private K8s k8s = new K8s();
    private Azure azure = new Azure();
    private Flux flux = new Flux();
    private String env = "dev";
    private String connectivityTarget = "1.1.1.1";

    // -- Engine accessors (delegate to nested) --
    public int getMaxParallel() { return engine.maxParallel; }
    public boolean isContinueOnError() { return engine.continueOnError; }

    public Duration getTaskTimeout() {
        return engine.taskTimeoutSeconds > 0 ? Duration.ofSeconds(engine.taskTimeoutSeconds) : null;
    }

    public Duration getRunTimeout() {
        return engine.runTimeoutSeconds > 0 ? Duration.ofSeconds(engine.runTimeoutSeconds) : null;
    }

    /**
     * Settings snapshot for a single run. Blank values are left out so tasks
     * can tell "not configured" apart from "configured empty".
     */
    public RunSettings toRunSettings() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(RunSettings.ENVIRONMENT, env);
        values.put(RunSettings.CONNECTIVITY_TARGET, connectivityTarget);
        values.put(RunSettings.K8S_VERSION, k8s.version);
        values.put(RunSettings.POD_NETWORK_CIDR, k8s.podNetworkCidr);
        values.put(RunSettings.CNI_MANIFEST_URL, k8s.cniManifestUrl);
        values.put(RunSettings.LOCAL_KUBECONFIG, k8s.localKubeconfigPath);
        values.put(RunSettings.AZURE_SUBSCRIPTION_ID, azure.subscriptionId);
        values.put(RunSettings.AZURE_TENANT_ID, azure.tenantId);
        values.put(RunSettings.AZURE_LOCATION, azure.location);
        values.put(RunSettings.AZURE_RESOURCE_GROUP, azure.resourceGroup);
        values.put(RunSettings.AZURE_CLUSTER_NAME, azure.clusterName);
        values.put(RunSettings.FLUX_REPOSITORY_URL, flux.repositoryUrl);
        values.put(RunSettings.FLUX_BRANCH, flux.branch);
        values.put(RunSettings.FLUX_PATH, flux.path);
        values.put(RunSettings.FLUX_PRIVATE_KEY_FILE, flux.privateKeyFile);
        return RunSettings.of(values);
    }

    public Engine getEngine() { return engine; }
    public void setEngine(Engine engine) { this.engine = engine; }
    public Ssh getSsh() { return ssh; }
    public void setSsh(Ssh ssh) { this.ssh = ssh; }
    public InventorySource getInventory() { return inventory; }
    public void setInventory(InventorySource inventory) { this.inventory = inventory; }
    public K8s getK8s() { return k8s; }
    public void setK8s(K8s k8s) { this.k8s = k8s; }
    public Azure getAzure() { return azure; }
    public void setAzure(Azure azure) { this.azure = azure; }
    public Flux getFlux() { return flux; }
    public void setFlux(Flux flux) { this.flux = flux; }
    public String getEnv() { return env; }
    public void setEnv(String env) { this.env = env; }
    public String getConnectivityTarget() { return connectivityTarget; }
    public void setConnectivityTarget(String connectivityTarget) { this.connectivityTarget = connectivityTarget; }

    public static class Engine {
        private int maxParallel = 8;
        private int taskTimeoutSeconds = 0;
        private int runTimeoutSeconds = 0;
        private boolean continueOnError = false;

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public int getTaskTimeoutSeconds() { return taskTimeoutSeconds; }
        public void setTaskTimeoutSeconds(int taskTimeoutSeconds) { this.taskTimeoutSeconds = taskTimeoutSeconds; }
        public int getRunTimeoutSeconds() { return runTimeoutSeconds; }
        public void setRunTimeoutSeconds(int runTimeoutSeconds) { this.runTimeoutSeconds = runTimeoutSeconds; }
        public boolean isContinueOnError() { return continueOnError; }
        public void setContinueOnError(boolean continueOnError) { this.continueOnError = continueOnError; }
    }

    public static class Ssh {
        private int connectTimeoutSeconds = 10;
        private int commandTimeoutSeconds = 600;
        private boolean strictHostKeyChecking = false;
        private String knownHostsFile;
        private String defaultUser;
        private int defaultPort = 22;

        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
        public int getCommandTimeoutSeconds() { return commandTimeoutSeconds; }
        public void setCommandTimeoutSeconds(int commandTimeoutSeconds) { this.commandTimeoutSeconds = commandTimeoutSeconds; }
        public boolean isStrictHostKeyChecking() { return strictHostKeyChecking; }
        public void setStrictHostKeyChecking(boolean strictHostKeyChecking) { this.strictHostKeyChecking = strictHostKeyChecking; }
        public String getKnownHostsFile() { return knownHostsFile; }
        public void setKnownHostsFile(String knownHostsFile) { this.knownHostsFile = knownHostsFile; }
        public String getDefaultUser() { return defaultUser; }
        public void setDefaultUser(String defaultUser) { this.defaultUser = defaultUser; }
        public int getDefaultPort() { return defaultPort; }
        public void setDefaultPort(int defaultPort) { this.defaultPort = defaultPort; }
    }

    public static class InventorySource {
        private String file = "inventory/hosts.yaml";

        public String getFile() { return file; }
        public void setFile(String file) { this.file = file; }
    }

    public static class K8s {
        private String version = "1.30";
        private String podNetworkCidr = "10.244.0.0/16";
        private String cniManifestUrl =
                "https://github.com/flannel-io/flannel/releases/latest/download/kube-flannel.yml";
        private String localKubeconfigPath = "inventory/kubeconfig_admin.yaml";

        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }
        public String getPodNetworkCidr() { return podNetworkCidr; }
        public void setPodNetworkCidr(String podNetworkCidr) { this.podNetworkCidr = podNetworkCidr; }
        public String getCniManifestUrl() { return cniManifestUrl; }
        public void setCniManifestUrl(String cniManifestUrl) { this.cniManifestUrl = cniManifestUrl; }
        public String getLocalKubeconfigPath() { return localKubeconfigPath; }
        public void setLocalKubeconfigPath(String localKubeconfigPath) { this.localKubeconfigPath = localKubeconfigPath; }
    }

    public static class Azure {
        private String subscriptionId;
        private String tenantId;
        private String location = "eastus";
        private String resourceGroup;
        private String clusterName;

        public String getSubscriptionId() { return subscriptionId; }
        public void setSubscriptionId(String subscriptionId) { this.subscriptionId = subscriptionId; }
        public String getTenantId() { return tenantId; }
        public void setTenantId(String tenantId) { this.tenantId = tenantId; }
        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
        public String getResourceGroup() { return resourceGroup; }
        public void setResourceGroup(String resourceGroup) { this.resourceGroup = resourceGroup; }
        public String getClusterName() { return clusterName; }
        public void setClusterName(String clusterName) { this.clusterName = clusterName; }
    }

    public static class Flux {
        private String repositoryUrl;
        private String branch = "main";
        private String path = "clusters/dev";
        private String privateKeyFile;

        public String getRepositoryUrl() { return repositoryUrl; }
        public void setRepositoryUrl(String repositoryUrl) { this.repositoryUrl = repositoryUrl; }
        public String getBranch() { return branch; }
        public void setBranch(String branch) { this.branch = branch; }
        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public String getPrivateKeyFile() { return privateKeyFile; }
        public void setPrivateKeyFile(String privateKeyFile) { this.privateKeyFile = privateKeyFile; }
    }
}
