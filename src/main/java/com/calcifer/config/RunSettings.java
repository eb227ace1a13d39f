package com.calcifer.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable settings handed into one run.
 * <p>
 * Values are keyed by dotted names ({@code k8s.version}, {@code azure.location}, ...) so that
 * command templates can reference them as {@code ${k8s.version}}.
 */
public final class RunSettings {

    public static final String K8S_VERSION = "k8s.version";
    public static final String POD_NETWORK_CIDR = "k8s.pod-network-cidr";
    public static final String CNI_MANIFEST_URL = "k8s.cni-manifest-url";
    public static final String LOCAL_KUBECONFIG = "k8s.local-kubeconfig-path";
    public static final String AZURE_SUBSCRIPTION_ID = "azure.subscription-id";
    public static final String AZURE_TENANT_ID = "azure.tenant-id";
    public static final String AZURE_LOCATION = "azure.location";
    public static final String AZURE_RESOURCE_GROUP = "azure.resource-group";
    public static final String AZURE_CLUSTER_NAME = "azure.cluster-name";
    public static final String FLUX_REPOSITORY_URL = "flux.repository-url";
    public static final String FLUX_BRANCH = "flux.branch";
    public static final String FLUX_PATH = "flux.path";
    public static final String FLUX_PRIVATE_KEY_FILE = "flux.private-key-file";
    public static final String CONNECTIVITY_TARGET = "connectivity.target";
    public static final String ENVIRONMENT = "env";

    private static final RunSettings EMPTY = new RunSettings(Map.of());

    private final Map<String, String> values;

    private RunSettings(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static RunSettings empty() {
        return EMPTY;
    }

    public static RunSettings of(Map<String, String> values) {
        LinkedHashMap<String, String> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (value != null && !value.isBlank()) {
                copy.put(key, value);
            }
        });
        return new RunSettings(copy);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public String getOrDefault(String key, String fallback) {
        return values.getOrDefault(key, fallback);
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    /**
     * Returns a copy with one value replaced. Blank values remove the key.
     */
    public RunSettings with(String key, String value) {
        LinkedHashMap<String, String> copy = new LinkedHashMap<>(values);
        if (value == null || value.isBlank()) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return new RunSettings(copy);
    }

    public Map<String, String> asMap() {
        return values;
    }

    public String k8sVersion() {
        return getOrDefault(K8S_VERSION, "1.30");
    }

    /** Minor release line used for apt repositories, e.g. {@code v1.30}. */
    public String k8sMinorVersion() {
        String version = k8sVersion();
        String[] parts = version.replaceFirst("^v", "").split("\\.");
        return parts.length >= 2 ? "v" + parts[0] + "." + parts[1] : "v" + version;
    }

    @Override
    public String toString() {
        // keys only; values may include subscription identifiers
        return "RunSettings" + values.keySet();
    }
}
