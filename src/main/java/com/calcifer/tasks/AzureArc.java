package com.calcifer.tasks;

import com.calcifer.backend.CommandResult;
import com.calcifer.backend.HostShell;
import com.calcifer.config.RunSettings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

import static com.calcifer.backend.AbstractHostShell.quote;

/**
 * {@code az connectedk8s} helpers shared by the Arc tasks.
 */
final class AzureArc {

    private static final Logger log = LoggerFactory.getLogger(AzureArc.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AzureArc() {}

    record Target(String clusterName, String resourceGroup, String location) {

        String args() {
            return "--name " + quote(clusterName) + " --resource-group " + quote(resourceGroup);
        }
    }

    static final String MISSING_TARGET = "Azure resource group and cluster name must be configured"
            + " (calcifer.azure.resource-group, calcifer.azure.cluster-name)";

    /**
     * Cluster resource coordinates from settings, or empty when incomplete.
     */
    static Optional<Target> target(RunSettings settings) {
        Optional<String> group = settings.get(RunSettings.AZURE_RESOURCE_GROUP);
        Optional<String> cluster = settings.get(RunSettings.AZURE_CLUSTER_NAME);
        if (group.isEmpty() || cluster.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Target(cluster.get(), group.get(), settings.getOrDefault(RunSettings.AZURE_LOCATION, "eastus")));
    }

    /**
     * Connectivity status of the Arc resource, or empty when it does not exist.
     */
    static Optional<String> connectionStatus(HostShell shell, Target target) {
        CommandResult show = shell.run("az connectedk8s show " + target.args() + " -o json");
        if (!show.succeeded()) {
            return Optional.empty();
        }
        try {
            JsonNode json = MAPPER.readTree(show.stdout());
            return Optional.of(json.path("connectivityStatus").asText("Unknown"));
        } catch (JsonProcessingException e) {
            log.warn("Unparseable 'az connectedk8s show' output: {}", e.getMessage());
            return Optional.of("Unknown");
        }
    }
}
