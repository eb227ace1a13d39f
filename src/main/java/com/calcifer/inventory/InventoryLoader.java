package com.calcifer.inventory;

import com.calcifer.config.CalciferProperties;
import com.calcifer.core.model.Host;
import com.calcifer.core.model.HostGroup;
import com.calcifer.core.model.Inventory;
import com.calcifer.core.registry.ConfigException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the host inventory from YAML.
 * <pre>
 * cp1:
 *   hostname: 10.0.0.10
 *   username: ubuntu
 *   credential: key:~/.ssh/id_ed25519
 *   groups: [k8s_control_plane]
 * controller:
 *   groups: [local_machine]
 * </pre>
 * Hosts in {@code local_machine} (or flagged {@code local: true}) run on the control machine.
 */
@Component
public class InventoryLoader {

    private static final Logger log = LoggerFactory.getLogger(InventoryLoader.class);

    private static final TypeReference<LinkedHashMap<String, HostEntry>> ENTRIES = new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private final int defaultPort;
    private final String defaultUser;

    @Autowired
    public InventoryLoader(CalciferProperties properties) {
        this(properties.getSsh().getDefaultPort(), properties.getSsh().getDefaultUser());
    }

    public InventoryLoader(int defaultPort, String defaultUser) {
        this.defaultPort = defaultPort;
        this.defaultUser = defaultUser;
    }

    /**
     * @throws ConfigException when the file is missing, unreadable or invalid
     */
    public Inventory load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigException("Inventory file not found: " + file.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(file)) {
            Inventory inventory = parse(in, file.toString());
            log.info("Loaded {} hosts from {}", inventory.size(), file);
            return inventory;
        } catch (IOException e) {
            throw new ConfigException("Cannot read inventory " + file + ": " + e.getMessage(), e);
        }
    }

    public Inventory parse(InputStream in, String source) {
        Map<String, HostEntry> entries;
        try {
            entries = mapper.readValue(in, ENTRIES);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Malformed inventory " + source + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("Cannot read inventory " + source + ": " + e.getMessage(), e);
        }
        if (entries == null || entries.isEmpty()) {
            throw new ConfigException("Inventory " + source + " defines no hosts");
        }

        List<Host> hosts = new ArrayList<>();
        for (Map.Entry<String, HostEntry> entry : entries.entrySet()) {
            hosts.add(toHost(entry.getKey(), entry.getValue(), source));
        }
        return new Inventory(hosts);
    }

    private Host toHost(String name, HostEntry entry, String source) {
        if (entry == null) {
            throw new ConfigException("Host '" + name + "' in " + source + " has no settings");
        }
        Set<HostGroup> groups = new LinkedHashSet<>();
        if (entry.groups() != null) {
            for (String group : entry.groups()) {
                if (group == null || group.isBlank()) {
                    throw new ConfigException("Host '" + name + "' in " + source + " has a blank group");
                }
                groups.add(HostGroup.of(group.trim()));
            }
        }
        if (groups.isEmpty()) {
            throw new ConfigException("Host '" + name + "' in " + source + " belongs to no group");
        }

        boolean local = Boolean.TRUE.equals(entry.local()) || groups.contains(HostGroup.LOCAL_MACHINE);
        if (local) {
            groups.add(HostGroup.LOCAL_MACHINE);
            String user = entry.username() != null ? entry.username() : System.getProperty("user.name");
            return new Host(name, "localhost", 0, user, null, groups, true);
        }

        if (entry.hostname() == null || entry.hostname().isBlank()) {
            throw new ConfigException("Host '" + name + "' in " + source + " has no hostname");
        }
        int port = entry.port() != null ? entry.port() : defaultPort;
        if (port < 1 || port > 65535) {
            throw new ConfigException("Host '" + name + "' in " + source + " has invalid port " + port);
        }
        String user = entry.username() != null ? entry.username()
                : defaultUser != null ? defaultUser : System.getProperty("user.name");
        return new Host(name, entry.hostname().trim(), port, user, entry.credential(), groups, false);
    }

    record HostEntry(
        String hostname,
        String username,
        Integer port,
        String credential,
        List<String> groups,
        Boolean local
    ) {}
}
