package com.calcifer.core.model;

import java.util.Objects;
import java.util.Set;

/**
 * A provisioning target.
 *
 * @param name          inventory identity, unique within an inventory
 * @param address       hostname or IP used to connect
 * @param port          SSH port
 * @param username      remote login user
 * @param credentialRef reference to the credential used for remote login (never the secret itself)
 * @param groups        groups this host belongs to
 * @param local         true for the control machine itself
 */
public record Host(
    String name,
    String address,
    int port,
    String username,
    String credentialRef,
    Set<HostGroup> groups,
    boolean local
) {

    public static final String LOCAL_NAME = "@local";

    public Host {
        Objects.requireNonNull(name, "name");
        groups = groups != null ? Set.copyOf(groups) : Set.of();
    }

    /** Sentinel for the machine running the orchestrator. */
    public static Host localMachine() {
        return new Host(LOCAL_NAME, "localhost", 0, System.getProperty("user.name"), null,
                Set.of(HostGroup.LOCAL_MACHINE), true);
    }

    public static Host remote(String name, String address, String username, HostGroup... groups) {
        return new Host(name, address, 22, username, null, Set.of(groups), false);
    }

    public boolean memberOf(HostGroup group) {
        return groups.contains(group);
    }
}
