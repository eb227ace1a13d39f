package com.calcifer.core.model;

import java.util.Objects;

/**
 * Symbolic tag used to scope tasks to a set of hosts.
 *
 * @param name group name as written in the inventory
 */
public record HostGroup(String name) {

    public static final HostGroup LOCAL_MACHINE = new HostGroup("local_machine");
    public static final HostGroup CONTROL_PLANE = new HostGroup("k8s_control_plane");
    public static final HostGroup WORKERS = new HostGroup("k8s_worker");

    public HostGroup {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Host group name must not be blank");
        }
    }

    public static HostGroup of(String name) {
        return new HostGroup(name.trim());
    }

    @Override
    public String toString() {
        return name;
    }
}
