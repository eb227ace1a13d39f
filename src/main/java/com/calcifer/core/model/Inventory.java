package com.calcifer.core.model;

import com.calcifer.core.registry.ConfigException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only collection of hosts for one run, in declaration order.
 */
public final class Inventory {

    private final List<Host> hosts;

    public Inventory(List<Host> hosts) {
        Set<String> names = new HashSet<>();
        for (Host host : hosts) {
            if (!names.add(host.name())) {
                throw new ConfigException("Duplicate host in inventory: " + host.name());
            }
        }
        this.hosts = List.copyOf(hosts);
    }

    public static Inventory of(Host... hosts) {
        return new Inventory(List.of(hosts));
    }

    public List<Host> hosts() {
        return hosts;
    }

    public List<Host> hostsIn(HostGroup group) {
        return hosts.stream().filter(h -> h.memberOf(group)).toList();
    }

    public Optional<Host> find(String name) {
        return hosts.stream().filter(h -> h.name().equals(name)).findFirst();
    }

    /**
     * Returns the subset of hosts matched by the filter, or this inventory when the filter is null.
     */
    public Inventory filter(TargetFilter filter) {
        if (filter == null) {
            return this;
        }
        List<Host> matched = new ArrayList<>();
        for (Host host : hosts) {
            if (filter.matches(host)) {
                matched.add(host);
            }
        }
        return new Inventory(matched);
    }

    public int size() {
        return hosts.size();
    }

    public boolean isEmpty() {
        return hosts.isEmpty();
    }
}
