package com.calcifer.core.engine;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Facts discovered while a run executes: per-host values (OS, architecture, ...) and values
 * shared across hosts, such as the join command published by the control plane.
 */
public class RunFacts {

    public static final String JOIN_COMMAND = "cluster.join-command";

    private final Map<String, Map<String, String>> hosts = new ConcurrentHashMap<>();
    private final Map<String, String> shared = new ConcurrentHashMap<>();

    public Map<String, String> forHost(String hostId) {
        return hosts.computeIfAbsent(hostId, k -> new ConcurrentHashMap<>());
    }

    public void putShared(String key, String value) {
        shared.put(key, value);
    }

    public Optional<String> shared(String key) {
        return Optional.ofNullable(shared.get(key));
    }
}
