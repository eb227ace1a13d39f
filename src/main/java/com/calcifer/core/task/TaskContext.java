package com.calcifer.core.task;

import com.calcifer.backend.HostShell;
import com.calcifer.config.RunSettings;
import com.calcifer.core.engine.RunContext;
import com.calcifer.core.engine.RunFacts;
import com.calcifer.core.model.Host;
import com.calcifer.core.model.Inventory;

import java.util.Map;

/**
 * Everything a task body may use during one invocation.
 *
 * @param host      the target host
 * @param shell     command and file access on the host
 * @param settings  run settings
 * @param inventory the full inventory of the run
 * @param facts     facts gathered earlier in the run
 */
public record TaskContext(Host host, HostShell shell, RunSettings settings, Inventory inventory, RunFacts facts) {

    public static TaskContext of(Host host, HostShell shell, RunContext run) {
        return new TaskContext(host, shell, run.options().settings(), run.inventory(), run.facts());
    }

    /** Mutable facts of the target host, shared with later tasks of the same run. */
    public Map<String, String> hostFacts() {
        return facts.forHost(host.name());
    }
}
