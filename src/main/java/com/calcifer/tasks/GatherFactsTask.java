package com.calcifer.tasks;

import com.calcifer.backend.CommandResult;
import com.calcifer.core.model.Host;
import com.calcifer.core.model.TaskOutcome;
import com.calcifer.core.task.Task;
import com.calcifer.core.task.TaskContext;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Detects distribution, release and CPU architecture, and stores them as host facts for
 * later tasks. Only Debian-family hosts are supported.
 */
public class GatherFactsTask implements Task {

    public static final String OS_ID = "os.id";
    public static final String OS_CODENAME = "os.codename";
    public static final String OS_VERSION = "os.version";
    public static final String OS_ARCH = "os.arch";

    static final Set<String> SUPPORTED = Set.of("ubuntu", "debian");

    @Override
    public String name() {
        return "gather-facts";
    }

    @Override
    public String description() {
        return "Gather system facts";
    }

    @Override
    public TaskOutcome execute(Host host, TaskContext context) {
        CommandResult release = context.shell().run("cat /etc/os-release");
        if (!release.succeeded()) {
            return TaskOutcome.failed("Could not read /etc/os-release");
        }
        Map<String, String> os = parseOsRelease(release.stdout());

        CommandResult arch = context.shell().run("dpkg --print-architecture");
        if (!arch.succeeded()) {
            return TaskOutcome.failed("Could not determine architecture");
        }

        String id = os.getOrDefault("ID", "unknown").toLowerCase(Locale.ROOT);
        if (!SUPPORTED.contains(id)) {
            return TaskOutcome.failed("Unsupported OS: " + id + ". Supported: " + String.join(", ", SUPPORTED.stream().sorted().toList()));
        }

        Map<String, String> facts = context.hostFacts();
        facts.put(OS_ID, id);
        facts.put(OS_CODENAME, os.getOrDefault("VERSION_CODENAME", "unknown"));
        facts.put(OS_VERSION, os.getOrDefault("VERSION_ID", "unknown"));
        facts.put(OS_ARCH, arch.output());

        return TaskOutcome.ok("OS verified: " + id + " " + facts.get(OS_VERSION)
                + " (" + facts.get(OS_CODENAME) + ") on " + facts.get(OS_ARCH));
    }

    static Map<String, String> parseOsRelease(String content) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String line : content.split("\n")) {
            int eq = line.indexOf('=');
            if (eq <= 0 || line.startsWith("#")) {
                continue;
            }
            String value = line.substring(eq + 1).trim();
            if (value.length() >= 2 && (value.startsWith("\"") || value.startsWith("'"))) {
                value = value.substring(1, value.length() - 1);
            }
            values.put(line.substring(0, eq).trim(), value);
        }
        return values;
    }
}
