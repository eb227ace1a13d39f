package com.calcifer.tasks;

import com.calcifer.backend.CommandResult;
import com.calcifer.config.RunSettings;
import com.calcifer.core.model.Host;
import com.calcifer.core.model.TaskOutcome;
import com.calcifer.core.task.Task;
import com.calcifer.core.task.TaskContext;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.calcifer.backend.AbstractHostShell.quote;

/**
 * Checks that the host reaches the internet by pinging a well-known address.
 */
public class CheckConnectivityTask implements Task {

    static final String DEFAULT_TARGET = "1.1.1.1";

    /** {@code rtt min/avg/max/mdev = 10.1/12.3/14.5/1.2 ms} */
    private static final Pattern RTT = Pattern.compile("=\\s*[\\d.]+/([\\d.]+)/[\\d.]+");

    @Override
    public String name() {
        return "check-connectivity";
    }

    @Override
    public String description() {
        return "Check internet connectivity";
    }

    @Override
    public TaskOutcome execute(Host host, TaskContext context) {
        String target = context.settings().getOrDefault(RunSettings.CONNECTIVITY_TARGET, DEFAULT_TARGET);
        CommandResult result = context.shell().run("ping -c 2 -W 3 " + quote(target));
        if (!result.succeeded()) {
            return TaskOutcome.failed("No internet access (ping " + target + " failed)");
        }
        return averageLatency(result.stdout())
                .map(avg -> TaskOutcome.ok("Internet reachable, " + target + " avg " + avg + " ms"))
                .orElseGet(() -> TaskOutcome.ok("Internet reachable (" + target + ")"));
    }

    static Optional<String> averageLatency(String pingOutput) {
        Matcher matcher = RTT.matcher(pingOutput);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
