package com.calcifer.core.metrics;

import com.calcifer.core.model.Goal;
import com.calcifer.core.model.RunStatus;
import com.calcifer.core.model.TaskStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for provisioning runs.
 */
@Service
public class CalciferMetrics {

    private final MeterRegistry registry;

    public CalciferMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskDuration(String taskName, TaskStatus status, Duration duration) {
        Timer.builder("calcifer.task.duration")
                .tag("task", taskName)
                .tag("status", status.name())
                .register(registry)
                .record(duration);
    }

    public void recordRunResult(Goal goal, RunStatus status, boolean aborted) {
        Counter.builder("calcifer.runs.total")
                .tag("goal", goal.cliName())
                .tag("status", status.name())
                .tag("aborted", String.valueOf(aborted))
                .register(registry)
                .increment();
    }

    public void incrementConnectionFailures() {
        Counter.builder("calcifer.connection.failures")
                .description("Hosts whose session could not be opened or was lost mid-task")
                .register(registry)
                .increment();
    }

    /**
     * Records how many hosts one task fanned out to.
     */
    public void recordFanOut(int hostCount) {
        DistributionSummary.builder("calcifer.task.fanout")
                .description("Hosts per task fan-out")
                .register(registry)
                .record(hostCount);
    }
}
