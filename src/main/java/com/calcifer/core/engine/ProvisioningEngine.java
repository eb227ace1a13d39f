package com.calcifer.core.engine;

import com.calcifer.backend.ExecutionBackend;
import com.calcifer.backend.ExecutionBackends;
import com.calcifer.backend.ssh.SessionFactory;
import com.calcifer.backend.ssh.SessionPool;
import com.calcifer.core.events.CalciferEvent;
import com.calcifer.core.events.EventBus;
import com.calcifer.core.logging.MdcContext;
import com.calcifer.core.metrics.CalciferMetrics;
import com.calcifer.core.model.ErrorKind;
import com.calcifer.core.model.Goal;
import com.calcifer.core.model.Host;
import com.calcifer.core.model.Inventory;
import com.calcifer.core.model.RunReport;
import com.calcifer.core.model.RunReportRecorder;
import com.calcifer.core.model.TaskResult;
import com.calcifer.core.registry.ExecutionPlan;
import com.calcifer.core.registry.Step;
import com.calcifer.core.registry.TaskRegistry;
import com.calcifer.core.task.HarnessedTask;
import com.calcifer.core.task.Task;
import com.calcifer.core.task.TaskHarness;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one goal from plan resolution to a sealed {@link RunReport}.
 * <p>
 * Steps run strictly in plan order. Within a step every task fans out to all hosts of the
 * step's group and all lanes are joined before the next task starts. A failed task aborts
 * the run unless {@link RunOptions#continueOnError()} is set; lanes already running finish
 * and nothing new starts. Remote sessions are released whatever happens.
 */
public class ProvisioningEngine {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningEngine.class);

    private final TaskRegistry registry;
    private final ExecutionBackends backends;
    private final TaskHarness harness;
    private final SessionFactory sessionFactory;
    private final EventBus eventBus;
    private final CalciferMetrics metrics;
    private final int maxParallel;
    private final Clock clock;

    public ProvisioningEngine(TaskRegistry registry, ExecutionBackends backends, TaskHarness harness,
                              SessionFactory sessionFactory, EventBus eventBus, CalciferMetrics metrics,
                              int maxParallel) {
        this(registry, backends, harness, sessionFactory, eventBus, metrics, maxParallel, Clock.systemUTC());
    }

    public ProvisioningEngine(TaskRegistry registry, ExecutionBackends backends, TaskHarness harness,
                              SessionFactory sessionFactory, EventBus eventBus, CalciferMetrics metrics,
                              int maxParallel, Clock clock) {
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be at least 1, got " + maxParallel);
        }
        this.registry = registry;
        this.backends = backends;
        this.harness = harness;
        this.sessionFactory = sessionFactory;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.maxParallel = maxParallel;
        this.clock = clock;
    }

    public TaskRegistry registry() {
        return registry;
    }

    public RunReport run(Goal goal, Inventory inventory, RunOptions options) {
        return run(goal, inventory, options, new AbortSignal());
    }

    /**
     * Executes the goal's plan.
     *
     * @param abort cancellation flag; triggering it stops the run before the next task
     * @throws com.calcifer.core.registry.ConfigException if the goal cannot be resolved (nothing runs)
     */
    public RunReport run(Goal goal, Inventory inventory, RunOptions options, AbortSignal abort) {
        ExecutionPlan plan = registry.resolve(goal);
        if (plan.steps().isEmpty() || plan.isEmpty()) {
            throw new IllegalStateException("Registry produced an empty plan for " + goal.cliName());
        }
        Objects.requireNonNull(inventory, "inventory");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(abort, "abort");

        String runId = generateRunId();
        RunReportRecorder recorder = new RunReportRecorder(runId, goal, clock.instant());
        SessionPool sessions = new SessionPool(sessionFactory);
        RunContext run = new RunContext(runId, goal, inventory, options, sessions, new RunFacts(), abort);

        MdcContext.setRun(runId, goal);
        log.info("Run {} started: goal={} steps={} hosts={} options={}", runId, goal.cliName(),
                plan.steps().size(), inventory.size(), describe(options));
        eventBus.publish(CalciferEvent.of(CalciferEvent.RUN_STARTED, runId, Map.of(
                "goal", goal.cliName(),
                "steps", plan.steps().size(),
                "hosts", inventory.size())));

        ExecutorService workers = newWorkerPool(runId);
        ScheduledExecutorService timer = scheduleRunTimeout(options, abort, runId);
        RunReport report;
        try {
            Inventory targets = inventory.filter(options.targetFilter());
            for (Step step : plan.steps()) {
                if (abort.isTriggered()) {
                    break;
                }
                List<Host> hosts = targets.hostsIn(step.group());
                if (hosts.isEmpty()) {
                    log.info("No hosts in group {}, skipping step", step.group());
                    eventBus.publish(CalciferEvent.of(CalciferEvent.STEP_EMPTY, runId,
                            Map.of("group", step.group().name())));
                    continue;
                }
                eventBus.publish(CalciferEvent.of(CalciferEvent.STEP_STARTED, runId, Map.of(
                        "group", step.group().name(),
                        "tasks", step.taskNames(),
                        "hosts", hosts.stream().map(Host::name).toList())));
                runStep(step, hosts, run, recorder, workers);
            }
        } finally {
            if (timer != null) {
                timer.shutdownNow();
            }
            workers.shutdownNow();
            sessions.close();
            report = recorder.seal(clock.instant(), abort.reason());
            if (report.aborted()) {
                log.warn("Run {} aborted: {}", runId, report.abortReason());
                eventBus.publish(CalciferEvent.of(CalciferEvent.RUN_ABORTED, runId,
                        Map.of("reason", report.abortReason())));
            }
            log.info("Run {} finished: {} ({} results, {} changed, {}ms)", runId, report.status(),
                    report.results().size(), report.changedCount(), report.duration().toMillis());
            eventBus.publish(CalciferEvent.of(CalciferEvent.RUN_COMPLETED, runId, Map.of("report", report)));
            if (metrics != null) {
                metrics.recordRunResult(goal, report.status(), report.aborted());
            }
            MdcContext.clear();
        }
        return report;
    }

    private void runStep(Step step, List<Host> hosts, RunContext run, RunReportRecorder recorder,
                         ExecutorService workers) {
        // hosts whose session failed earlier in this step
        Set<String> unreachable = ConcurrentHashMap.newKeySet();

        for (Task task : step.tasks()) {
            if (run.abort().isTriggered()) {
                log.warn("Not starting {}: {}", task.name(), run.abort().reason());
                return;
            }
            HarnessedTask harnessed = harness.wrap(task);
            List<TaskResult> results = new ArrayList<>();
            Map<Host, CompletableFuture<TaskResult>> lanes = new LinkedHashMap<>();

            for (Host host : hosts) {
                if (unreachable.contains(host.name())) {
                    TaskResult lost = unreachableResult(task, host, run);
                    recorder.append(lost);
                    results.add(lost);
                    continue;
                }
                ExecutionBackend backend = backends.forHost(host);
                lanes.put(host, CompletableFuture.supplyAsync(() -> {
                    TaskResult result = harnessed.run(host, backend, run);
                    recorder.append(result);
                    return result;
                }, workers));
            }
            if (metrics != null) {
                metrics.recordFanOut(lanes.size());
            }

            // barrier
            for (Map.Entry<Host, CompletableFuture<TaskResult>> lane : lanes.entrySet()) {
                try {
                    results.add(lane.getValue().join());
                } catch (CompletionException e) {
                    log.error("Unexpected error collecting result of {} on {}", task.name(), lane.getKey().name(), e);
                    Instant now = clock.instant();
                    TaskResult failure = TaskResult.failure(lane.getKey().name(), task.name(), ErrorKind.TASK_EXECUTION,
                            "System Error: " + e.getCause(), now, now);
                    recorder.append(failure);
                    results.add(failure);
                }
            }

            List<String> failedHosts = new ArrayList<>();
            for (TaskResult result : results) {
                if (result.errorKind() == ErrorKind.CONNECTION) {
                    unreachable.add(result.hostId());
                }
                if (result.failed()) {
                    failedHosts.add(result.hostId());
                }
            }
            if (!failedHosts.isEmpty() && !run.options().continueOnError()) {
                run.abort().trigger("Task '" + task.name() + "' failed on " + String.join(", ", failedHosts));
            }
        }
    }

    private TaskResult unreachableResult(Task task, Host host, RunContext run) {
        Instant now = clock.instant();
        TaskResult result = TaskResult.failure(host.name(), task.name(), ErrorKind.CONNECTION,
                "Host unreachable: connection failed earlier in this step", now, now);
        eventBus.publish(new CalciferEvent(CalciferEvent.TASK_COMPLETED, run.runId(), host.name(), task.name(),
                Map.of("result", result), now));
        return result;
    }

    private ExecutorService newWorkerPool(String runId) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(maxParallel, r -> {
            Thread t = new Thread(r, "calcifer-" + runId + "-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private ScheduledExecutorService scheduleRunTimeout(RunOptions options, AbortSignal abort, String runId) {
        if (options.runTimeout() == null) {
            return null;
        }
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "calcifer-" + runId + "-timeout");
            t.setDaemon(true);
            return t;
        });
        timer.schedule(() -> {
            if (abort.trigger("Run timeout of " + options.runTimeout().toSeconds() + "s exceeded")) {
                log.warn("Run {} exceeded its timeout", runId);
            }
        }, options.runTimeout().toMillis(), TimeUnit.MILLISECONDS);
        return timer;
    }

    private static String describe(RunOptions options) {
        return "continueOnError=" + options.continueOnError()
                + ", target=" + (options.targetFilter() != null ? options.targetFilter().selector() : "all")
                + ", taskTimeout=" + options.perTaskTimeout()
                + ", runTimeout=" + options.runTimeout()
                + ", expectConverged=" + options.expectConverged();
    }

    private static String generateRunId() {
        return "run-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
