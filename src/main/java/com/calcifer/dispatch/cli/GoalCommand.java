package com.calcifer.dispatch.cli;

import com.calcifer.config.CalciferProperties;
import com.calcifer.core.engine.AbortSignal;
import com.calcifer.core.engine.ProvisioningEngine;
import com.calcifer.core.engine.RunOptions;
import com.calcifer.core.events.CalciferEvent;
import com.calcifer.core.events.EventBus;
import com.calcifer.core.model.Goal;
import com.calcifer.core.model.Inventory;
import com.calcifer.core.model.RunReport;
import com.calcifer.core.model.TargetFilter;
import com.calcifer.core.model.TaskResult;
import com.calcifer.core.registry.ConfigException;
import com.calcifer.inventory.InventoryLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Shared options and execution flow of the goal subcommands.
 * <p>
 * Exit codes: 0 when the run rolls up OK, 1 on WARNING or FAILED, 2 on configuration errors.
 */
public abstract class GoalCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GoalCommand.class);

    static final int EXIT_CONFIG_ERROR = 2;

    /** How long an interrupted run may keep the JVM alive to release sessions and staged files. */
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    @Option(names = {"--inventory", "-i"}, description = "Inventory file (default: calcifer.inventory.file)")
    private Path inventory;

    @Option(names = {"--target", "-t"}, description = "Limit the run to one host name or group")
    private String target;

    @Option(names = "--continue-on-error", description = "Keep running remaining tasks after a failure")
    private boolean continueOnError;

    @Option(names = "--task-timeout", paramLabel = "SECONDS", description = "Timeout for each task on each host")
    private Long taskTimeoutSeconds;

    @Option(names = "--run-timeout", paramLabel = "SECONDS", description = "Timeout for the whole run")
    private Long runTimeoutSeconds;

    @Option(names = "--expect-converged",
            description = "Report any change as an idempotency warning (use after a successful run)")
    private boolean expectConverged;

    @Option(names = {"--quiet", "-q"}, description = "Only print results that need attention and the summary")
    private boolean quiet;

    private final ProvisioningEngine engine;
    private final InventoryLoader inventoryLoader;
    private final CalciferProperties properties;
    private final EventBus eventBus;

    protected GoalCommand(ProvisioningEngine engine, InventoryLoader inventoryLoader,
                          CalciferProperties properties, EventBus eventBus) {
        this.engine = engine;
        this.inventoryLoader = inventoryLoader;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    protected abstract Goal goal();

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Inventory hosts;
        RunOptions options;
        try {
            hosts = inventoryLoader.load(inventoryPath());
            options = runOptions();
        } catch (ConfigException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        AbortSignal abort = new AbortSignal();
        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> awaitCleanup(abort, finished), "calcifer-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        RunReport report;
        try (EventBus.Subscription ignored = eventBus.subscribeAll(this::render)) {
            report = engine.run(goal(), hosts, options, abort);
        } catch (ConfigException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_CONFIG_ERROR;
        } finally {
            finished.countDown();
            removeShutdownHook(shutdownHook);
        }

        ConsoleOutput.summary(report);
        return report.exitCode();
    }

    Path inventoryPath() {
        return inventory != null ? inventory : Path.of(properties.getInventory().getFile());
    }

    RunOptions runOptions() {
        return new RunOptions(
                continueOnError || properties.isContinueOnError(),
                target != null ? new TargetFilter(target) : null,
                taskTimeoutSeconds != null ? Duration.ofSeconds(taskTimeoutSeconds) : properties.getTaskTimeout(),
                runTimeoutSeconds != null ? Duration.ofSeconds(runTimeoutSeconds) : properties.getRunTimeout(),
                expectConverged,
                properties.toRunSettings());
    }

    @SuppressWarnings("unchecked")
    private void render(CalciferEvent event) {
        switch (event.eventType()) {
            case CalciferEvent.RUN_STARTED -> {
                if (!quiet) {
                    ConsoleOutput.runStarted(event.runId(), String.valueOf(event.payload().get("goal")),
                            ((Number) event.payload().get("hosts")).intValue());
                }
            }
            case CalciferEvent.STEP_STARTED -> {
                if (!quiet) {
                    ConsoleOutput.step(String.valueOf(event.payload().get("group")),
                            (List<String>) event.payload().get("hosts"));
                }
            }
            case CalciferEvent.STEP_EMPTY -> {
                if (!quiet) {
                    ConsoleOutput.emptyStep(String.valueOf(event.payload().get("group")));
                }
            }
            case CalciferEvent.TASK_COMPLETED ->
                    ConsoleOutput.taskResult((TaskResult) event.payload().get("result"), quiet);
            case CalciferEvent.RUN_ABORTED -> ConsoleOutput.aborted(String.valueOf(event.payload().get("reason")));
            default -> {
                // run.completed is rendered from the returned report
            }
        }
    }

    private static void awaitCleanup(AbortSignal abort, CountDownLatch finished) {
        if (!abort.trigger("Interrupted by signal")) {
            return;
        }
        try {
            if (!finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Run did not finish within {}s of the interrupt; staged files may remain",
                        SHUTDOWN_GRACE_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM shutdown in progress, keeping shutdown hook");
        }
    }
}
