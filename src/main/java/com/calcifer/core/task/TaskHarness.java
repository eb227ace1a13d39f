package com.calcifer.core.task;

import com.calcifer.backend.BackendOutcome;
import com.calcifer.backend.ExecutionBackend;
import com.calcifer.backend.SessionLostException;
import com.calcifer.core.engine.RunContext;
import com.calcifer.core.events.CalciferEvent;
import com.calcifer.core.events.EventBus;
import com.calcifer.core.logging.MdcContext;
import com.calcifer.core.metrics.CalciferMetrics;
import com.calcifer.core.model.ErrorKind;
import com.calcifer.core.model.Host;
import com.calcifer.core.model.TaskOutcome;
import com.calcifer.core.model.TaskResult;
import com.calcifer.core.model.TaskStatus;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The only path through which tasks execute.
 * <p>
 * Every invocation yields exactly one {@link TaskResult}: exceptions from the task body are
 * contained, timestamps come from the injected clock, the per-task timeout is enforced, and
 * one {@code task.completed} event plus one log record are emitted.
 */
@Component
public class TaskHarness {

    private static final Logger log = LoggerFactory.getLogger(TaskHarness.class);

    static final String SYSTEM_ERROR_PREFIX = "System Error: ";

    private final EventBus eventBus;
    private final CalciferMetrics metrics;
    private final Clock clock;
    private final ExecutorService timeoutExecutor;

    @Autowired
    public TaskHarness(EventBus eventBus, @Autowired(required = false) CalciferMetrics metrics) {
        this(eventBus, metrics, Clock.systemUTC());
    }

    public TaskHarness(EventBus eventBus, CalciferMetrics metrics, Clock clock) {
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        AtomicInteger counter = new AtomicInteger();
        this.timeoutExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "calcifer-task-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public HarnessedTask wrap(Task task) {
        return new HarnessedTask(task, this);
    }

    public TaskResult invoke(Task task, Host host, ExecutionBackend backend, RunContext run) {
        MdcContext.setTask(run.runId(), run.goal(), host.name(), task.name());
        Instant startedAt = clock.instant();
        try {
            log.info("START {} on {}", task.name(), host.name());
            eventBus.publish(new CalciferEvent(CalciferEvent.TASK_STARTED, run.runId(), host.name(), task.name(),
                    Map.of("description", task.description()), startedAt));

            TaskResult result = execute(task, host, backend, run, startedAt);
            if (run.options().expectConverged() && result.changed() && result.status() != TaskStatus.FAILED) {
                result = new TaskResult(result.hostId(), result.taskName(), TaskStatus.WARNING,
                        "Expected a converged host but the task changed it: " + result.message(),
                        true, ErrorKind.IDEMPOTENCY_VIOLATION, result.startedAt(), result.finishedAt());
            }

            logEnd(result);
            if (metrics != null) {
                metrics.recordTaskDuration(task.name(), result.status(), result.duration());
                if (result.errorKind() == ErrorKind.CONNECTION) {
                    metrics.incrementConnectionFailures();
                }
            }
            eventBus.publish(new CalciferEvent(CalciferEvent.TASK_COMPLETED, run.runId(), host.name(), task.name(),
                    Map.of("result", result), result.finishedAt()));
            return result;
        } finally {
            MdcContext.clearTask();
        }
    }

    private TaskResult execute(Task task, Host host, ExecutionBackend backend, RunContext run, Instant startedAt) {
        Duration timeout = run.options().perTaskTimeout();
        try {
            BackendOutcome outcome = callBounded(() -> backend.execute(task, host, run), timeout);
            Instant finishedAt = clock.instant();
            if (!outcome.isCompleted()) {
                return TaskResult.failure(host.name(), task.name(), outcome.errorKind(), outcome.error(),
                        startedAt, finishedAt);
            }
            TaskOutcome body = outcome.outcome();
            return new TaskResult(host.name(), task.name(), body.status(), body.message(), body.changed(),
                    null, startedAt, finishedAt);
        } catch (TimeoutException e) {
            return TaskResult.failure(host.name(), task.name(), ErrorKind.TIMEOUT,
                    "Timed out after " + describe(timeout), startedAt, clock.instant());
        } catch (SessionLostException e) {
            log.error("Session lost while running {} on {}", task.name(), host.name(), e);
            return TaskResult.failure(host.name(), task.name(), ErrorKind.CONNECTION,
                    SYSTEM_ERROR_PREFIX + describe(e), startedAt, clock.instant());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TaskResult.failure(host.name(), task.name(), ErrorKind.TASK_EXECUTION,
                    SYSTEM_ERROR_PREFIX + "interrupted", startedAt, clock.instant());
        } catch (Exception e) {
            log.error("Task {} failed on {}", task.name(), host.name(), e);
            return TaskResult.failure(host.name(), task.name(), ErrorKind.TASK_EXECUTION,
                    SYSTEM_ERROR_PREFIX + describe(e), startedAt, clock.instant());
        }
    }

    /**
     * Runs the body on the caller's thread when unbounded, otherwise on the harness executor,
     * interrupting it once the timeout expires.
     */
    private BackendOutcome callBounded(Callable<BackendOutcome> body, Duration timeout) throws Exception {
        if (timeout == null) {
            return body.call();
        }
        Future<BackendOutcome> future = timeoutExecutor.submit(MdcContext.propagate(body));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }

    private void logEnd(TaskResult result) {
        String line = "END {} on {}: {} ({}ms) {}";
        Object[] args = {result.taskName(), result.hostId(), result.status(), result.duration().toMillis(), result.message()};
        switch (result.status()) {
            case FAILED -> log.error(line, args);
            case WARNING -> log.warn(line, args);
            default -> log.info(line, args);
        }
    }

    static String describe(Duration timeout) {
        long millis = timeout.toMillis();
        return millis % 1000 == 0 ? millis / 1000 + "s" : millis + "ms";
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }

    @PreDestroy
    public void shutdown() {
        timeoutExecutor.shutdownNow();
    }
}
