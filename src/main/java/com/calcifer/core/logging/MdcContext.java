package com.calcifer.core.logging;

import com.calcifer.core.model.Goal;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Calcifer MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String GOAL = "goal";
    public static final String HOST_ID = "hostId";
    public static final String TASK_NAME = "taskName";

    private MdcContext() {}

    public static void setRun(String runId, Goal goal) {
        MDC.put(RUN_ID, runId);
        MDC.put(GOAL, goal.cliName());
    }

    public static void setTask(String runId, Goal goal, String hostId, String taskName) {
        setRun(runId, goal);
        MDC.put(HOST_ID, hostId);
        MDC.put(TASK_NAME, taskName);
    }

    /** Wraps a callable so it runs with the caller's MDC on another thread. */
    public static <T> Callable<T> propagate(Callable<T> task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (captured != null) {
                MDC.setContextMap(captured);
            }
            try {
                return task.call();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }

    public static void clearTask() {
        MDC.remove(HOST_ID);
        MDC.remove(TASK_NAME);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(GOAL);
        clearTask();
    }
}
