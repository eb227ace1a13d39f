package com.calcifer.core.task;

import com.calcifer.core.model.Host;
import com.calcifer.core.model.TaskOutcome;

/**
 * A named, idempotent operation applied to one host.
 * <p>
 * Implementations check whether the desired state already holds before changing anything,
 * and report {@code OK} when it does. They must not depend on engine or registry state.
 */
public interface Task {

    String name();

    default String description() {
        return name();
    }

    TaskOutcome execute(Host host, TaskContext context) throws Exception;
}
