package com.calcifer.core.registry;

import com.calcifer.core.model.HostGroup;
import com.calcifer.core.task.Task;

import java.util.List;
import java.util.Objects;

/**
 * One stage of an execution plan: an ordered task list applied to every host of a group.
 */
public record Step(HostGroup group, List<Task> tasks) {

    public Step {
        Objects.requireNonNull(group, "group");
        tasks = List.copyOf(tasks);
    }

    public List<String> taskNames() {
        return tasks.stream().map(Task::name).toList();
    }
}
