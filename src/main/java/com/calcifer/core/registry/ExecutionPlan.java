package com.calcifer.core.registry;

import com.calcifer.core.model.Goal;

import java.util.List;

/**
 * Ordered steps resolved for one goal. Order is the registry declaration order.
 */
public record ExecutionPlan(Goal goal, List<Step> steps) {

    public ExecutionPlan {
        steps = List.copyOf(steps);
    }

    public boolean isEmpty() {
        return steps.stream().allMatch(step -> step.tasks().isEmpty());
    }

    public int taskCount() {
        return steps.stream().mapToInt(step -> step.tasks().size()).sum();
    }
}
