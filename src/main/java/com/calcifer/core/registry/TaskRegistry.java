package com.calcifer.core.registry;

import com.calcifer.core.model.Goal;
import com.calcifer.core.model.HostGroup;
import com.calcifer.core.task.Task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static declaration of which tasks run, in which order, against which host group, for each goal.
 * <p>
 * Immutable once built. Integrators extend the default table with {@link #toBuilder()}.
 */
public final class TaskRegistry {

    private final Map<Goal, ExecutionPlan> plans;

    private TaskRegistry(Map<Goal, ExecutionPlan> plans) {
        this.plans = Collections.unmodifiableMap(plans);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves the plan for a goal.
     *
     * @throws UnknownGoalException if nothing is registered under {@code goal}
     */
    public ExecutionPlan resolve(Goal goal) {
        ExecutionPlan plan = goal != null ? plans.get(goal) : null;
        if (plan == null) {
            throw new UnknownGoalException(String.valueOf(goal));
        }
        return plan;
    }

    public Set<Goal> goals() {
        return plans.keySet();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        plans.forEach((goal, plan) ->
                plan.steps().forEach(step -> builder.register(goal, step.group(), step.tasks())));
        return builder;
    }

    public static final class Builder {

        private final Map<Goal, LinkedHashMap<HostGroup, List<Task>>> entries = new EnumMap<>(Goal.class);

        private Builder() {}

        /**
         * Appends tasks to the (goal, group) step. An existing step keeps its position;
         * a new pair becomes the last step of the goal.
         */
        public Builder register(Goal goal, HostGroup group, List<? extends Task> tasks) {
            Objects.requireNonNull(goal, "goal");
            Objects.requireNonNull(group, "group");
            if (tasks == null || tasks.isEmpty()) {
                throw new ConfigException("No tasks given for " + goal.cliName() + " on group " + group);
            }
            for (Task task : tasks) {
                if (task == null) {
                    throw new ConfigException("Null task registered for " + goal.cliName() + " on group " + group);
                }
            }
            entries.computeIfAbsent(goal, g -> new LinkedHashMap<>())
                    .computeIfAbsent(group, g -> new ArrayList<>())
                    .addAll(tasks);
            return this;
        }

        public Builder register(Goal goal, HostGroup group, Task... tasks) {
            return register(goal, group, List.of(tasks));
        }

        public TaskRegistry build() {
            Map<Goal, ExecutionPlan> plans = new EnumMap<>(Goal.class);
            entries.forEach((goal, groups) -> {
                List<Step> steps = new ArrayList<>();
                groups.forEach((group, tasks) -> steps.add(new Step(group, tasks)));
                plans.put(goal, new ExecutionPlan(goal, steps));
            });
            return new TaskRegistry(plans);
        }
    }
}
