package com.calcifer.core.registry;

/**
 * No execution plan is registered under the requested goal.
 */
public class UnknownGoalException extends ConfigException {

    private final String goal;

    public UnknownGoalException(String goal) {
        super("Unknown goal: " + goal);
        this.goal = goal;
    }

    public String getGoal() {
        return goal;
    }
}
