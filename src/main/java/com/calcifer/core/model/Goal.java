package com.calcifer.core.model;

import com.calcifer.core.registry.UnknownGoalException;

import java.util.Locale;

/**
 * High-level intent driving one engine run.
 */
public enum Goal {
    VERIFY("verify"),
    INIT("init"),
    ARC_CONNECT("arc-connect"),
    DESTROY("destroy");

    private final String cliName;

    Goal(String cliName) {
        this.cliName = cliName;
    }

    public String cliName() {
        return cliName;
    }

    /**
     * Resolves a goal from either its enum name or its CLI name.
     * Matching ignores case and treats {@code -} and {@code _} alike.
     *
     * @throws UnknownGoalException if no goal matches
     */
    public static Goal fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new UnknownGoalException(String.valueOf(name));
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (Goal goal : values()) {
            if (goal.name().equals(normalized)) {
                return goal;
            }
        }
        throw new UnknownGoalException(name);
    }
}
