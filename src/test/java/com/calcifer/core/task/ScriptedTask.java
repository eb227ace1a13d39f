package com.calcifer.core.task;

import com.calcifer.core.model.Host;
import com.calcifer.core.model.TaskOutcome;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Task double whose body is supplied by the test. Records the hosts it ran on.
 */
public class ScriptedTask implements Task {

    @FunctionalInterface
    public interface Body {
        TaskOutcome apply(Host host, TaskContext context) throws Exception;
    }

    private final String name;
    private final Body body;
    private final List<String> invocations = new CopyOnWriteArrayList<>();

    public ScriptedTask(String name, Body body) {
        this.name = name;
        this.body = body;
    }

    public static ScriptedTask returning(String name, TaskOutcome outcome) {
        return new ScriptedTask(name, (host, context) -> outcome);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public TaskOutcome execute(Host host, TaskContext context) throws Exception {
        invocations.add(host.name());
        return body.apply(host, context);
    }

    public List<String> invocations() {
        return List.copyOf(invocations);
    }
}
