package com.calcifer.tasks;

import com.calcifer.backend.CommandResult;
import com.calcifer.backend.HostShell;
import com.calcifer.core.model.Host;
import com.calcifer.core.model.TaskOutcome;
import com.calcifer.core.model.TaskStatus;
import com.calcifer.core.task.Task;
import com.calcifer.core.task.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declarative idempotent task made of (check, apply) steps.
 * <p>
 * In ensure mode each step whose check fails is applied and checked again; the task reports
 * {@code CHANGED} when anything was applied and {@code OK} when every check already passed.
 * In verify mode nothing is applied: failing checks yield the configured severity.
 * Command templates may use {@code ${...}} placeholders.
 */
public class CommandTask implements Task {

    private static final Logger log = LoggerFactory.getLogger(CommandTask.class);

    public enum Mode { ENSURE, VERIFY }

    /**
     * @param label   operator-facing name of the step
     * @param check   command that exits 0 when the desired state holds
     * @param apply   command that establishes the state, null for check-only steps
     * @param sudo    run {@code apply} through sudo
     */
    public record CheckStep(String label, String check, String apply, boolean sudo) {
        public CheckStep {
            Objects.requireNonNull(label, "label");
            Objects.requireNonNull(check, "check");
        }
    }

    private final String name;
    private final String description;
    private final Mode mode;
    private final TaskStatus verifySeverity;
    private final List<CheckStep> steps;

    private CommandTask(Builder builder) {
        this.name = builder.name;
        this.description = builder.description != null ? builder.description : builder.name;
        this.mode = builder.mode;
        this.verifySeverity = builder.verifySeverity;
        this.steps = List.copyOf(builder.steps);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    public Mode mode() {
        return mode;
    }

    public List<CheckStep> steps() {
        return steps;
    }

    @Override
    public TaskOutcome execute(Host host, TaskContext context) {
        HostShell shell = context.shell();
        List<String> applied = new ArrayList<>();
        List<String> missing = new ArrayList<>();

        for (CheckStep step : steps) {
            String check = Placeholders.render(step.check(), context);
            if (shell.run(check).succeeded()) {
                log.debug("[{}] {}: satisfied", host.name(), step.label());
                continue;
            }
            if (mode == Mode.VERIFY || step.apply() == null) {
                missing.add(step.label());
                if (mode == Mode.ENSURE) {
                    return TaskOutcome.failed(step.label() + ": check failed and no remedy is defined");
                }
                continue;
            }

            String apply = Placeholders.render(step.apply(), context);
            log.info("[{}] applying {}", host.name(), step.label());
            CommandResult result = step.sudo() ? shell.sudo(apply) : shell.run(apply);
            if (!result.succeeded()) {
                return new TaskOutcome(TaskStatus.FAILED,
                        step.label() + " failed: " + result.errorSummary(), !applied.isEmpty());
            }
            applied.add(step.label());
            if (!shell.run(check).succeeded()) {
                return new TaskOutcome(TaskStatus.FAILED,
                        step.label() + " applied but check still fails", true);
            }
        }

        if (mode == Mode.VERIFY) {
            if (missing.isEmpty()) {
                return TaskOutcome.ok("All " + steps.size() + " checks passed");
            }
            return new TaskOutcome(verifySeverity, "Missing: " + String.join(", ", missing), false);
        }
        if (applied.isEmpty()) {
            return TaskOutcome.ok("Already in desired state");
        }
        return TaskOutcome.changed("Applied: " + String.join(", ", applied));
    }

    public static final class Builder {
        private final String name;
        private String description;
        private Mode mode = Mode.ENSURE;
        private TaskStatus verifySeverity = TaskStatus.FAILED;
        private final List<CheckStep> steps = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /** Never apply anything; report {@code severity} when a check fails. */
        public Builder verifyOnly(TaskStatus severity) {
            if (severity != TaskStatus.WARNING && severity != TaskStatus.FAILED) {
                throw new IllegalArgumentException("Verify severity must be WARNING or FAILED");
            }
            this.mode = Mode.VERIFY;
            this.verifySeverity = severity;
            return this;
        }

        public Builder ensure(String label, String check, String apply) {
            steps.add(new CheckStep(label, check, apply, false));
            return this;
        }

        public Builder ensureAsRoot(String label, String check, String apply) {
            steps.add(new CheckStep(label, check, apply, true));
            return this;
        }

        public Builder check(String label, String check) {
            steps.add(new CheckStep(label, check, null, false));
            return this;
        }

        public CommandTask build() {
            if (steps.isEmpty()) {
                throw new IllegalStateException("Command task " + name + " has no steps");
            }
            return new CommandTask(this);
        }
    }
}
