package com.calcifer.tasks;

import com.calcifer.backend.CommandResult;
import com.calcifer.backend.HostShell;
import com.calcifer.config.RunSettings;
import com.calcifer.core.model.Host;
import com.calcifer.core.model.TaskOutcome;
import com.calcifer.core.model.TaskStatus;
import com.calcifer.core.task.Task;
import com.calcifer.core.task.TaskContext;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static com.calcifer.backend.AbstractHostShell.quote;

/**
 * Installs the flux CLI and bootstraps GitOps against the configured repository.
 * The deploy key is staged only for the bootstrap and removed when the task ends.
 */
public class FluxBootstrapTask implements Task {

    static final String MARKER = "/var/lib/calcifer/flux_bootstrapped";
    static final String INSTALL = "curl -sS https://fluxcd.io/install.sh | sudo -n bash";

    @Override
    public String name() {
        return "flux-bootstrap";
    }

    @Override
    public String description() {
        return "Install and bootstrap FluxCD";
    }

    @Override
    public TaskOutcome execute(Host host, TaskContext context) throws IOException {
        RunSettings settings = context.settings();
        Optional<String> repository = settings.get(RunSettings.FLUX_REPOSITORY_URL);
        if (repository.isEmpty()) {
            return TaskOutcome.skipped("No Flux repository configured");
        }
        HostShell shell = context.shell();
        if (shell.fileExists(MARKER)) {
            return TaskOutcome.ok("Flux already bootstrapped");
        }

        Optional<String> keyFile = settings.get(RunSettings.FLUX_PRIVATE_KEY_FILE);
        if (keyFile.isEmpty() || !Files.isReadable(Path.of(keyFile.get()))) {
            return TaskOutcome.failed("Flux private key not readable: " + keyFile.orElse("(not configured)"));
        }

        boolean installed = false;
        if (!shell.run("command -v flux").succeeded()) {
            CommandResult install = shell.run(INSTALL);
            if (!install.succeeded()) {
                return TaskOutcome.failed("Failed to install flux CLI: " + install.errorSummary());
            }
            installed = true;
        }

        String key = shell.stage(Files.readAllBytes(Path.of(keyFile.get())));
        CommandResult bootstrap = shell.sudo("KUBECONFIG=/etc/kubernetes/admin.conf flux bootstrap git"
                + " --url=" + quote(repository.get())
                + " --branch=" + quote(settings.getOrDefault(RunSettings.FLUX_BRANCH, "main"))
                + " --path=" + quote(settings.getOrDefault(RunSettings.FLUX_PATH, "clusters/dev"))
                + " --private-key-file=" + quote(key)
                + " --silent");
        if (!bootstrap.succeeded()) {
            return new TaskOutcome(TaskStatus.FAILED, "Flux bootstrap failed: " + bootstrap.errorSummary(), installed);
        }
        CommandResult marker = shell.sudo("mkdir -p /var/lib/calcifer && touch " + MARKER);
        if (!marker.succeeded()) {
            return new TaskOutcome(TaskStatus.WARNING,
                    "Flux bootstrapped, but the completion marker could not be written: " + marker.errorSummary(), true);
        }
        return TaskOutcome.changed("GitOps pipeline active (" + repository.get() + ")");
    }
}
