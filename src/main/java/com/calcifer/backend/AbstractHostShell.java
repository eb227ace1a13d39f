package com.calcifer.backend;

import com.calcifer.core.model.Host;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shared command plumbing for local and remote shells: sudo wrapping, file probes
 * and bookkeeping of staged files.
 */
public abstract class AbstractHostShell implements HostShell {

    private static final Logger log = LoggerFactory.getLogger(AbstractHostShell.class);

    static final String SUDO_PASSWORD_REQUIRED = "a password is required";

    protected final Host host;
    private final List<String> staged = new ArrayList<>();

    protected AbstractHostShell(Host host) {
        this.host = host;
    }

    @Override
    public String hostId() {
        return host.name();
    }

    @Override
    public CommandResult sudo(String command) {
        CommandResult result = run("sudo -n bash -c " + quote(command));
        if (!result.succeeded() && result.stderr().contains(SUDO_PASSWORD_REQUIRED)) {
            String user = host.username() != null ? host.username() : "current user";
            return new CommandResult(result.exitCode(), result.stdout(),
                    "Sudo privileges missing for " + user + " on " + host.name()
                            + ": configure NOPASSWD sudo for this user");
        }
        return result;
    }

    @Override
    public boolean fileExists(String path) {
        return run("test -e " + quote(path)).succeeded();
    }

    @Override
    public Optional<String> readFile(String path) {
        CommandResult result = run("cat " + quote(path));
        return result.succeeded() ? Optional.of(result.stdout()) : Optional.empty();
    }

    @Override
    public final synchronized String stage(byte[] content) {
        String path = writeStaged(content);
        staged.add(path);
        log.debug("Staged {} bytes at {} on {}", content.length, path, host.name());
        return path;
    }

    /**
     * Removes every file staged through this shell. Failures are logged and the
     * remaining files are still attempted.
     *
     * @return number of files that could not be removed
     */
    public synchronized int removeStagedFiles() {
        int failures = 0;
        for (String path : staged) {
            try {
                deleteStaged(path);
            } catch (RuntimeException e) {
                failures++;
                log.warn("Could not remove staged file {} on {}: {}", path, host.name(), e.getMessage());
            }
        }
        staged.clear();
        return failures;
    }

    public synchronized List<String> stagedFiles() {
        return List.copyOf(staged);
    }

    protected abstract String writeStaged(byte[] content);

    protected abstract void deleteStaged(String path);

    /** Single-quotes a value for {@code bash -c}. */
    public static String quote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }
}
