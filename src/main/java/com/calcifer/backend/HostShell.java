package com.calcifer.backend;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Command and file capability a task uses to act on its host.
 * <p>
 * Obtained from {@link com.calcifer.core.task.TaskContext#shell()}; bound to the host's
 * execution backend for the duration of one task invocation.
 */
public interface HostShell {

    String hostId();

    /** Runs a command as the login user. Non-zero exits are returned, not thrown. */
    CommandResult run(String command);

    /** Runs a command through passwordless {@code sudo -n}. */
    CommandResult sudo(String command);

    boolean fileExists(String path);

    /** Content of a readable file, or empty when it does not exist or cannot be read. */
    Optional<String> readFile(String path);

    /**
     * Writes a transient file on the host and returns its path. The file is
     * removed when the task finishes, whatever its outcome.
     */
    String stage(byte[] content);

    default String stage(String content) {
        return stage(content.getBytes(StandardCharsets.UTF_8));
    }

    /** Copies a host file to the control machine now. */
    void download(String path, Path localPath);

    /**
     * Copies a host file to the control machine when the host's session closes at
     * the end of the run, then deletes the host copy.
     */
    void retrieveOnClose(String path, Path localPath);
}
