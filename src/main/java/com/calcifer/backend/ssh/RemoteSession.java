package com.calcifer.backend.ssh;

import com.calcifer.backend.CommandResult;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * An authenticated connection to one remote host.
 * <p>
 * Not thread-safe; the {@link SessionPool} guarantees one user at a time.
 */
public interface RemoteSession extends Closeable {

    String hostId();

    /**
     * Runs a command and waits for it to exit.
     *
     * @param timeout maximum wait, or null to wait indefinitely
     * @throws IOException when the transport fails or the command does not exit in time
     */
    CommandResult exec(String command, Duration timeout) throws IOException;

    void upload(byte[] content, String remotePath) throws IOException;

    void download(String remotePath, Path localPath) throws IOException;

    boolean isOpen();
}
