package com.calcifer.backend;

import com.calcifer.core.model.Host;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Shell for the control machine. Commands run through {@code bash -c} via {@link ProcessBuilder}.
 */
public class LocalShell extends AbstractHostShell {

    private static final Logger log = LoggerFactory.getLogger(LocalShell.class);

    private static final ExecutorService STREAM_READERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "calcifer-local-io");
        t.setDaemon(true);
        return t;
    });

    private final Duration commandTimeout;

    public LocalShell(Host host, Duration commandTimeout) {
        super(host);
        this.commandTimeout = commandTimeout;
    }

    @Override
    public CommandResult run(String command) {
        log.debug("Local command: {}", command);
        Process process;
        try {
            process = new ProcessBuilder("bash", "-c", command).start();
        } catch (IOException e) {
            throw new CommandExecutionException("Cannot start local command: " + e.getMessage(), e);
        }
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of local command: {}", e.getMessage());
        }
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), STREAM_READERS);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), STREAM_READERS);
        try {
            if (commandTimeout == null) {
                process.waitFor();
            } else if (!process.waitFor(commandTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new CommandExecutionException("Local command timed out after "
                        + commandTimeout.toSeconds() + "s: " + command);
            }
            return new CommandResult(process.exitValue(), stdout.join(), stderr.join());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CommandExecutionException("Interrupted while running local command", e);
        }
    }

    @Override
    protected String writeStaged(byte[] content) {
        try {
            Path file = Files.createTempFile("calcifer_", ".tmp");
            try {
                Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
            } catch (UnsupportedOperationException e) {
                log.debug("POSIX permissions not supported for {}", file);
            }
            Files.write(file, content);
            return file.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot stage local file", e);
        }
    }

    @Override
    protected void deleteStaged(String path) {
        try {
            Files.deleteIfExists(Path.of(path));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void download(String path, Path localPath) {
        try {
            Path parent = localPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.copy(Path.of(path), localPath, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new CommandExecutionException("Cannot copy " + path + " to " + localPath, e);
        }
    }

    /** Local files are already reachable, so the copy happens immediately. */
    @Override
    public void retrieveOnClose(String path, Path localPath) {
        Path source = Path.of(path);
        if (source.toAbsolutePath().normalize().equals(localPath.toAbsolutePath().normalize())) {
            return;
        }
        download(path, localPath);
        try {
            Files.deleteIfExists(source);
        } catch (IOException e) {
            log.warn("Could not delete {} after copying it to {}: {}", path, localPath, e.getMessage());
        }
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
