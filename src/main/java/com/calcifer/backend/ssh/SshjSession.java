package com.calcifer.backend.ssh;

import com.calcifer.backend.CommandResult;
import net.schmizz.sshj.SSHClient;
import net.schmizz.sshj.common.IOUtils;
import net.schmizz.sshj.connection.channel.direct.Session;
import net.schmizz.sshj.sftp.SFTPClient;
import net.schmizz.sshj.xfer.InMemorySourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * {@link RemoteSession} over an authenticated sshj client.
 */
class SshjSession implements RemoteSession {

    private static final Logger log = LoggerFactory.getLogger(SshjSession.class);

    static final int TIMED_OUT_EXIT = 124;

    private static final ExecutorService STREAM_READERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "calcifer-ssh-io");
        t.setDaemon(true);
        return t;
    });

    private final String hostId;
    private final SSHClient client;

    SshjSession(String hostId, SSHClient client) {
        this.hostId = hostId;
        this.client = client;
    }

    @Override
    public String hostId() {
        return hostId;
    }

    @Override
    public CommandResult exec(String command, Duration timeout) throws IOException {
        log.debug("[{}] exec: {}", hostId, command);
        try (Session session = client.startSession()) {
            Session.Command cmd = session.exec(command);
            CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(cmd.getInputStream()), STREAM_READERS);
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(cmd.getErrorStream()), STREAM_READERS);
            try {
                if (timeout != null) {
                    cmd.join(timeout.toMillis(), TimeUnit.MILLISECONDS);
                } else {
                    cmd.join();
                }
            } catch (net.schmizz.sshj.connection.ConnectionException e) {
                if (!client.isConnected()) {
                    throw e;
                }
                cmd.close();
                return new CommandResult(TIMED_OUT_EXIT, "",
                        "Command timed out after " + (timeout != null ? timeout.toSeconds() + "s" : "wait"));
            }
            Integer exit = cmd.getExitStatus();
            return new CommandResult(exit != null ? exit : -1, await(stdout), await(stderr));
        }
    }

    @Override
    public void upload(byte[] content, String remotePath) throws IOException {
        String name = Path.of(remotePath).getFileName().toString();
        try (SFTPClient sftp = client.newSFTPClient()) {
            sftp.put(new InMemorySourceFile() {
                @Override
                public String getName() {
                    return name;
                }

                @Override
                public long getLength() {
                    return content.length;
                }

                @Override
                public InputStream getInputStream() {
                    return new ByteArrayInputStream(content);
                }

                @Override
                public int getPermissions() {
                    return 0600;
                }
            }, remotePath);
        }
    }

    @Override
    public void download(String remotePath, Path localPath) throws IOException {
        try (SFTPClient sftp = client.newSFTPClient()) {
            sftp.get(remotePath, localPath.toString());
        }
    }

    @Override
    public boolean isOpen() {
        return client.isConnected() && client.isAuthenticated();
    }

    @Override
    public void close() throws IOException {
        client.disconnect();
        log.debug("Disconnected from {}", hostId);
    }

    private static String drain(InputStream in) {
        try {
            return IOUtils.readFully(in).toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String await(CompletableFuture<String> stream) throws IOException {
        try {
            return stream.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof UncheckedIOException io) {
                throw io.getCause();
            }
            throw e;
        }
    }
}
