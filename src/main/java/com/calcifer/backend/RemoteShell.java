package com.calcifer.backend;

import com.calcifer.backend.ssh.RemoteSession;
import com.calcifer.backend.ssh.SessionPool;
import com.calcifer.core.model.Host;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;

/**
 * Shell bound to a leased remote session. Transport failures surface as {@link SessionLostException}.
 */
public class RemoteShell extends AbstractHostShell {

    static final String STAGING_PREFIX = "/tmp/calcifer_";

    private final RemoteSession session;
    private final SessionPool pool;
    private final Duration commandTimeout;

    public RemoteShell(Host host, RemoteSession session, SessionPool pool, Duration commandTimeout) {
        super(host);
        this.session = session;
        this.pool = pool;
        this.commandTimeout = commandTimeout;
    }

    @Override
    public CommandResult run(String command) {
        try {
            return session.exec(command, commandTimeout);
        } catch (IOException e) {
            throw new SessionLostException(host.name(), e.getMessage(), e);
        }
    }

    @Override
    protected String writeStaged(byte[] content) {
        String path = STAGING_PREFIX + UUID.randomUUID().toString().replace("-", "");
        try {
            session.upload(content, path);
        } catch (IOException e) {
            throw new SessionLostException(host.name(), "upload to " + path + " failed: " + e.getMessage(), e);
        }
        return path;
    }

    @Override
    protected void deleteStaged(String path) {
        CommandResult result = run("rm -f " + quote(path));
        if (!result.succeeded()) {
            // staged files are written by the login user, so sudo is only a fallback
            CommandResult forced = sudo("rm -f " + quote(path));
            if (!forced.succeeded()) {
                throw new CommandExecutionException("rm " + path + ": " + forced.errorSummary());
            }
        }
    }

    @Override
    public void download(String path, Path localPath) {
        try {
            session.download(path, localPath);
        } catch (IOException e) {
            throw new SessionLostException(host.name(), "download of " + path + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void retrieveOnClose(String path, Path localPath) {
        pool.retrieveOnClose(host, path, localPath);
    }
}
