package com.calcifer.backend.ssh;

import com.calcifer.config.CalciferProperties;
import com.calcifer.core.model.Host;
import net.schmizz.sshj.SSHClient;
import net.schmizz.sshj.transport.verification.PromiscuousVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * Opens {@link RemoteSession}s with sshj.
 */
public class SshjSessionFactory implements SessionFactory {

    private static final Logger log = LoggerFactory.getLogger(SshjSessionFactory.class);

    private final CalciferProperties.Ssh settings;
    private final CredentialResolver credentials;

    public SshjSessionFactory(CalciferProperties.Ssh settings, CredentialResolver credentials) {
        this.settings = settings;
        this.credentials = credentials;
    }

    @Override
    public RemoteSession open(Host host) throws ConnectionException {
        String user = resolveUser(host);
        int port = host.port() > 0 ? host.port() : settings.getDefaultPort();
        CredentialResolver.Credential credential = credentials.resolve(host);

        SSHClient client = new SSHClient();
        try {
            if (settings.isStrictHostKeyChecking()) {
                if (settings.getKnownHostsFile() != null && !settings.getKnownHostsFile().isBlank()) {
                    client.loadKnownHosts(new File(settings.getKnownHostsFile()));
                } else {
                    client.loadKnownHosts();
                }
            } else {
                client.addHostKeyVerifier(new PromiscuousVerifier());
            }
            client.setConnectTimeout(settings.getConnectTimeoutSeconds() * 1000);
            client.connect(host.address(), port);

            switch (credential.kind()) {
                case KEY_FILE -> client.authPublickey(user, client.loadKeys(credential.keyFile()));
                case PASSWORD -> {
                    char[] password = credential.password();
                    try {
                        client.authPassword(user, password);
                    } finally {
                        java.util.Arrays.fill(password, '\0');
                    }
                }
                default -> client.authPublickey(user);
            }
            log.info("Authenticated to {} as {} using {}", host.name(), user, credential);
            return new SshjSession(host.name(), client);
        } catch (IOException e) {
            disconnect(client, host);
            throw new ConnectionException(host.name(),
                    "Cannot connect to " + host.name() + " (" + host.address() + ":" + port + "): " + e.getMessage(), e);
        } finally {
            credential.wipe();
        }
    }

    private String resolveUser(Host host) {
        if (host.username() != null && !host.username().isBlank()) {
            return host.username();
        }
        if (settings.getDefaultUser() != null && !settings.getDefaultUser().isBlank()) {
            return settings.getDefaultUser();
        }
        return System.getProperty("user.name");
    }

    private static void disconnect(SSHClient client, Host host) {
        try {
            client.disconnect();
        } catch (IOException e) {
            log.debug("Disconnect after failed open of {}: {}", host.name(), e.getMessage());
        }
    }
}
