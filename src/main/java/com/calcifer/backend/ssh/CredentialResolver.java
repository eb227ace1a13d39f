package com.calcifer.backend.ssh;

import com.calcifer.core.model.Host;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.function.Function;

/**
 * Turns a host's credential reference into something an SSH client can authenticate with.
 * <p>
 * Supported references:
 * <ul>
 *   <li>{@code key:<path>} private key file ({@code ~} expands to the user home)</li>
 *   <li>{@code env:<VARIABLE>} password read from the environment</li>
 *   <li>absent or {@code default}: the client's default key locations and agent</li>
 * </ul>
 */
public class CredentialResolver {

    private final Function<String, String> environment;
    private final String userHome;

    public CredentialResolver() {
        this(System::getenv, System.getProperty("user.home"));
    }

    public CredentialResolver(Function<String, String> environment, String userHome) {
        this.environment = environment;
        this.userHome = userHome;
    }

    public Credential resolve(Host host) throws ConnectionException {
        String ref = host.credentialRef();
        if (ref == null || ref.isBlank() || "default".equalsIgnoreCase(ref.trim())) {
            return Credential.defaults();
        }
        ref = ref.trim();
        if (ref.startsWith("key:")) {
            String location = expandHome(ref.substring("key:".length()).trim());
            if (!Files.isReadable(Path.of(location))) {
                throw new ConnectionException(host.name(), "Private key not readable: " + location);
            }
            return Credential.key(location);
        }
        if (ref.startsWith("env:")) {
            String variable = ref.substring("env:".length()).trim();
            String value = environment.apply(variable);
            if (value == null || value.isEmpty()) {
                throw new ConnectionException(host.name(), "Environment variable " + variable + " is not set");
            }
            return Credential.password(value.toCharArray());
        }
        throw new ConnectionException(host.name(), "Unsupported credential reference for host " + host.name());
    }

    private String expandHome(String location) {
        if (location.equals("~")) {
            return userHome;
        }
        if (location.startsWith("~/")) {
            return userHome + location.substring(1);
        }
        return location;
    }

    public enum Kind { DEFAULT_KEYS, KEY_FILE, PASSWORD }

    /**
     * Resolved credential. {@link #toString()} never includes the secret.
     */
    public static final class Credential {
        private final Kind kind;
        private final String keyFile;
        private final char[] password;

        private Credential(Kind kind, String keyFile, char[] password) {
            this.kind = kind;
            this.keyFile = keyFile;
            this.password = password;
        }

        static Credential defaults() {
            return new Credential(Kind.DEFAULT_KEYS, null, null);
        }

        static Credential key(String keyFile) {
            return new Credential(Kind.KEY_FILE, keyFile, null);
        }

        static Credential password(char[] password) {
            return new Credential(Kind.PASSWORD, null, password);
        }

        public Kind kind() { return kind; }
        public String keyFile() { return keyFile; }

        public char[] password() {
            return password != null ? password.clone() : null;
        }

        public void wipe() {
            if (password != null) {
                Arrays.fill(password, '\0');
            }
        }

        @Override
        public String toString() {
            return kind == Kind.KEY_FILE ? "Credential[KEY_FILE " + keyFile + "]" : "Credential[" + kind + "]";
        }
    }
}
