package com.calcifer.backend.ssh;

/**
 * A session to a host could not be opened or authenticated.
 */
public class ConnectionException extends Exception {

    private final String hostId;

    public ConnectionException(String hostId, String message) {
        super(message);
        this.hostId = hostId;
    }

    public ConnectionException(String hostId, String message, Throwable cause) {
        super(message, cause);
        this.hostId = hostId;
    }

    public String getHostId() {
        return hostId;
    }
}
