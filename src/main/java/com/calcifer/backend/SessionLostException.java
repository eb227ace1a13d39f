package com.calcifer.backend;

/**
 * The remote session broke while a task was using it.
 */
public class SessionLostException extends RuntimeException {

    private final String hostId;

    public SessionLostException(String hostId, String message, Throwable cause) {
        super("Connection to " + hostId + " lost: " + message, cause);
        this.hostId = hostId;
    }

    public String getHostId() {
        return hostId;
    }
}
