package com.calcifer.backend;

/**
 * A command could not be executed at all (as opposed to running and exiting non-zero).
 */
public class CommandExecutionException extends RuntimeException {

    public CommandExecutionException(String message) {
        super(message);
    }

    public CommandExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
