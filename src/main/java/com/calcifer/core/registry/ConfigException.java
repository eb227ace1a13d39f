package com.calcifer.core.registry;

/**
 * Raised when the run cannot start because its configuration is invalid:
 * an unknown goal, a malformed inventory, an empty registry entry or bad run options.
 * Nothing has executed when this is thrown.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
