package com.raditha.dbg.config;

/**
 * Thrown when {@code dbg.yml} cannot be read or does not hold valid settings.
 */
public class ConfigLoadException extends RuntimeException {

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
