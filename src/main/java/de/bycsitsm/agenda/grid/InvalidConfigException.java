package de.bycsitsm.agenda.grid;

/**
 * Exception thrown when a grid configuration is malformed.
 */
public class InvalidConfigException extends RuntimeException {

    public InvalidConfigException(String message) {
        super(message);
    }

    public InvalidConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
