package de.bycsitsm.agenda.recurrence;

/**
 * Exception thrown when a recurrence rule is malformed and cannot be expanded.
 */
public class InvalidRuleException extends RuntimeException {

    public InvalidRuleException(String message) {
        super(message);
    }

    public InvalidRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
