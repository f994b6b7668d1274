package io.notify4j.core;

/**
 * Rejected input: bad schedule, duplicate reminder offsets, missing required fields.
 * Raised before anything is persisted.
 */
public class ValidationException extends Notify4jException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
