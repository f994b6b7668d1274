package io.notify4j.core;

/**
 * Base type for all errors raised by notify4j.
 */
public class Notify4jException extends RuntimeException {

    public Notify4jException(String message) {
        super(message);
    }

    public Notify4jException(String message, Throwable cause) {
        super(message, cause);
    }
}
