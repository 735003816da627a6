package io.spotbot.exceptions;

/**
 * Transient exchange failure, the whole tick is paused and retried.
 */
public class TemporaryException extends RuntimeException {
    public TemporaryException(String message) {
        super(message);
    }

    public TemporaryException(String message, Throwable cause) {
        super(message, cause);
    }
}
