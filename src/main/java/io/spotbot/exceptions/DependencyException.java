package io.spotbot.exceptions;

/**
 * Expected condition that prevents an action this tick (insufficient balance,
 * empty whitelist). Caught at the call site and logged.
 */
public class DependencyException extends RuntimeException {
    public DependencyException(String message) {
        super(message);
    }

    public DependencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
