package io.spotbot.exceptions;

/**
 * Unexpected condition that requires a human: the bot is stopped at the end of the tick.
 */
public class OperationalException extends RuntimeException {
    public OperationalException(String message) {
        super(message);
    }

    public OperationalException(String message, Throwable cause) {
        super(message, cause);
    }
}
