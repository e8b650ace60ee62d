package io.recur4j.core;

/**
 * Raised when operator input cannot be turned into a well-formed job or rule.
 *
 * <p>The message is meant to be shown to the operator as the reason the edit was rejected.
 */
public class InvalidScheduleException extends IllegalArgumentException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
