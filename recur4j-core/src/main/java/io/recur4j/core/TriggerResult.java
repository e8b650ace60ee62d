package io.recur4j.core;

/**
 * Executor acknowledgement of a "run job now" signal.
 *
 * accepted   : executor queued the job
 * statusCode : HTTP-style status; 0 when the executor could not be reached
 * message    : executor reply or transport error, shown verbatim to the operator
 */
public record TriggerResult(
        boolean accepted,
        int statusCode,
        String message
) {

    public static TriggerResult accepted(int statusCode, String message) {
        return new TriggerResult(true, statusCode, message);
    }

    public static TriggerResult rejected(int statusCode, String message) {
        return new TriggerResult(false, statusCode, message);
    }

    public static TriggerResult unreachable(String message) {
        return new TriggerResult(false, 0, message);
    }
}
