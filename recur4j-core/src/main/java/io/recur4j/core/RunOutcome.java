package io.recur4j.core;

import java.util.Objects;

/**
 * Terminal result of one attempt, as reported by the executor.
 *
 * @param status        SUCCESS or FAILED
 * @param responseCode  HTTP status, MQTT return code, or null when nothing came back
 * @param errorMessage  failure reason, if any
 * @param responseBody  response text, if any
 */
public record RunOutcome(
        RunStatus status,
        Integer responseCode,
        String errorMessage,
        String responseBody
) {

    public RunOutcome {
        Objects.requireNonNull(status, "status must not be null");
    }

    public static RunOutcome success(Integer responseCode, String responseBody) {
        return new RunOutcome(RunStatus.SUCCESS, responseCode, null, responseBody);
    }

    public static RunOutcome failure(Integer responseCode, String errorMessage) {
        return new RunOutcome(RunStatus.FAILED, responseCode, errorMessage, null);
    }

    RunOutcome truncated(int maxBodyLength) {
        if (responseBody == null || responseBody.length() <= maxBodyLength) {
            return this;
        }
        int end = maxBodyLength;
        // never split a surrogate pair
        if (end > 0 && Character.isHighSurrogate(responseBody.charAt(end - 1))) {
            end--;
        }
        return new RunOutcome(status, responseCode, errorMessage, responseBody.substring(0, end));
    }
}
