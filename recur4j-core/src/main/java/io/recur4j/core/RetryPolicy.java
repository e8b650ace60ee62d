package io.recur4j.core;

/**
 * Retry settings handed to the executor. Scheduling never reads them.
 */
public record RetryPolicy(
        int maxRetries,
        int retryBackoffSec,
        int timeoutSec
) {

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 60, 10);
    }

    public RetryPolicy validate() {
        if (maxRetries < 0) {
            throw new InvalidScheduleException("max_retries must not be negative");
        }
        if (retryBackoffSec < 0) {
            throw new InvalidScheduleException("retry_backoff_sec must not be negative");
        }
        if (timeoutSec <= 0) {
            throw new InvalidScheduleException("timeout_sec must be positive");
        }
        return this;
    }
}
