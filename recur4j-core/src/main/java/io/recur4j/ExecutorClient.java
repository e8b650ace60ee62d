package io.recur4j;

import io.recur4j.core.TriggerResult;

/**
 * Outbound signal to the executor process: "run job N now".
 *
 * <p>Implementations never throw for transport problems and never retry; they report the failure
 * through {@link TriggerResult}.
 */
public interface ExecutorClient {

    TriggerResult runNow(String jobId);
}
