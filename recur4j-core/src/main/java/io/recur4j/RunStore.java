package io.recur4j;

import io.recur4j.core.RunOutcome;
import io.recur4j.core.ScheduleRun;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-mostly store of execution records.
 *
 * <p>The two transition methods are compare-and-set: they only apply when the record is still in
 * the expected state, and report whether they did.
 */
public interface RunStore {

    /**
     * @return the stored record with its assigned id
     */
    ScheduleRun insert(ScheduleRun run);

    Optional<ScheduleRun> findById(String id);

    /**
     * PLANNED -> STARTED.
     */
    boolean markStarted(String id, Instant startedAt);

    /**
     * STARTED -> FINISHED, writing status and response fields together with {@code finishedAt}.
     */
    boolean markFinished(String id, RunOutcome outcome, Instant finishedAt);

    /**
     * Newest first.
     */
    List<ScheduleRun> findByJobId(String jobId, int limit);

    /**
     * Newest first, across all jobs.
     */
    List<ScheduleRun> findRecent(int limit);
}
