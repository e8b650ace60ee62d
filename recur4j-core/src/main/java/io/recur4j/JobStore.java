package io.recur4j;

import io.recur4j.core.PersistResult;
import io.recur4j.core.ScheduleJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable table of jobs.
 *
 * <p>Every write bumps the job's {@code version}. Writers that recompute {@code nextRunAt} from a rule
 * they read must go through {@link #updateNextRunAt} with the version they read, so a concurrent edit
 * is never overwritten with a value derived from the old rule.
 */
public interface JobStore {

    /**
     * Insert when {@code job.id()} is null, otherwise replace the stored job's editable fields.
     * Never re-creates a job that is gone: an unknown id yields {@link PersistResult#noop(String)}.
     */
    PersistResult save(ScheduleJob job);

    Optional<ScheduleJob> findById(String id);

    List<ScheduleJob> findAll();

    /**
     * Enabled jobs whose schedule type is DAILY or WEEKLY.
     */
    List<ScheduleJob> findEnabledRecurring();

    /**
     * Write a recomputed next run if the stored version still equals {@code expectedVersion}.
     *
     * @param nextRunAt recomputed value
     * @param ruleHash  fingerprint of the rule it was computed from
     * @return false when the job is gone or was modified in between
     */
    boolean updateNextRunAt(String id, long expectedVersion, Instant nextRunAt, String ruleHash);

    /**
     * Enable the job together with its recomputed next run, if the stored version still equals
     * {@code expectedVersion}. Rule fields are left untouched.
     *
     * @return false when the job is gone or was modified in between
     */
    boolean enable(String id, long expectedVersion, Instant nextRunAt, String ruleHash);

    /**
     * @return false when no job has this id
     */
    boolean setEnabled(String id, boolean enabled);

    /**
     * Hard delete. Execution records of the job are left in place.
     *
     * @return deleted count (0 or 1)
     */
    long deleteById(String id);
}
