package io.recur4j;

import io.recur4j.core.JobDefinition;
import io.recur4j.core.RecalcResult;
import io.recur4j.core.ScheduleJob;
import io.recur4j.core.TriggerResult;

import java.util.List;
import java.util.Optional;

/**
 * Operator actions on jobs.
 *
 * <p>Every action that changes a rule or re-enables a job recomputes its cached next run.
 */
public interface ScheduleAdmin {

    /**
     * Create or edit a job.
     *
     * @throws io.recur4j.core.InvalidScheduleException when the definition is rejected; nothing is written
     */
    ScheduleJob save(JobDefinition definition);

    Optional<ScheduleJob> find(String id);

    List<ScheduleJob> list();

    Optional<ScheduleJob> setEnabled(String id, boolean enabled);

    Optional<ScheduleJob> toggle(String id);

    boolean delete(String id);

    /**
     * Re-enable the job if paused and ask the executor to run it immediately.
     */
    TriggerResult runNow(String id);

    /**
     * Refresh the next run of every enabled DAILY/WEEKLY job.
     */
    RecalcResult recalculate();

    /**
     * Builder for rules in this admin's default zone.
     */
    RuleBuilder rule();
}
