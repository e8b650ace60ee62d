package io.recur4j.core;

import io.recur4j.utils.CivilTimeFormat;

import java.time.Instant;

/**
 * Persisted job.
 *
 * <p>{@code nextRunAt} is a cache derived from {@code rule}; {@code nextRunRuleHash} is the
 * {@link ScheduleRule#fingerprint()} it was computed from. {@code version} increments on every write
 * and guards read-evaluate-write cycles against concurrent edits.
 */
public record ScheduleJob(

        // identity
        String id,
        String name,
        boolean enabled,

        // scheduling
        ScheduleRule rule,
        Instant nextRunAt,
        String nextRunRuleHash,

        // dispatch
        DispatchTarget target,
        RetryPolicy retry,

        // bookkeeping
        Instant lastRunAt,
        long version,
        Instant createdAt,
        Instant updatedAt
) {

    public static ScheduleJob from(JobDefinition definition, Instant nextRunAt, Instant now) {
        return new ScheduleJob(
                definition.id(),
                definition.name(),
                definition.enabled(),
                definition.rule(),
                nextRunAt,
                nextRunAt == null ? null : definition.rule().fingerprint(),
                definition.target(),
                definition.retry(),
                null,
                0L,
                now,
                now
        );
    }

    public JobDefinition definition() {
        return new JobDefinition(id, name, enabled, rule, target, retry);
    }

    public ScheduleJob withNextRunAt(Instant nextRunAt) {
        return new ScheduleJob(id, name, enabled, rule, nextRunAt,
                nextRunAt == null ? null : rule.fingerprint(),
                target, retry, lastRunAt, version, createdAt, updatedAt);
    }

    public ScheduleJob withEnabled(boolean enabled) {
        return new ScheduleJob(id, name, enabled, rule, nextRunAt, nextRunRuleHash,
                target, retry, lastRunAt, version, createdAt, updatedAt);
    }

    /**
     * Keeps identity, history and version of this stored job while taking the edited fields from
     * {@code edited}.
     */
    public ScheduleJob mergeEdit(ScheduleJob edited) {
        return new ScheduleJob(id, edited.name(), edited.enabled(), edited.rule(), edited.nextRunAt(),
                edited.nextRunRuleHash(), edited.target(), edited.retry(), lastRunAt, version, createdAt,
                edited.updatedAt());
    }

    /**
     * True when the cached next run was computed from a different rule than the current one.
     */
    public boolean isNextRunStale() {
        return nextRunAt != null && !rule.fingerprint().equals(nextRunRuleHash);
    }

    /**
     * Cached next run as {@code YYYY-MM-DD HH:MM:SS} in the job's zone, or null.
     */
    public String nextRunAtText() {
        return CivilTimeFormat.formatInstant(nextRunAt, rule.timezone());
    }
}
