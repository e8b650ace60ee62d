package io.recur4j.core;

/**
 * Operator-editable part of a job, as submitted by an edit form.
 *
 * @param id null to create a new job
 */
public record JobDefinition(
        String id,
        String name,
        boolean enabled,
        ScheduleRule rule,
        DispatchTarget target,
        RetryPolicy retry
) {

    public JobDefinition withId(String id) {
        return new JobDefinition(id, name, enabled, rule, target, retry);
    }
}
