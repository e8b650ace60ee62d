package io.recur4j.core;

import java.time.Instant;

/**
 * Execution record of one attempt at firing a job.
 *
 * <p>{@code jobId} is a weak reference: the record outlives the job. {@code status} and the response
 * fields are only present once {@code finishedAt} is set.
 */
public record ScheduleRun(
        String id,
        String jobId,
        Instant plannedAt,
        Instant startedAt,
        Instant finishedAt,
        RunStatus status,
        int attempt,
        Integer responseCode,
        String errorMessage,
        String responseBody
) {

    public static ScheduleRun planned(String jobId, Instant plannedAt, int attempt) {
        return new ScheduleRun(null, jobId, plannedAt, null, null, null, attempt, null, null, null);
    }

    public RunState state() {
        if (finishedAt != null) {
            return RunState.FINISHED;
        }
        if (startedAt != null) {
            return RunState.STARTED;
        }
        return RunState.PLANNED;
    }

    public ScheduleRun withId(String id) {
        return new ScheduleRun(id, jobId, plannedAt, startedAt, finishedAt, status, attempt,
                responseCode, errorMessage, responseBody);
    }

    public ScheduleRun started(Instant startedAt) {
        return new ScheduleRun(id, jobId, plannedAt, startedAt, null, null, attempt, null, null, null);
    }

    public ScheduleRun finished(RunOutcome outcome, Instant finishedAt) {
        return new ScheduleRun(id, jobId, plannedAt, startedAt, finishedAt, outcome.status(), attempt,
                outcome.responseCode(), outcome.errorMessage(), outcome.responseBody());
    }
}
