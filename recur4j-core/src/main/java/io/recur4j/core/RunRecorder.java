package io.recur4j.core;

import io.recur4j.RunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Writes execution records as a firing moves through PLANNED -> STARTED -> FINISHED.
 *
 * <p>Each retry is a new record with the next attempt number; finished records are never mutated.
 * Whether to retry is the executor's decision, this class only stores what it reports.
 */
public class RunRecorder {

    private static final Logger log = LoggerFactory.getLogger(RunRecorder.class);

    public static final int DEFAULT_MAX_BODY_LENGTH = 500;
    public static final int DEFAULT_RECENT_LIMIT = 300;

    private final RunStore runStore;
    private final int maxBodyLength;
    private final int recentLimit;

    public RunRecorder(RunStore runStore) {
        this(runStore, DEFAULT_MAX_BODY_LENGTH, DEFAULT_RECENT_LIMIT);
    }

    public RunRecorder(RunStore runStore, int maxBodyLength, int recentLimit) {
        this.runStore = Objects.requireNonNull(runStore, "runStore must not be null");
        if (maxBodyLength <= 0) {
            throw new IllegalArgumentException("maxBodyLength must be positive");
        }
        if (recentLimit <= 0) {
            throw new IllegalArgumentException("recentLimit must be positive");
        }
        this.maxBodyLength = maxBodyLength;
        this.recentLimit = recentLimit;
    }

    /**
     * Record a scheduled fire (attempt 1).
     */
    public ScheduleRun plan(String jobId, Instant plannedAt) {
        requireJobId(jobId);
        Objects.requireNonNull(plannedAt, "plannedAt must not be null");
        ScheduleRun run = runStore.insert(ScheduleRun.planned(jobId, plannedAt, 1));
        log.debug("recur4j run planned id={} jobId={} plannedAt={}", run.id(), jobId, plannedAt);
        return run;
    }

    /**
     * Record the next attempt after {@code previous} finished.
     */
    public ScheduleRun planRetry(ScheduleRun previous, Instant plannedAt) {
        Objects.requireNonNull(previous, "previous must not be null");
        Objects.requireNonNull(plannedAt, "plannedAt must not be null");
        if (previous.state() != RunState.FINISHED) {
            throw new IllegalRunTransitionException(previous.id(), RunState.FINISHED, previous.state());
        }
        ScheduleRun run = runStore.insert(ScheduleRun.planned(previous.jobId(), plannedAt, previous.attempt() + 1));
        log.debug("recur4j retry planned id={} jobId={} attempt={} plannedAt={}",
                run.id(), run.jobId(), run.attempt(), plannedAt);
        return run;
    }

    public ScheduleRun start(String runId, Instant startedAt) {
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        ScheduleRun current = require(runId);
        if (current.state() != RunState.PLANNED) {
            throw new IllegalRunTransitionException(runId, RunState.PLANNED, current.state());
        }
        if (!runStore.markStarted(runId, startedAt)) {
            throw new IllegalRunTransitionException(runId, RunState.PLANNED, require(runId).state());
        }
        return current.started(startedAt);
    }

    public ScheduleRun finish(String runId, RunOutcome outcome, Instant finishedAt) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");
        ScheduleRun current = require(runId);
        if (current.state() != RunState.STARTED) {
            throw new IllegalRunTransitionException(runId, RunState.STARTED, current.state());
        }
        requireOrdered(current.startedAt(), finishedAt);

        RunOutcome stored = outcome.truncated(maxBodyLength);
        if (!runStore.markFinished(runId, stored, finishedAt)) {
            throw new IllegalRunTransitionException(runId, RunState.STARTED, require(runId).state());
        }
        log.info("recur4j run finished id={} jobId={} attempt={} status={} code={}",
                runId, current.jobId(), current.attempt(), stored.status(), stored.responseCode());
        return current.finished(stored, finishedAt);
    }

    /**
     * Store an attempt the executor reports as already complete.
     */
    public ScheduleRun record(String jobId, Instant plannedAt, int attempt, Instant startedAt, Instant finishedAt,
                              RunOutcome outcome) {
        requireJobId(jobId);
        Objects.requireNonNull(plannedAt, "plannedAt must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1: " + attempt);
        }
        requireOrdered(startedAt, finishedAt);

        ScheduleRun complete = ScheduleRun.planned(jobId, plannedAt, attempt)
                .started(startedAt)
                .finished(outcome.truncated(maxBodyLength), finishedAt);
        ScheduleRun stored = runStore.insert(complete);
        log.info("recur4j run recorded id={} jobId={} attempt={} status={} code={}",
                stored.id(), jobId, attempt, outcome.status(), outcome.responseCode());
        return stored;
    }

    public List<ScheduleRun> history(String jobId, int limit) {
        requireJobId(jobId);
        return runStore.findByJobId(jobId, limit > 0 ? limit : recentLimit);
    }

    public List<ScheduleRun> recent() {
        return runStore.findRecent(recentLimit);
    }

    /**
     * @param limit row cap; non-positive means the configured default
     */
    public List<ScheduleRun> recent(int limit) {
        return runStore.findRecent(limit > 0 ? limit : recentLimit);
    }

    private ScheduleRun require(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        return runStore.findById(runId)
                .orElseThrow(() -> new IllegalArgumentException("No run with id: " + runId));
    }

    private static void requireOrdered(Instant startedAt, Instant finishedAt) {
        if (finishedAt.isBefore(startedAt)) {
            throw new IllegalRunTransitionException(
                    "finishedAt " + finishedAt + " is before startedAt " + startedAt);
        }
    }

    private static void requireJobId(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId must not be blank");
        }
    }
}
