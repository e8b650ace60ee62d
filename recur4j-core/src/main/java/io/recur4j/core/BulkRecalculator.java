package io.recur4j.core;

import io.recur4j.JobStore;
import io.recur4j.utils.RecurrenceEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Refreshes the cached next run of every enabled DAILY/WEEKLY job.
 *
 * <p>ONCE jobs are never recalculated. A job whose rule yields no occurrence keeps its cached value and
 * is counted as failed; one bad job never stops the batch. Writes are conditional on the version that
 * was read, so a job edited meanwhile is counted as stale and left alone.
 */
public class BulkRecalculator {

    private static final Logger log = LoggerFactory.getLogger(BulkRecalculator.class);

    private final JobStore jobStore;
    private final Clock clock;

    public BulkRecalculator(JobStore jobStore, Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public RecalcResult recalculate() {
        Instant now = clock.instant();
        List<ScheduleJob> jobs = jobStore.findEnabledRecurring();

        int updated = 0;
        int failed = 0;
        int stale = 0;

        for (ScheduleJob job : jobs) {
            if (!job.enabled() || !job.rule().type().isRecurring()) {
                continue;
            }
            try {
                Optional<ZonedDateTime> next = RecurrenceEvaluator.computeNextRun(job.rule(), now);
                if (next.isEmpty()) {
                    failed++;
                    log.warn("recur4j recalc no occurrence id={} name={} rule={}",
                            job.id(), job.name(), job.rule().canonical());
                    continue;
                }
                boolean written = jobStore.updateNextRunAt(
                        job.id(), job.version(), next.get().toInstant(), job.rule().fingerprint());
                if (written) {
                    updated++;
                    log.debug("recur4j recalc id={} nextRunAt={}", job.id(), next.get());
                } else {
                    stale++;
                    log.warn("recur4j recalc skipped concurrently modified job id={} version={}",
                            job.id(), job.version());
                }
            } catch (Exception e) {
                failed++;
                log.error("recur4j recalc failed id={} msg={}", job.id(), e.getMessage(), e);
            }
        }

        log.info("recur4j recalc finished updated={} failed={} stale={}", updated, failed, stale);
        return new RecalcResult(updated, failed, stale);
    }
}
