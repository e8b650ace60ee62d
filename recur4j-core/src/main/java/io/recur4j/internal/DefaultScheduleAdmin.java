package io.recur4j.internal;

import io.recur4j.ExecutorClient;
import io.recur4j.JobStore;
import io.recur4j.RuleBuilder;
import io.recur4j.ScheduleAdmin;
import io.recur4j.core.BulkRecalculator;
import io.recur4j.core.InvalidScheduleException;
import io.recur4j.core.JobDefinition;
import io.recur4j.core.PersistResult;
import io.recur4j.core.RecalcResult;
import io.recur4j.core.RetryPolicy;
import io.recur4j.core.ScheduleDefaults;
import io.recur4j.core.ScheduleJob;
import io.recur4j.core.ScheduleRule;
import io.recur4j.core.ScheduleType;
import io.recur4j.core.TriggerResult;
import io.recur4j.utils.RecurrenceEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ScheduleAdmin} over a {@link JobStore} and an {@link ExecutorClient}.
 *
 * <p>Typical usage:
 * <pre>{@code
 * ScheduleRule rule = admin.rule()
 *         .type("WEEKLY")
 *         .daysOfWeek("Mon,Wed")
 *         .timesOfDay("09:00,15:00")
 *         .timezone("Asia/Taipei")
 *         .build();
 *
 * ScheduleJob job = admin.save(new JobDefinition(null, "lights-on", true, rule,
 *         DispatchTarget.mqtt("home/lights", "ON", 1, false), RetryPolicy.defaults()));
 *
 * admin.recalculate();
 * }</pre>
 */
public class DefaultScheduleAdmin implements ScheduleAdmin {

    private static final Logger log = LoggerFactory.getLogger(DefaultScheduleAdmin.class);

    static final int MAX_ENABLE_ATTEMPTS = 3;

    private final JobStore jobStore;
    private final BulkRecalculator recalculator;
    private final ExecutorClient executorClient;
    private final Clock clock;
    private final ScheduleDefaults defaults;

    public DefaultScheduleAdmin(JobStore jobStore, BulkRecalculator recalculator, ExecutorClient executorClient,
                                Clock clock, ScheduleDefaults defaults) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.recalculator = Objects.requireNonNull(recalculator, "recalculator must not be null");
        this.executorClient = Objects.requireNonNull(executorClient, "executorClient must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
    }

    @Override
    public ScheduleJob save(JobDefinition definition) {
        JobDefinition checked = validate(definition);
        Instant now = clock.instant();
        Instant nextRunAt = nextRunFor(checked.rule(), now, checked.name());
        ScheduleJob edited = ScheduleJob.from(checked, nextRunAt, now);

        PersistResult result;
        if (checked.id() == null) {
            result = jobStore.save(edited);
        } else {
            ScheduleJob existing = jobStore.findById(checked.id())
                    .orElseThrow(() -> new InvalidScheduleException("No job with id: " + checked.id()));
            result = jobStore.save(existing.mergeEdit(edited));
            if (!result.created() && !result.updated()) {
                // deleted between the lookup and the write
                throw new InvalidScheduleException("No job with id: " + checked.id());
            }
        }

        log.info("recur4j job saved id={} name={} created={} type={} nextRunAt={}",
                result.id(), checked.name(), result.created(), checked.rule().type(),
                edited.nextRunAtText());

        return jobStore.findById(result.id())
                .orElseThrow(() -> new IllegalStateException("Saved job not found: " + result.id()));
    }

    @Override
    public Optional<ScheduleJob> find(String id) {
        return jobStore.findById(id);
    }

    @Override
    public List<ScheduleJob> list() {
        return jobStore.findAll();
    }

    @Override
    public Optional<ScheduleJob> setEnabled(String id, boolean enabled) {
        Objects.requireNonNull(id, "id must not be null");
        if (!enabled) {
            Optional<ScheduleJob> found = jobStore.findById(id);
            if (found.isEmpty() || !found.get().enabled()) {
                return found;
            }
            // keep the cached next run for display
            jobStore.setEnabled(id, false);
            log.info("recur4j job id={} enabled=false", id);
            return jobStore.findById(id);
        }

        for (int attempt = 1; attempt <= MAX_ENABLE_ATTEMPTS; attempt++) {
            Optional<ScheduleJob> found = jobStore.findById(id);
            if (found.isEmpty() || found.get().enabled()) {
                return found;
            }
            ScheduleJob job = found.get();
            Instant next = nextRunFor(job.rule(), clock.instant(), job.name());
            String hash = next == null ? null : job.rule().fingerprint();
            if (jobStore.enable(id, job.version(), next, hash)) {
                log.info("recur4j job id={} enabled=true nextRunAt={}", id, next);
                return jobStore.findById(id);
            }
            log.debug("recur4j enable raced with a concurrent write id={} version={} attempt={}",
                    id, job.version(), attempt);
        }
        log.warn("recur4j enable gave up after {} concurrent writes id={}", MAX_ENABLE_ATTEMPTS, id);
        return jobStore.findById(id);
    }

    @Override
    public Optional<ScheduleJob> toggle(String id) {
        return jobStore.findById(id).flatMap(job -> setEnabled(id, !job.enabled()));
    }

    @Override
    public boolean delete(String id) {
        Objects.requireNonNull(id, "id must not be null");
        long deleted = jobStore.deleteById(id);
        log.info("recur4j job deleted id={} deleted={}", id, deleted);
        return deleted > 0;
    }

    @Override
    public TriggerResult runNow(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Optional<ScheduleJob> found = jobStore.findById(id);
        if (found.isEmpty()) {
            return TriggerResult.rejected(404, "job not found: " + id);
        }
        if (!found.get().enabled()) {
            // next run stays as it is; only the pause is lifted
            jobStore.setEnabled(id, true);
        }

        TriggerResult result = executorClient.runNow(id);
        if (result.accepted()) {
            log.info("recur4j run-now queued id={} code={}", id, result.statusCode());
        } else {
            log.warn("recur4j run-now failed id={} code={} msg={}", id, result.statusCode(), result.message());
        }
        return result;
    }

    @Override
    public RecalcResult recalculate() {
        return recalculator.recalculate();
    }

    @Override
    public RuleBuilder rule() {
        return new SimpleRuleBuilder(defaults.defaultZone());
    }

    private Instant nextRunFor(ScheduleRule rule, Instant now, String name) {
        Instant next = RecurrenceEvaluator.nextRunInstant(rule, now);
        if (next != null) {
            return next;
        }
        if (rule.type() == ScheduleType.ONCE) {
            Instant fallback = now.plus(defaults.onceFallbackDelay());
            log.warn("recur4j ONCE run_at already passed name={} runAt={} -> nextRunAt={}",
                    name, rule.runAt(), fallback);
            return fallback;
        }
        log.warn("recur4j rule has no occurrence name={} rule={}", name, rule.canonical());
        return null;
    }

    private static JobDefinition validate(JobDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        if (definition.name() == null || definition.name().isBlank()) {
            throw new InvalidScheduleException("name required");
        }
        if (definition.rule() == null) {
            throw new InvalidScheduleException("schedule rule required");
        }
        if (definition.target() == null) {
            throw new InvalidScheduleException("dispatch target required");
        }
        definition.rule().validate();
        definition.target().validate();
        RetryPolicy retry = definition.retry() == null ? RetryPolicy.defaults() : definition.retry().validate();
        return new JobDefinition(definition.id(), definition.name().trim(), definition.enabled(),
                definition.rule(), definition.target(), retry);
    }
}
