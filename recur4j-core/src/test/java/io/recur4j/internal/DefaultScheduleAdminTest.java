package io.recur4j.internal;

import io.recur4j.ExecutorClient;
import io.recur4j.core.BulkRecalculator;
import io.recur4j.core.DispatchTarget;
import io.recur4j.core.InvalidScheduleException;
import io.recur4j.core.JobDefinition;
import io.recur4j.core.RecalcResult;
import io.recur4j.core.RetryPolicy;
import io.recur4j.core.ScheduleDefaults;
import io.recur4j.core.ScheduleJob;
import io.recur4j.core.ScheduleRule;
import io.recur4j.core.TriggerResult;
import io.recur4j.testing.InMemoryJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultScheduleAdminTest {

    // 2026-03-02 00:00 in Taipei
    private static final Instant NOW = Instant.parse("2026-03-01T16:00:00Z");
    private static final ZoneId TAIPEI = ZoneId.of("Asia/Taipei");

    private InMemoryJobStore jobStore;
    private ExecutorClient executorClient;
    private DefaultScheduleAdmin admin;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        jobStore = new InMemoryJobStore();
        executorClient = mock(ExecutorClient.class);
        admin = new DefaultScheduleAdmin(
                jobStore,
                new BulkRecalculator(jobStore, clock),
                executorClient,
                clock,
                new ScheduleDefaults(TAIPEI, Duration.ofMinutes(1)));
    }

    @Test
    void saveShouldComputeNextRunFromRule() {
        ScheduleRule rule = admin.rule().type("DAILY").timesOfDay("09:00").build();

        ScheduleJob job = admin.save(definition(null, rule));

        assertThat(job.id()).isNotNull();
        assertThat(job.nextRunAtText()).isEqualTo("2026-03-02 09:00:00");
        assertThat(job.nextRunRuleHash()).isEqualTo(rule.fingerprint());
        assertThat(job.isNextRunStale()).isFalse();
    }

    @Test
    void lapsedOnceShouldBeRearmedOneMinuteAhead() {
        ScheduleRule rule = admin.rule().type("ONCE").runAt("2025-01-01 00:00:00").build();

        ScheduleJob job = admin.save(definition(null, rule));

        assertThat(job.nextRunAt()).isEqualTo(NOW.plus(Duration.ofMinutes(1)));
    }

    @Test
    void futureOnceShouldKeepRunAt() {
        ScheduleRule rule = admin.rule().type("ONCE").runAt("2026-03-05 12:00").build();

        ScheduleJob job = admin.save(definition(null, rule));

        assertThat(job.nextRunAtText()).isEqualTo("2026-03-05 12:00:00");
    }

    @Test
    void invalidDefinitionShouldBeRejectedWithoutWriting() {
        ScheduleRule weeklyNoDays = admin.rule().type("WEEKLY").timesOfDay("09:00").daysOfWeek("nope")
                .buildUnchecked();
        ScheduleRule daily = admin.rule().type("DAILY").timesOfDay("09:00").build();

        assertThatThrownBy(() -> admin.save(definition(null, weeklyNoDays)))
                .isInstanceOf(InvalidScheduleException.class);
        assertThatThrownBy(() -> admin.save(new JobDefinition(null, "mqtt", true, daily,
                DispatchTarget.mqtt(" ", "ON", 0, false), RetryPolicy.defaults())))
                .hasMessage("MQTT requires mqtt_topic");
        assertThatThrownBy(() -> admin.save(new JobDefinition(null, "http", true, daily,
                DispatchTarget.http(null, "GET", null, null, null), RetryPolicy.defaults())))
                .hasMessage("HTTP requires http_url");
        assertThatThrownBy(() -> admin.save(new JobDefinition(null, " ", true, daily,
                DispatchTarget.http("http://x", "GET", null, null, null), null)))
                .hasMessage("name required");

        assertThat(jobStore.findAll()).isEmpty();
    }

    @Test
    void editShouldRecomputeAndKeepIdentity() {
        ScheduleJob created = admin.save(definition(null, admin.rule().type("DAILY").timesOfDay("09:00").build()));
        ScheduleRule weekly = admin.rule().type("WEEKLY").daysOfWeek("Wed").timesOfDay("15:00").build();

        ScheduleJob edited = admin.save(definition(created.id(), weekly));

        assertThat(edited.id()).isEqualTo(created.id());
        assertThat(edited.createdAt()).isEqualTo(created.createdAt());
        assertThat(edited.version()).isGreaterThan(created.version());
        assertThat(edited.nextRunAtText()).isEqualTo("2026-03-04 15:00:00");
        assertThat(jobStore.findAll()).hasSize(1);
    }

    @Test
    void editOfUnknownJobShouldBeRejected() {
        ScheduleRule rule = admin.rule().type("DAILY").timesOfDay("09:00").build();

        assertThatThrownBy(() -> admin.save(definition("404", rule)))
                .isInstanceOf(InvalidScheduleException.class);
    }

    @Test
    void toggleShouldPauseAndRecomputeOnResume() {
        ScheduleJob job = admin.save(definition(null, admin.rule().type("DAILY").timesOfDay("09:00").build()));
        jobStore.updateNextRunAt(job.id(), job.version(), Instant.parse("2020-01-01T00:00:00Z"), "outdated");

        ScheduleJob paused = admin.toggle(job.id()).orElseThrow();
        assertThat(paused.enabled()).isFalse();
        assertThat(paused.nextRunAt()).isEqualTo(Instant.parse("2020-01-01T00:00:00Z"));

        ScheduleJob resumed = admin.toggle(job.id()).orElseThrow();
        assertThat(resumed.enabled()).isTrue();
        assertThat(resumed.nextRunAtText()).isEqualTo("2026-03-02 09:00:00");
        assertThat(resumed.isNextRunStale()).isFalse();

        assertThat(admin.toggle("missing")).isEmpty();
    }

    @Test
    void runNowShouldReenablePausedJobAndSignalExecutor() {
        ScheduleJob job = admin.save(definition(null, admin.rule().type("DAILY").timesOfDay("09:00").build()));
        admin.setEnabled(job.id(), false);
        when(executorClient.runNow(job.id())).thenReturn(TriggerResult.accepted(200, "{\"ok\":true}"));

        TriggerResult result = admin.runNow(job.id());

        assertThat(result.accepted()).isTrue();
        ScheduleJob after = admin.find(job.id()).orElseThrow();
        assertThat(after.enabled()).isTrue();
        assertThat(after.nextRunAt()).isEqualTo(job.nextRunAt());
        verify(executorClient).runNow(job.id());
    }

    @Test
    void runNowShouldSurfaceExecutorFailureVerbatim() {
        ScheduleJob job = admin.save(definition(null, admin.rule().type("DAILY").timesOfDay("09:00").build()));
        when(executorClient.runNow(job.id())).thenReturn(TriggerResult.unreachable("Connection refused"));

        TriggerResult result = admin.runNow(job.id());

        assertThat(result).isEqualTo(new TriggerResult(false, 0, "Connection refused"));
    }

    @Test
    void runNowOfUnknownJobShouldNotSignalExecutor() {
        TriggerResult result = admin.runNow("missing");

        assertThat(result.accepted()).isFalse();
        assertThat(result.statusCode()).isEqualTo(404);
        verify(executorClient, never()).runNow(anyString());
    }

    @Test
    void deleteShouldRemoveJob() {
        ScheduleJob job = admin.save(definition(null, admin.rule().type("DAILY").timesOfDay("09:00").build()));

        assertThat(admin.delete(job.id())).isTrue();
        assertThat(admin.delete(job.id())).isFalse();
        assertThat(admin.list()).isEmpty();
    }

    @Test
    void recalculateShouldDelegateToBulkRecalculator() {
        admin.save(definition(null, admin.rule().type("WEEKLY").daysOfWeek("Mon").timesOfDay("09:00").build()));
        admin.save(definition(null, admin.rule().type("ONCE").runAt("2026-03-05 12:00").build()));

        assertThat(admin.recalculate()).isEqualTo(new RecalcResult(1, 0, 0));
    }

    @Test
    void enableShouldKeepRuleEditedConcurrently() {
        InterleavingJobStore store = new InterleavingJobStore();
        DefaultScheduleAdmin racingAdmin = adminOver(store);
        ScheduleJob job = racingAdmin.save(definition(null, admin.rule().type("DAILY").timesOfDay("09:00").build()));
        racingAdmin.setEnabled(job.id(), false);

        ScheduleRule evening = admin.rule().type("DAILY").timesOfDay("18:00").build();
        store.afterNextRead(() -> {
            ScheduleJob stored = store.findById(job.id()).orElseThrow();
            JobDefinition edit = new JobDefinition(job.id(), "evening-ping", false, evening,
                    stored.target(), stored.retry());
            store.save(stored.mergeEdit(ScheduleJob.from(edit, null, NOW)));
        });

        ScheduleJob enabled = racingAdmin.setEnabled(job.id(), true).orElseThrow();

        assertThat(enabled.enabled()).isTrue();
        assertThat(enabled.name()).isEqualTo("evening-ping");
        assertThat(enabled.rule()).isEqualTo(evening);
        assertThat(enabled.nextRunAtText()).isEqualTo("2026-03-02 18:00:00");
        assertThat(enabled.isNextRunStale()).isFalse();
    }

    @Test
    void editOfJobDeletedMidwayShouldFailWithoutRecreatingIt() {
        InterleavingJobStore store = new InterleavingJobStore();
        DefaultScheduleAdmin racingAdmin = adminOver(store);
        ScheduleJob job = racingAdmin.save(definition(null, admin.rule().type("DAILY").timesOfDay("09:00").build()));

        store.afterNextRead(() -> store.deleteById(job.id()));

        ScheduleRule evening = admin.rule().type("DAILY").timesOfDay("18:00").build();
        assertThatThrownBy(() -> racingAdmin.save(definition(job.id(), evening)))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining(job.id());
        assertThat(store.findById(job.id())).isEmpty();
    }

    private DefaultScheduleAdmin adminOver(InMemoryJobStore store) {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        return new DefaultScheduleAdmin(store, new BulkRecalculator(store, clock), executorClient, clock,
                new ScheduleDefaults(TAIPEI, Duration.ofMinutes(1)));
    }

    /**
     * Runs a write right after the next read, as another operator would.
     */
    private static class InterleavingJobStore extends InMemoryJobStore {

        private Runnable pending;

        void afterNextRead(Runnable write) {
            this.pending = write;
        }

        @Override
        public Optional<ScheduleJob> findById(String id) {
            Optional<ScheduleJob> read = super.findById(id);
            Runnable write = pending;
            if (write != null) {
                pending = null;
                write.run();
            }
            return read;
        }
    }

    private static JobDefinition definition(String id, ScheduleRule rule) {
        return new JobDefinition(id, "morning-ping", true, rule,
                DispatchTarget.http("http://127.0.0.1:9000/ping", "POST", "application/json", null, "{}"),
                RetryPolicy.defaults());
    }
}
