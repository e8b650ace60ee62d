package io.recur4j.core;

import io.recur4j.JobStore;
import io.recur4j.testing.InMemoryJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BulkRecalculatorTest {

    private static final ZoneId TAIPEI = ZoneId.of("Asia/Taipei");
    // 2026-03-02 10:00 in Taipei, a Monday
    private static final Instant NOW = Instant.parse("2026-03-02T02:00:00Z");
    private static final Instant OLD_NEXT = Instant.parse("2026-02-01T00:00:00Z");

    private InMemoryJobStore jobStore;
    private BulkRecalculator recalculator;

    @BeforeEach
    void setUp() {
        jobStore = new InMemoryJobStore();
        recalculator = new BulkRecalculator(jobStore, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldTallyUpdatedAndFailedJobs() {
        String daily = insert(ScheduleRule.daily(List.of(LocalTime.of(9, 0)), TAIPEI), true);
        insert(ScheduleRule.daily(List.of(LocalTime.of(12, 0), LocalTime.of(18, 0)), TAIPEI), true);
        insert(ScheduleRule.weekly(Set.of(Weekday.MON, Weekday.WED),
                List.of(LocalTime.of(9, 0), LocalTime.of(15, 0)), TAIPEI), true);
        insert(ScheduleRule.weekly(Set.of(Weekday.SUN), List.of(LocalTime.of(8, 0)), TAIPEI), true);
        String broken = insert(ScheduleRule.weekly(Set.of(), List.of(LocalTime.of(8, 0)), TAIPEI), true);

        RecalcResult result = recalculator.recalculate();

        assertThat(result).isEqualTo(new RecalcResult(4, 1, 0));
        assertThat(result.hasFailures()).isTrue();
        assertThat(jobStore.findById(broken).orElseThrow().nextRunAt()).isEqualTo(OLD_NEXT);

        ScheduleJob refreshed = jobStore.findById(daily).orElseThrow();
        assertThat(refreshed.nextRunAtText()).isEqualTo("2026-03-03 09:00:00");
        assertThat(refreshed.isNextRunStale()).isFalse();
    }

    @Test
    void shouldSkipOnceAndDisabledJobs() {
        String once = insert(ScheduleRule.once(LocalDateTime.parse("2025-01-01T00:00:00"), TAIPEI), true);
        String disabled = insert(ScheduleRule.daily(List.of(LocalTime.of(9, 0)), TAIPEI), false);

        RecalcResult result = recalculator.recalculate();

        assertThat(result).isEqualTo(RecalcResult.empty());
        assertThat(jobStore.findById(once).orElseThrow().nextRunAt()).isEqualTo(OLD_NEXT);
        assertThat(jobStore.findById(disabled).orElseThrow().nextRunAt()).isEqualTo(OLD_NEXT);
    }

    @Test
    void repeatedRunsShouldBeIdempotent() {
        String id = insert(ScheduleRule.weekly(Set.of(Weekday.WED), List.of(LocalTime.of(9, 0)), TAIPEI), true);

        recalculator.recalculate();
        Instant first = jobStore.findById(id).orElseThrow().nextRunAt();
        recalculator.recalculate();

        assertThat(jobStore.findById(id).orElseThrow().nextRunAt()).isEqualTo(first);
    }

    @Test
    void concurrentEditShouldBeReportedAsStale() {
        ScheduleJob job = ScheduleJob.from(definition(ScheduleRule.daily(List.of(LocalTime.NOON), TAIPEI), true),
                OLD_NEXT, NOW);
        JobStore racing = mock(JobStore.class);
        when(racing.findEnabledRecurring()).thenReturn(List.of(job));
        when(racing.updateNextRunAt(any(), anyLong(), any(), anyString())).thenReturn(false);

        RecalcResult result = new BulkRecalculator(racing, Clock.fixed(NOW, ZoneOffset.UTC)).recalculate();

        assertThat(result).isEqualTo(new RecalcResult(0, 0, 1));
    }

    @Test
    void storeFailureShouldNotAbortBatch() {
        ScheduleJob a = ScheduleJob.from(definition(ScheduleRule.daily(List.of(LocalTime.NOON), TAIPEI), true),
                OLD_NEXT, NOW);
        ScheduleJob b = new ScheduleJob("b", "b", true, a.rule(), OLD_NEXT, null, a.target(), a.retry(),
                null, 0L, NOW, NOW);
        JobStore flaky = mock(JobStore.class);
        when(flaky.findEnabledRecurring()).thenReturn(List.of(a, b));
        when(flaky.updateNextRunAt(any(), anyLong(), any(), anyString()))
                .thenThrow(new IllegalStateException("connection reset"))
                .thenReturn(true);

        RecalcResult result = new BulkRecalculator(flaky, Clock.fixed(NOW, ZoneOffset.UTC)).recalculate();

        assertThat(result).isEqualTo(new RecalcResult(1, 1, 0));
    }

    private String insert(ScheduleRule rule, boolean enabled) {
        ScheduleJob job = ScheduleJob.from(definition(rule, enabled), OLD_NEXT, NOW);
        return jobStore.save(job).id();
    }

    private static JobDefinition definition(ScheduleRule rule, boolean enabled) {
        return new JobDefinition(null, "job", enabled, rule,
                DispatchTarget.http("http://127.0.0.1:8080/hook", "POST", null, null, "{}"),
                RetryPolicy.defaults());
    }
}
