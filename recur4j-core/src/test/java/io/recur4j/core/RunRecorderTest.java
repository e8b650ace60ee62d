package io.recur4j.core;

import io.recur4j.testing.InMemoryRunStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunRecorderTest {

    private static final Instant PLANNED = Instant.parse("2026-03-02T01:00:00Z");

    private InMemoryRunStore runStore;
    private RunRecorder recorder;

    @BeforeEach
    void setUp() {
        runStore = new InMemoryRunStore();
        recorder = new RunRecorder(runStore, 10, 300);
    }

    @Test
    void shouldMoveThroughPlannedStartedFinished() {
        ScheduleRun planned = recorder.plan("job-1", PLANNED);
        assertThat(planned.state()).isEqualTo(RunState.PLANNED);
        assertThat(planned.attempt()).isEqualTo(1);
        assertThat(planned.status()).isNull();

        ScheduleRun started = recorder.start(planned.id(), PLANNED.plusSeconds(1));
        assertThat(started.state()).isEqualTo(RunState.STARTED);
        assertThat(started.status()).isNull();

        ScheduleRun finished = recorder.finish(planned.id(),
                RunOutcome.success(200, "0123456789-overflow"), PLANNED.plusSeconds(2));

        assertThat(finished.state()).isEqualTo(RunState.FINISHED);
        assertThat(finished.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(finished.responseCode()).isEqualTo(200);
        assertThat(finished.responseBody()).isEqualTo("0123456789");
        assertThat(runStore.findById(planned.id())).contains(finished);
    }

    @Test
    void shouldRejectOutOfOrderTransitions() {
        ScheduleRun planned = recorder.plan("job-1", PLANNED);

        assertThatThrownBy(() -> recorder.finish(planned.id(), RunOutcome.failure(500, "boom"), PLANNED))
                .isInstanceOf(IllegalRunTransitionException.class);

        recorder.start(planned.id(), PLANNED);
        assertThatThrownBy(() -> recorder.start(planned.id(), PLANNED))
                .isInstanceOf(IllegalRunTransitionException.class);

        recorder.finish(planned.id(), RunOutcome.failure(500, "boom"), PLANNED.plusSeconds(1));
        assertThatThrownBy(() -> recorder.finish(planned.id(), RunOutcome.success(200, "ok"), PLANNED.plusSeconds(2)))
                .isInstanceOf(IllegalRunTransitionException.class);

        assertThat(runStore.findById(planned.id()).orElseThrow().status()).isEqualTo(RunStatus.FAILED);
    }

    @Test
    void finishBeforeStartShouldBeRejected() {
        ScheduleRun planned = recorder.plan("job-1", PLANNED);
        recorder.start(planned.id(), PLANNED.plusSeconds(10));

        assertThatThrownBy(() -> recorder.finish(planned.id(), RunOutcome.success(200, null), PLANNED))
                .isInstanceOf(IllegalRunTransitionException.class);
        assertThat(runStore.findById(planned.id()).orElseThrow().state()).isEqualTo(RunState.STARTED);
    }

    @Test
    void retryShouldAppendNewRecordWithNextAttempt() {
        ScheduleRun first = recorder.plan("job-1", PLANNED);
        recorder.start(first.id(), PLANNED);
        ScheduleRun failed = recorder.finish(first.id(), RunOutcome.failure(null, "timeout"), PLANNED.plusSeconds(10));

        ScheduleRun retry = recorder.planRetry(failed, PLANNED.plusSeconds(70));

        assertThat(retry.id()).isNotEqualTo(first.id());
        assertThat(retry.attempt()).isEqualTo(2);
        assertThat(retry.jobId()).isEqualTo("job-1");
        assertThat(runStore.findById(first.id()).orElseThrow().status()).isEqualTo(RunStatus.FAILED);

        List<ScheduleRun> history = recorder.history("job-1", 10);
        assertThat(history).extracting(ScheduleRun::attempt).containsExactly(2, 1);
    }

    @Test
    void retryOfUnfinishedRunShouldBeRejected() {
        ScheduleRun first = recorder.plan("job-1", PLANNED);

        assertThatThrownBy(() -> recorder.planRetry(first, PLANNED.plusSeconds(60)))
                .isInstanceOf(IllegalRunTransitionException.class);
    }

    @Test
    void recordShouldStoreCompleteAttempt() {
        ScheduleRun stored = recorder.record("job-9", PLANNED, 3, PLANNED.plusSeconds(1), PLANNED.plusSeconds(4),
                RunOutcome.failure(503, "Service Unavailable"));

        assertThat(stored.id()).isNotNull();
        assertThat(stored.state()).isEqualTo(RunState.FINISHED);
        assertThat(stored.attempt()).isEqualTo(3);
        assertThat(stored.errorMessage()).isEqualTo("Service Unavailable");
        assertThat(recorder.recent()).containsExactly(stored);

        assertThatThrownBy(() -> recorder.record("job-9", PLANNED, 0, PLANNED, PLANNED, RunOutcome.success(200, "")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> recorder.record("job-9", PLANNED, 1, PLANNED.plusSeconds(5), PLANNED,
                RunOutcome.success(200, ""))).isInstanceOf(IllegalRunTransitionException.class);
    }

    @Test
    void recentShouldBeNewestFirstAndCapped() {
        RunRecorder capped = new RunRecorder(runStore, 10, 2);
        capped.plan("a", PLANNED);
        capped.plan("b", PLANNED.plusSeconds(60));
        ScheduleRun newest = capped.plan("c", PLANNED.plusSeconds(120));

        assertThat(capped.recent()).hasSize(2).first().isEqualTo(newest);
        assertThat(capped.recent(1)).containsExactly(newest);
        assertThat(capped.recent(0)).hasSize(2);
    }

    @Test
    void truncationShouldNotSplitSurrogatePair() {
        // the emoji occupies chars 9 and 10, straddling the 10-char cap
        String body = "012345678\uD83D\uDE00x";

        ScheduleRun stored = recorder.record("job-9", PLANNED, 1, PLANNED, PLANNED.plusSeconds(1),
                RunOutcome.success(200, body));

        assertThat(stored.responseBody()).isEqualTo("012345678");
        assertThat(runStore.findById(stored.id()).orElseThrow().responseBody()).isEqualTo("012345678");
    }
}
