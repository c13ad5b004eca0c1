package com.company.adaptive.scheduled;

import com.company.adaptive.domain.enums.JobState;
import com.company.adaptive.dto.response.JobSnapshot;
import com.company.adaptive.exception.DuplicateJobException;
import com.company.adaptive.exception.JobNotFoundException;
import com.company.adaptive.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class MaintenanceSchedulerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private MaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        meterRegistry = new SimpleMeterRegistry();
        scheduler = new MaintenanceScheduler(null, Duration.ofSeconds(1), clock, meterRegistry);
    }

    @Test
    void fixedPeriodJobKeepsScheduleDespiteFailure() {
        List<Instant> runs = new ArrayList<>();
        scheduler.schedule("flaky", IntervalSpec.parse("60s"), () -> {
            runs.add(clock.instant());
            if (runs.size() == 1) {
                throw new IllegalStateException("boom");
            }
        });

        for (int second = 1; second <= 185; second++) {
            clock.advance(Duration.ofSeconds(1));
            scheduler.tick();
        }

        assertThat(runs).containsExactly(T0.plusSeconds(60), T0.plusSeconds(120), T0.plusSeconds(180));
        JobSnapshot job = scheduler.listJobs().get(0);
        assertThat(job.getRunCount()).isEqualTo(3);
        assertThat(job.getFailureCount()).isEqualTo(1);
        assertThat(job.getLastError()).isEqualTo("IllegalStateException: boom");
        assertThat(job.getNextRunAt()).isEqualTo(T0.plusSeconds(240));
        assertThat(job.getState()).isEqualTo(JobState.IDLE);
        assertThat(meterRegistry.counter("adaptive.scheduler.job.runs", "job", "flaky", "outcome", "failure").count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.counter("adaptive.scheduler.job.runs", "job", "flaky", "outcome", "success").count())
                .isEqualTo(2.0);
    }

    @Test
    void failingJobDoesNotStopOtherJobs() {
        AtomicInteger healthyRuns = new AtomicInteger();
        scheduler.schedule("broken", IntervalSpec.every(Duration.ofSeconds(10)), () -> {
            throw new RuntimeException("always");
        });
        scheduler.schedule("healthy", IntervalSpec.every(Duration.ofSeconds(10)), healthyRuns::incrementAndGet);

        clock.advance(Duration.ofSeconds(10));

        assertThat(scheduler.tick()).isEqualTo(2);
        assertThat(healthyRuns).hasValue(1);
    }

    @Test
    void jobThrowingErrorIsIsolatedAndRunsAgain() {
        AtomicInteger badCalls = new AtomicInteger();
        AtomicInteger goodCalls = new AtomicInteger();
        scheduler.schedule("bad", IntervalSpec.every(Duration.ofSeconds(10)), () -> {
            badCalls.incrementAndGet();
            throw new AssertionError("x");
        });
        scheduler.schedule("good", IntervalSpec.every(Duration.ofSeconds(10)), goodCalls::incrementAndGet);

        for (int i = 0; i < 5; i++) {
            clock.advance(Duration.ofSeconds(10));
            assertThat(scheduler.tick()).isEqualTo(2);
        }

        assertThat(badCalls).hasValue(5);
        assertThat(goodCalls).hasValue(5);
        JobSnapshot bad = scheduler.listJobs().get(0);
        assertThat(bad.getState()).isEqualTo(JobState.FAILED);
        assertThat(bad.getRunCount()).isEqualTo(5);
        assertThat(bad.getFailureCount()).isEqualTo(5);
        assertThat(bad.getLastError()).isEqualTo("AssertionError: x");
        assertThat(bad.getNextRunAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(scheduler.listJobs().get(1).getState()).isEqualTo(JobState.IDLE);
    }

    @Test
    void failedStateIsVisibleUntilNextSuccessfulRun() {
        AtomicInteger calls = new AtomicInteger();
        scheduler.schedule("recovering", IntervalSpec.every(Duration.ofSeconds(30)), () -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("first run fails");
            }
        });

        clock.advance(Duration.ofSeconds(30));
        scheduler.tick();
        assertThat(scheduler.listJobs().get(0).getState()).isEqualTo(JobState.FAILED);

        clock.advance(Duration.ofSeconds(10));
        assertThat(scheduler.tick()).isZero();
        assertThat(scheduler.listJobs().get(0).getState()).isEqualTo(JobState.FAILED);

        clock.advance(Duration.ofSeconds(20));
        assertThat(scheduler.tick()).isEqualTo(1);
        JobSnapshot job = scheduler.listJobs().get(0);
        assertThat(job.getState()).isEqualTo(JobState.IDLE);
        assertThat(job.getLastError()).isEqualTo("IllegalStateException: first run fails");
        assertThat(job.getFailureCount()).isEqualTo(1);
    }

    @Test
    void jobIsNotRunBeforeItIsDue() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.schedule("job", IntervalSpec.every(Duration.ofSeconds(60)), runs::incrementAndGet);

        clock.advance(Duration.ofSeconds(59));

        assertThat(scheduler.tick()).isZero();
        assertThat(runs).hasValue(0);
    }

    @Test
    void rejectsDuplicateNames() {
        scheduler.schedule("job", IntervalSpec.parse("1m"), () -> { });

        assertThatThrownBy(() -> scheduler.schedule("job", IntervalSpec.parse("5m"), () -> { }))
                .isInstanceOf(DuplicateJobException.class);
    }

    @Test
    void unscheduleIsIdempotent() {
        scheduler.schedule("job", IntervalSpec.parse("1m"), () -> { });

        assertThat(scheduler.unschedule("job")).isTrue();
        assertThat(scheduler.unschedule("job")).isFalse();
        assertThat(scheduler.listJobs()).isEmpty();
    }

    @Test
    void runNowMakesJobDueOnNextTick() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.schedule("job", IntervalSpec.parse("hourly"), runs::incrementAndGet);

        scheduler.runNow("job");
        scheduler.tick();

        assertThat(runs).hasValue(1);
        assertThatThrownBy(() -> scheduler.runNow("missing")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void stopRequestedMidTickSkipsRemainingJobs() {
        AtomicInteger secondRuns = new AtomicInteger();
        scheduler.schedule("first", IntervalSpec.every(Duration.ofSeconds(5)), scheduler::stop);
        scheduler.schedule("second", IntervalSpec.every(Duration.ofSeconds(5)), secondRuns::incrementAndGet);
        clock.advance(Duration.ofSeconds(5));

        assertThat(scheduler.tick()).isEqualTo(1);
        assertThat(secondRuns).hasValue(0);
        assertThat(scheduler.listJobs()).extracting(JobSnapshot::getState)
                .containsOnly(JobState.IDLE);

        clock.advance(Duration.ofSeconds(5));
        assertThat(scheduler.tick()).isZero();
    }

    @Test
    void startAndStopDrivePeriodicTask() {
        TaskScheduler taskScheduler = mock(TaskScheduler.class);
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofSeconds(1)));

        MaintenanceScheduler periodic = new MaintenanceScheduler(taskScheduler, Duration.ofSeconds(1), clock,
                meterRegistry);
        periodic.start();
        assertThat(periodic.isRunning()).isTrue();

        periodic.stop();

        verify(future).cancel(false);
        assertThat(periodic.isRunning()).isFalse();
    }
}
