package com.company.adaptive.scheduled;

import com.company.adaptive.domain.ScheduledJob;
import com.company.adaptive.domain.enums.JobState;
import com.company.adaptive.dto.response.JobSnapshot;
import com.company.adaptive.exception.DuplicateJobException;
import com.company.adaptive.exception.InvalidRequestException;
import com.company.adaptive.exception.JobExecutionException;
import com.company.adaptive.exception.JobNotFoundException;
import com.company.adaptive.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs named maintenance jobs from a single cooperative tick loop.
 *
 * <p>Each {@link #tick()} collects the jobs whose {@code nextRunAt} has been reached and
 * runs them one after another. The job table lock is never held while an action runs.
 * A failing action, including one that throws an {@link Error}, is recorded on its job
 * and logged; it neither aborts the loop nor unschedules the job, and the next run time
 * is computed the same way as after a success. The job then rests in
 * {@link JobState#FAILED} until it is next due.
 *
 * <p>{@link #stop()} is a one-shot signal: the periodic task is cancelled without
 * interrupting, and a tick already in progress finishes its current job and skips
 * the rest.
 */
@Slf4j
public class MaintenanceScheduler {

    private final TaskScheduler taskScheduler;
    private final Duration tickInterval;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ScheduledJob> jobs = new LinkedHashMap<>();
    private final AtomicBoolean ticking = new AtomicBoolean(false);

    private volatile boolean stopRequested;
    private ScheduledFuture<?> tickTask;

    public MaintenanceScheduler(TaskScheduler taskScheduler, Duration tickInterval,
                                Clock clock, MeterRegistry meterRegistry) {
        this.taskScheduler = taskScheduler;
        this.tickInterval = tickInterval;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public JobSnapshot schedule(String name, IntervalSpec intervalSpec, Runnable action) {
        if (name == null || name.isBlank()) {
            throw new InvalidRequestException("Job name must not be blank");
        }
        if (intervalSpec == null || action == null) {
            throw new InvalidRequestException("Job " + name + " needs an interval spec and an action");
        }
        Instant now = clock.instant();

        lock.lock();
        try {
            if (jobs.containsKey(name)) {
                throw new DuplicateJobException(name);
            }
            ScheduledJob job = ScheduledJob.builder()
                    .name(name)
                    .intervalSpec(intervalSpec)
                    .action(action)
                    .nextRunAt(intervalSpec.firstRunAt(now, clock.getZone()))
                    .build();
            jobs.put(name, job);
            log.info("Scheduled job {} ({}), first run at {}", name, intervalSpec, job.getNextRunAt());
            return toSnapshot(job);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a job. No-op when it is not scheduled.
     *
     * @return true if a job was removed
     */
    public boolean unschedule(String name) {
        lock.lock();
        try {
            boolean removed = jobs.remove(name) != null;
            if (removed) {
                log.info("Unscheduled job {}", name);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Makes a job due immediately; it runs on the next tick.
     */
    public JobSnapshot runNow(String name) {
        Instant now = clock.instant();
        lock.lock();
        try {
            ScheduledJob job = jobs.get(name);
            if (job == null) {
                throw new JobNotFoundException(name);
            }
            job.setNextRunAt(now);
            return toSnapshot(job);
        } finally {
            lock.unlock();
        }
    }

    public List<JobSnapshot> listJobs() {
        lock.lock();
        try {
            return jobs.values().stream().map(MaintenanceScheduler::toSnapshot).toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs every job that is due now.
     *
     * @return number of jobs executed
     */
    public int tick() {
        if (stopRequested || !ticking.compareAndSet(false, true)) {
            return 0;
        }
        List<ScheduledJob> due = List.of();
        try {
            due = collectDueJobs(clock.instant());
            int executed = 0;
            for (ScheduledJob job : due) {
                if (stopRequested) {
                    log.info("Scheduler stop requested, {} due job(s) left for later", due.size() - executed);
                    break;
                }
                execute(job);
                executed++;
            }
            return executed;
        } finally {
            releaseUnstarted(due);
            ticking.set(false);
        }
    }

    public synchronized void start() {
        if (tickTask != null) {
            return;
        }
        if (taskScheduler == null) {
            throw new IllegalStateException("No task scheduler configured; drive the scheduler with tick()");
        }
        stopRequested = false;
        tickTask = taskScheduler.scheduleAtFixedRate(this::safeTick, tickInterval);
        log.info("Maintenance scheduler started (tick every {}, {} jobs)", tickInterval, listJobs().size());
    }

    public synchronized void stop() {
        stopRequested = true;
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
            log.info("Maintenance scheduler stopped");
        }
    }

    public synchronized boolean isRunning() {
        return tickTask != null && !stopRequested;
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            // an exception escaping here would cancel the periodic task
            log.error("Maintenance tick failed", e);
        }
    }

    private List<ScheduledJob> collectDueJobs(Instant now) {
        lock.lock();
        try {
            List<ScheduledJob> due = new ArrayList<>();
            for (ScheduledJob job : jobs.values()) {
                boolean resting = job.getState() == JobState.IDLE || job.getState() == JobState.FAILED;
                if (resting && job.getNextRunAt() != null
                        && !now.isBefore(job.getNextRunAt())) {
                    job.setState(JobState.DUE);
                    due.add(job);
                }
            }
            return due;
        } finally {
            lock.unlock();
        }
    }

    private void execute(ScheduledJob job) {
        Instant scheduledAt;
        lock.lock();
        try {
            if (jobs.get(job.getName()) != job) {
                // unscheduled while waiting its turn
                return;
            }
            job.setState(JobState.RUNNING);
            scheduledAt = job.getNextRunAt();
        } finally {
            lock.unlock();
        }

        Instant startedAt = clock.instant();
        Throwable failure = null;
        try {
            job.getAction().run();
        } catch (Throwable t) {
            failure = t;
        }
        Instant finishedAt = clock.instant();

        lock.lock();
        try {
            job.setLastRunAt(startedAt);
            job.setRunCount(job.getRunCount() + 1);
            if (failure != null) {
                job.setLastError(failure.getClass().getSimpleName() + ": " + failure.getMessage());
                job.setLastErrorAt(finishedAt);
                job.setFailureCount(job.getFailureCount() + 1);
            }
            job.setNextRunAt(job.getIntervalSpec().nextRunAt(scheduledAt, finishedAt, clock.getZone()));
            job.setState(failure == null ? JobState.IDLE : JobState.FAILED);
        } finally {
            lock.unlock();
        }

        String outcome = failure == null ? "success" : "failure";
        meterRegistry.counter("adaptive.scheduler.job.runs", "job", job.getName(), "outcome", outcome).increment();
        if (failure != null) {
            log.error("Maintenance job {} failed, next run at {}", job.getName(), job.getNextRunAt(),
                    new JobExecutionException(job.getName(), failure));
        } else {
            log.debug("Maintenance job {} completed in {}, next run at {}", job.getName(),
                    TimeUtils.formatDuration(Duration.between(startedAt, finishedAt)), job.getNextRunAt());
        }
    }

    // returns jobs still marked DUE to the state they rested in before this tick
    private void releaseUnstarted(List<ScheduledJob> pending) {
        if (pending.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            for (ScheduledJob job : pending) {
                if (job.getState() == JobState.DUE || job.getState() == JobState.RUNNING) {
                    job.setState(lastRunFailed(job) ? JobState.FAILED : JobState.IDLE);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private static boolean lastRunFailed(ScheduledJob job) {
        return job.getLastErrorAt() != null && job.getLastRunAt() != null
                && !job.getLastErrorAt().isBefore(job.getLastRunAt());
    }

    private static JobSnapshot toSnapshot(ScheduledJob job) {
        return JobSnapshot.builder()
                .name(job.getName())
                .intervalSpec(job.getIntervalSpec().toString())
                .state(job.getState())
                .nextRunAt(job.getNextRunAt())
                .lastRunAt(job.getLastRunAt())
                .lastError(job.getLastError())
                .lastErrorAt(job.getLastErrorAt())
                .runCount(job.getRunCount())
                .failureCount(job.getFailureCount())
                .build();
    }
}
