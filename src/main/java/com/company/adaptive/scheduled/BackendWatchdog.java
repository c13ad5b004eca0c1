package com.company.adaptive.scheduled;

import com.company.adaptive.repository.DocumentStore;
import com.company.adaptive.service.HealthAggregator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Watches backing-store liveness on its own timer, independent of the job table.
 *
 * <p>An unreachable store gets up to {@code maxReconnectAttempts} consecutive reconnect
 * attempts. After that the failure is escalated to the health aggregator, which then
 * reports unhealthy, and the watchdog only keeps probing until the store comes back.
 * Reconnects always run outside the lock.
 */
@Slf4j
public class BackendWatchdog {

    private final DocumentStore documentStore;
    private final HealthAggregator healthAggregator;
    private final TaskScheduler taskScheduler;
    private final Duration checkInterval;
    private final int maxReconnectAttempts;
    private final MeterRegistry meterRegistry;

    private final ReentrantLock lock = new ReentrantLock();
    private int consecutiveFailures;
    private int reconnectAttempts;
    private boolean escalated;

    private volatile boolean stopRequested;
    private ScheduledFuture<?> probeTask;

    public BackendWatchdog(DocumentStore documentStore, HealthAggregator healthAggregator,
                           TaskScheduler taskScheduler, Duration checkInterval, int maxReconnectAttempts,
                           MeterRegistry meterRegistry) {
        this.documentStore = documentStore;
        this.healthAggregator = healthAggregator;
        this.taskScheduler = taskScheduler;
        this.checkInterval = checkInterval;
        this.maxReconnectAttempts = maxReconnectAttempts;
        this.meterRegistry = meterRegistry;
    }

    /**
     * One liveness check, with a reconnect or an escalation when the store is down.
     */
    public void probe() {
        if (stopRequested) {
            return;
        }
        if (isReachable()) {
            markRecovered();
            return;
        }

        boolean attemptReconnect;
        boolean escalateNow = false;
        int attempt;
        lock.lock();
        try {
            consecutiveFailures++;
            attemptReconnect = reconnectAttempts < maxReconnectAttempts;
            if (attemptReconnect) {
                reconnectAttempts++;
            } else if (!escalated) {
                escalated = true;
                escalateNow = true;
            }
            attempt = reconnectAttempts;
        } finally {
            lock.unlock();
        }

        if (attemptReconnect) {
            reconnect(attempt);
        } else if (escalateNow) {
            String reason = "unreachable after " + maxReconnectAttempts + " reconnect attempts";
            healthAggregator.reportBackendFailure(reason);
            meterRegistry.counter("adaptive.watchdog.escalations").increment();
            log.error("Backing store {}; reporting unhealthy until it recovers", reason);
        }
    }

    public synchronized void start() {
        if (probeTask != null) {
            return;
        }
        stopRequested = false;
        probeTask = taskScheduler.scheduleAtFixedRate(this::safeProbe, checkInterval);
        log.info("Backend watchdog started (check every {}, {} reconnect attempts)",
                checkInterval, maxReconnectAttempts);
    }

    public synchronized void stop() {
        stopRequested = true;
        if (probeTask != null) {
            probeTask.cancel(false);
            probeTask = null;
            log.info("Backend watchdog stopped");
        }
    }

    public synchronized boolean isRunning() {
        return probeTask != null && !stopRequested;
    }

    public int getConsecutiveFailures() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    public boolean isEscalated() {
        lock.lock();
        try {
            return escalated;
        } finally {
            lock.unlock();
        }
    }

    private void reconnect(int attempt) {
        meterRegistry.counter("adaptive.watchdog.reconnects").increment();
        log.warn("Backing store unreachable, reconnect attempt {}/{}", attempt, maxReconnectAttempts);
        try {
            documentStore.reconnect();
        } catch (Exception e) {
            log.warn("Reconnect attempt {} failed: {}", attempt, e.getMessage());
            return;
        }
        if (isReachable()) {
            markRecovered();
        }
    }

    private void markRecovered() {
        boolean wasEscalated;
        int failures;
        lock.lock();
        try {
            wasEscalated = escalated;
            failures = consecutiveFailures;
            consecutiveFailures = 0;
            reconnectAttempts = 0;
            escalated = false;
        } finally {
            lock.unlock();
        }
        if (wasEscalated) {
            healthAggregator.reportBackendRecovered();
        }
        if (failures > 0) {
            log.info("Backing store reachable again after {} failed check(s)", failures);
        }
    }

    private boolean isReachable() {
        try {
            return documentStore.isReachable();
        } catch (Exception e) {
            log.warn("Liveness check failed: {}", e.getMessage());
            return false;
        }
    }

    private void safeProbe() {
        try {
            probe();
        } catch (Exception e) {
            log.error("Watchdog probe failed", e);
        }
    }
}
