package com.company.adaptive.service;

import com.company.adaptive.config.AdaptiveRuntimeProperties;
import com.company.adaptive.domain.ResourceSnapshot;
import com.company.adaptive.domain.enums.HealthState;
import com.company.adaptive.domain.enums.OperationKind;
import com.company.adaptive.dto.response.HealthReport;
import com.company.adaptive.exception.ConfigurationException;
import com.company.adaptive.exception.InvalidRequestException;
import com.company.adaptive.util.TimeUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rolling-window operation counters plus the latest host resource snapshot.
 *
 * <p>Operations land in fixed-width time buckets arranged in a ring covering the health
 * window; buckets older than the window are reset on reuse, so counters roll off by age.
 * {@link #status()} classifies with inclusive thresholds: a value exactly at a ceiling
 * counts as having reached it.
 */
@Slf4j
public class HealthAggregator {

    private final int windowSeconds;
    private final int bucketSeconds;
    private final double errorRateSoft;
    private final double errorRateHard;
    private final double resourceSoft;
    private final double resourceHard;
    private final ResourceProbe resourceProbe;
    private final Clock clock;
    private final Instant startedAt;

    private final ReentrantLock lock = new ReentrantLock();
    private final Bucket[] buckets;
    private final Map<OperationKind, Long> lifetimeOperations = new EnumMap<>(OperationKind.class);
    private long lifetimeErrors;
    private ResourceSnapshot resources;
    private String lastError;
    private Instant lastErrorAt;
    private String backendFailure;

    public HealthAggregator(AdaptiveRuntimeProperties.Health settings, ResourceProbe resourceProbe, Clock clock) {
        if (settings.getBucketSeconds() <= 0 || settings.getWindowSeconds() < settings.getBucketSeconds()) {
            throw new ConfigurationException("Health window must cover at least one positive-width bucket");
        }
        if (settings.getErrorRateSoft() > settings.getErrorRateHard()) {
            throw new ConfigurationException("Soft error-rate threshold exceeds the hard threshold");
        }
        if (settings.getResourceSoftPercent() > settings.getResourceHardPercent()) {
            throw new ConfigurationException("Soft resource threshold exceeds the hard threshold");
        }
        this.windowSeconds = settings.getWindowSeconds();
        this.bucketSeconds = settings.getBucketSeconds();
        this.errorRateSoft = settings.getErrorRateSoft();
        this.errorRateHard = settings.getErrorRateHard();
        this.resourceSoft = settings.getResourceSoftPercent();
        this.resourceHard = settings.getResourceHardPercent();
        this.resourceProbe = resourceProbe;
        this.clock = clock;
        this.startedAt = clock.instant();

        int count = (windowSeconds + bucketSeconds - 1) / bucketSeconds;
        this.buckets = new Bucket[count];
        for (int i = 0; i < count; i++) {
            buckets[i] = new Bucket();
        }
    }

    public void record(OperationKind kind, long durationMs, boolean success) {
        if (kind == null) {
            throw new InvalidRequestException("Operation kind is required");
        }
        if (durationMs < 0) {
            throw new InvalidRequestException("Duration must not be negative, got " + durationMs);
        }
        long id = bucketId(clock.instant());

        lock.lock();
        try {
            Bucket bucket = bucketFor(id);
            bucket.operations[kind.ordinal()]++;
            bucket.latencySumMs += durationMs;
            bucket.latencyMaxMs = Math.max(bucket.latencyMaxMs, durationMs);
            lifetimeOperations.merge(kind, 1L, Long::sum);
            if (!success) {
                bucket.errors++;
                lifetimeErrors++;
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordError(String message) {
        Instant now = clock.instant();
        lock.lock();
        try {
            lastError = message;
            lastErrorAt = now;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Samples host resources. The probe runs outside the lock.
     */
    public ResourceSnapshot snapshotResources() {
        ResourceSnapshot snapshot = resourceProbe.sample();
        lock.lock();
        try {
            resources = snapshot;
        } finally {
            lock.unlock();
        }
        log.debug("Resource snapshot: cpu={}%, memory={}%, disk={}%",
                snapshot.getCpuPercent(), snapshot.getMemoryPercent(), snapshot.getDiskPercent());
        return snapshot;
    }

    public boolean hasResourceSnapshot() {
        lock.lock();
        try {
            return resources != null;
        } finally {
            lock.unlock();
        }
    }

    public void reportBackendFailure(String reason) {
        lock.lock();
        try {
            backendFailure = reason;
        } finally {
            lock.unlock();
        }
    }

    public void reportBackendRecovered() {
        lock.lock();
        try {
            backendFailure = null;
        } finally {
            lock.unlock();
        }
    }

    public HealthReport status() {
        Instant now = clock.instant();
        long current = bucketId(now);

        lock.lock();
        try {
            long[] operations = new long[OperationKind.values().length];
            long errors = 0;
            long latencySum = 0;
            long latencyMax = 0;
            for (Bucket bucket : buckets) {
                if (bucket.id <= current - buckets.length || bucket.id > current) {
                    continue;
                }
                for (int i = 0; i < operations.length; i++) {
                    operations[i] += bucket.operations[i];
                }
                errors += bucket.errors;
                latencySum += bucket.latencySumMs;
                latencyMax = Math.max(latencyMax, bucket.latencyMaxMs);
            }

            long total = 0;
            Map<String, Long> windowOps = new LinkedHashMap<>();
            for (OperationKind kind : OperationKind.values()) {
                windowOps.put(kind.tagValue(), operations[kind.ordinal()]);
                total += operations[kind.ordinal()];
            }
            double errorRate = total == 0 ? 0.0 : (double) errors / total;

            List<String> issues = new ArrayList<>();
            HealthState state = classifyErrors(total, errorRate, issues);
            if (resources != null) {
                state = HealthState.worst(state, classifyResource("CPU", resources.getCpuPercent(), issues));
                state = HealthState.worst(state, classifyResource("memory", resources.getMemoryPercent(), issues));
                state = HealthState.worst(state, classifyResource("disk", resources.getDiskPercent(), issues));
            }
            if (backendFailure != null) {
                issues.add("Backing store unavailable: " + backendFailure);
                state = HealthState.UNHEALTHY;
            }

            Map<String, Long> lifetime = new LinkedHashMap<>();
            for (OperationKind kind : OperationKind.values()) {
                lifetime.put(kind.tagValue(), lifetimeOperations.getOrDefault(kind, 0L));
            }

            long uptime = Duration.between(startedAt, now).getSeconds();
            return HealthReport.builder()
                    .status(state)
                    .issues(List.copyOf(issues))
                    .windowSeconds(windowSeconds)
                    .windowOperations(windowOps)
                    .windowTotal(total)
                    .windowErrors(errors)
                    .errorRate(errorRate)
                    .averageLatencyMs(total == 0 ? 0.0 : (double) latencySum / total)
                    .maxLatencyMs(latencyMax)
                    .lifetimeOperations(lifetime)
                    .lifetimeErrors(lifetimeErrors)
                    .resources(resources)
                    .backendAvailable(backendFailure == null)
                    .uptimeSeconds(uptime)
                    .uptimeHuman(TimeUtils.formatUptime(uptime))
                    .lastError(lastError)
                    .lastErrorAt(lastErrorAt)
                    .timestamp(now)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public long uptimeSeconds() {
        return Duration.between(startedAt, clock.instant()).getSeconds();
    }

    public double getResourceSoftPercent() {
        return resourceSoft;
    }

    public double getResourceHardPercent() {
        return resourceHard;
    }

    private HealthState classifyErrors(long total, double errorRate, List<String> issues) {
        if (total == 0) {
            return HealthState.HEALTHY;
        }
        if (errorRate >= errorRateHard) {
            issues.add(String.format(Locale.ROOT, "Critical error rate: %.2f%%", errorRate * 100));
            return HealthState.UNHEALTHY;
        }
        if (errorRate >= errorRateSoft) {
            issues.add(String.format(Locale.ROOT, "High error rate: %.2f%%", errorRate * 100));
            return HealthState.DEGRADED;
        }
        return HealthState.HEALTHY;
    }

    private HealthState classifyResource(String name, double percent, List<String> issues) {
        if (percent >= resourceHard) {
            issues.add(String.format(Locale.ROOT, "Critical %s usage: %.1f%%", name, percent));
            return HealthState.UNHEALTHY;
        }
        if (percent >= resourceSoft) {
            issues.add(String.format(Locale.ROOT, "High %s usage: %.1f%%", name, percent));
            return HealthState.DEGRADED;
        }
        return HealthState.HEALTHY;
    }

    // caller holds the lock
    private Bucket bucketFor(long id) {
        Bucket bucket = buckets[(int) Math.floorMod(id, (long) buckets.length)];
        if (bucket.id != id) {
            bucket.reset(id);
        }
        return bucket;
    }

    private long bucketId(Instant instant) {
        return Math.floorDiv(instant.getEpochSecond(), bucketSeconds);
    }

    private static final class Bucket {
        private long id = Long.MIN_VALUE;
        private final long[] operations = new long[OperationKind.values().length];
        private long errors;
        private long latencySumMs;
        private long latencyMaxMs;

        private void reset(long newId) {
            id = newId;
            Arrays.fill(operations, 0L);
            errors = 0;
            latencySumMs = 0;
            latencyMaxMs = 0;
        }
    }
}
