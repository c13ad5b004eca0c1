package com.company.adaptive.service;

import com.company.adaptive.cache.ResultCache;
import com.company.adaptive.config.AdaptiveRuntimeProperties;
import com.company.adaptive.domain.PatternSignature;
import com.company.adaptive.domain.ScalingRecommendation;
import com.company.adaptive.domain.enums.OperationKind;
import com.company.adaptive.dto.response.CacheStatsResponse;
import com.company.adaptive.dto.response.HealthReport;
import com.company.adaptive.dto.response.HotTrail;
import com.company.adaptive.dto.response.JobSnapshot;
import com.company.adaptive.dto.response.ScopeSummary;
import com.company.adaptive.dto.response.SmellReport;
import com.company.adaptive.exception.InvalidRequestException;
import com.company.adaptive.scheduled.IntervalSpec;
import com.company.adaptive.scheduled.MaintenanceScheduler;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single entry point to the adaptive runtime: cache, trails, health, scheduling and
 * scaling advice. Callers never reach the individual components directly.
 */
@Service
@Slf4j
public class AdaptiveRuntimeService {

    private final ResultCache resultCache;
    private final TrailTracker trailTracker;
    private final HealthAggregator healthAggregator;
    private final ScalingAdvisor scalingAdvisor;
    private final MaintenanceScheduler maintenanceScheduler;
    private final SmellMonitor smellMonitor;
    private final MeterRegistry meterRegistry;
    private final int scalingHistorySize;

    private final ReentrantLock historyLock = new ReentrantLock();
    private final Deque<ScalingRecommendation> scalingHistory = new ArrayDeque<>();

    public AdaptiveRuntimeService(ResultCache resultCache,
                                  TrailTracker trailTracker,
                                  HealthAggregator healthAggregator,
                                  ScalingAdvisor scalingAdvisor,
                                  MaintenanceScheduler maintenanceScheduler,
                                  SmellMonitor smellMonitor,
                                  MeterRegistry meterRegistry,
                                  AdaptiveRuntimeProperties properties) {
        this.resultCache = resultCache;
        this.trailTracker = trailTracker;
        this.healthAggregator = healthAggregator;
        this.scalingAdvisor = scalingAdvisor;
        this.maintenanceScheduler = maintenanceScheduler;
        this.smellMonitor = smellMonitor;
        this.meterRegistry = meterRegistry;
        this.scalingHistorySize = properties.getScaling().getHistorySize();
    }

    /**
     * Returns the cached value for {@code key}, or computes, caches and returns it.
     * No lock is held while {@code compute} runs, so two concurrent misses may both
     * compute; the last write wins. A value whose scope was invalidated while it was
     * being computed is returned but not cached. Failures and null results are not cached.
     *
     * @param ttl entry lifetime, null for the configured default
     */
    @SuppressWarnings("unchecked")
    public <T> T cacheLookupOrCompute(String scope, String key, Duration ttl, Supplier<T> compute) {
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new InvalidRequestException("TTL must be positive, got " + ttl);
        }
        Optional<Object> cached = resultCache.get(scope, key);
        if (cached.isPresent()) {
            meterRegistry.counter("adaptive.cache.lookups", "result", "hit").increment();
            return (T) cached.get();
        }
        meterRegistry.counter("adaptive.cache.lookups", "result", "miss").increment();

        long generation = resultCache.generation(scope);
        T value = compute.get();
        if (value != null) {
            resultCache.setIfCurrent(scope, key, value, ttl, generation);
        }
        return value;
    }

    public void recordOperation(String scope, OperationKind kind, long durationMs, boolean success,
                                PatternSignature pattern) {
        healthAggregator.record(kind, durationMs, success);
        if (pattern != null) {
            trailTracker.reinforce(scope, pattern);
        }
    }

    /**
     * Keeps the message of the latest failure for the health report.
     */
    public void reportError(String message) {
        healthAggregator.recordError(message);
    }

    public HealthReport getHealth() {
        if (!healthAggregator.hasResourceSnapshot()) {
            healthAggregator.snapshotResources();
        }
        return healthAggregator.status();
    }

    public List<HotTrail> getHotTrails(String scope, int limit) {
        return trailTracker.hotTrails(scope, limit);
    }

    public SmellReport getSmells(String scope) {
        return smellMonitor.report(scope, trailTracker.detectSmells(scope));
    }

    public ScopeSummary getScopeSummary(String scope) {
        return trailTracker.scopeSummary(scope);
    }

    /**
     * Computes a fresh recommendation from the current health and volume snapshots.
     * The result is appended to a bounded history but never served from it.
     */
    public ScalingRecommendation getScalingRecommendation() {
        ScalingRecommendation recommendation = scalingAdvisor.recommend(getHealth(), trailTracker.volumeSignal());

        historyLock.lock();
        try {
            scalingHistory.addLast(recommendation);
            while (scalingHistory.size() > scalingHistorySize) {
                scalingHistory.removeFirst();
            }
        } finally {
            historyLock.unlock();
        }
        log.debug("Scaling recommendation: {} (confidence {})",
                recommendation.getDirection(), recommendation.getConfidence());
        return recommendation;
    }

    /**
     * Issued recommendations, oldest first.
     */
    public List<ScalingRecommendation> getScalingHistory() {
        historyLock.lock();
        try {
            return List.copyOf(scalingHistory);
        } finally {
            historyLock.unlock();
        }
    }

    public JobSnapshot scheduleJob(String name, String intervalSpec, Runnable action) {
        return scheduleJob(name, IntervalSpec.parse(intervalSpec), action);
    }

    public JobSnapshot scheduleJob(String name, IntervalSpec intervalSpec, Runnable action) {
        return maintenanceScheduler.schedule(name, intervalSpec, action);
    }

    public boolean unscheduleJob(String name) {
        return maintenanceScheduler.unschedule(name);
    }

    public List<JobSnapshot> listJobs() {
        return maintenanceScheduler.listJobs();
    }

    public JobSnapshot triggerJob(String name) {
        return maintenanceScheduler.runNow(name);
    }

    public CacheStatsResponse getCacheStats(String scope) {
        return resultCache.stats(scope);
    }

    /**
     * Drops one entry when {@code key} is given, otherwise the whole scope.
     *
     * @return number of entries removed
     */
    public int invalidateCache(String scope, String key) {
        if (scope == null || scope.isBlank()) {
            throw new InvalidRequestException("Scope must not be blank");
        }
        if (key != null && !key.isBlank()) {
            return resultCache.invalidate(scope, key) ? 1 : 0;
        }
        int removed = resultCache.invalidateScope(scope);
        log.debug("Invalidated {} cache entries in scope {}", removed, scope);
        return removed;
    }
}
