package com.company.adaptive.service;

import com.company.adaptive.config.AdaptiveRuntimeProperties;
import com.company.adaptive.domain.PatternSignature;
import com.company.adaptive.domain.SmellFinding;
import com.company.adaptive.domain.Trail;
import com.company.adaptive.domain.VolumeSignal;
import com.company.adaptive.domain.enums.Severity;
import com.company.adaptive.domain.enums.SmellType;
import com.company.adaptive.dto.response.HotTrail;
import com.company.adaptive.dto.response.ScopeSummary;
import com.company.adaptive.exception.ConfigurationException;
import com.company.adaptive.exception.InvalidRequestException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Learns which operation patterns are "hot" per scope.
 *
 * <p>Each observation adds a fixed amount of weight to the pattern's trail, capped at a
 * ceiling. {@link #decay()} multiplies every weight by the decay factor once per elapsed
 * decay interval (at least once per call) and prunes trails that fall below the floor,
 * which keeps memory bounded to patterns still in use.
 *
 * <p>A ring of per-bucket reinforcement counts across all scopes backs the volume signal
 * consumed by the scaling advisor.
 */
@Slf4j
public class TrailTracker {

    private static final Comparator<Trail> HOTTEST_FIRST = Comparator
            .comparingDouble(Trail::getWeight).reversed()
            .thenComparing(Comparator.comparingLong(Trail::getHitCount).reversed())
            .thenComparing(Trail::getLastReinforcedAt, Comparator.reverseOrder());

    private final double reinforcementAmount;
    private final double decayFactor;
    private final double pruneFloor;
    private final double weightCeiling;
    private final Duration decayInterval;
    private final long smellVolumeThreshold;
    private final Duration thrashingInterval;
    private final int volumeBucketSeconds;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<TrailKey, Trail> trails = new HashMap<>();

    private final long[] volumeCounts;
    private final long[] volumeBucketIds;
    private final long firstVolumeBucket;
    private long totalReinforcements;

    public TrailTracker(AdaptiveRuntimeProperties.Trail settings, Clock clock) {
        if (settings.getReinforcementAmount() <= 0) {
            throw new ConfigurationException("Trail reinforcement amount must be positive");
        }
        if (settings.getDecayFactor() <= 0 || settings.getDecayFactor() >= 1) {
            throw new ConfigurationException("Trail decay factor must be in (0, 1), got " + settings.getDecayFactor());
        }
        if (settings.getPruneFloor() <= 0 || settings.getPruneFloor() >= settings.getWeightCeiling()) {
            throw new ConfigurationException("Trail prune floor must be in (0, weightCeiling)");
        }
        if (settings.getDecayInterval() == null || settings.getDecayInterval().isZero()
                || settings.getDecayInterval().isNegative()) {
            throw new ConfigurationException("Trail decay interval must be positive");
        }
        if (settings.getVolumeBucketSeconds() <= 0 || settings.getVolumeWindowBuckets() < 2) {
            throw new ConfigurationException("Trail volume window needs a positive bucket width and at least 2 buckets");
        }
        this.reinforcementAmount = settings.getReinforcementAmount();
        this.decayFactor = settings.getDecayFactor();
        this.pruneFloor = settings.getPruneFloor();
        this.weightCeiling = settings.getWeightCeiling();
        this.decayInterval = settings.getDecayInterval();
        this.smellVolumeThreshold = settings.getSmellVolumeThreshold();
        this.thrashingInterval = settings.getThrashingInterval();
        this.volumeBucketSeconds = settings.getVolumeBucketSeconds();
        this.clock = clock;

        this.volumeCounts = new long[settings.getVolumeWindowBuckets()];
        this.volumeBucketIds = new long[settings.getVolumeWindowBuckets()];
        Arrays.fill(volumeBucketIds, -1L);
        this.firstVolumeBucket = bucketId(clock.instant());
    }

    public void reinforce(String scope, PatternSignature pattern) {
        requireScope(scope);
        if (pattern == null) {
            throw new InvalidRequestException("Pattern signature is required");
        }
        Instant now = clock.instant();
        TrailKey key = new TrailKey(scope, pattern.value());

        lock.lock();
        try {
            Trail trail = trails.computeIfAbsent(key, k -> Trail.builder()
                    .scope(scope)
                    .pattern(pattern.value())
                    .operationKind(pattern.getKind())
                    .collection(pattern.getCollection())
                    .firstSeenAt(now)
                    .build());
            trail.setWeight(Math.min(weightCeiling, trail.getWeight() + reinforcementAmount));
            trail.setHitCount(trail.getHitCount() + 1);
            trail.setLastReinforcedAt(now);
            countVolume(now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies one decay sweep.
     *
     * @return number of trails pruned
     */
    public int decay() {
        Instant now = clock.instant();
        lock.lock();
        try {
            int pruned = 0;
            Iterator<Trail> it = trails.values().iterator();
            while (it.hasNext()) {
                Trail trail = it.next();
                long cycles = elapsedCycles(trail, now);
                trail.setWeight(trail.getWeight() * Math.pow(decayFactor, cycles));
                trail.setLastDecayedAt(now);
                if (trail.getWeight() < pruneFloor) {
                    it.remove();
                    pruned++;
                }
            }
            log.debug("Trail decay sweep: {} pruned, {} remaining", pruned, trails.size());
            return pruned;
        } finally {
            lock.unlock();
        }
    }

    public List<HotTrail> hotTrails(String scope, int limit) {
        requireScope(scope);
        if (limit <= 0) {
            throw new InvalidRequestException("Hot trail limit must be positive, got " + limit);
        }
        lock.lock();
        try {
            return trails.values().stream()
                    .filter(t -> t.getScope().equals(scope))
                    .sorted(HOTTEST_FIRST)
                    .limit(limit)
                    .map(t -> HotTrail.builder()
                            .pattern(t.getPattern())
                            .weight(t.getWeight())
                            .hitCount(t.getHitCount())
                            .lastReinforcedAt(t.getLastReinforcedAt())
                            .build())
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Flags patterns hit more than the volume threshold whose mean interval between
     * reinforcements is below the thrashing interval. A heuristic: it points at
     * repeated identical work that a cache or a reshaped query would absorb.
     */
    public List<SmellFinding> detectSmells(String scope) {
        requireScope(scope);
        Instant now = clock.instant();
        lock.lock();
        try {
            List<SmellFinding> findings = new ArrayList<>();
            trails.values().stream()
                    .filter(t -> t.getScope().equals(scope))
                    .filter(t -> t.getHitCount() > smellVolumeThreshold)
                    .sorted(HOTTEST_FIRST)
                    .forEach(t -> {
                        Duration interval = t.averageInterval();
                        if (interval != null && interval.compareTo(thrashingInterval) < 0) {
                            findings.add(SmellFinding.builder()
                                    .type(SmellType.THRASHING)
                                    .severity(Severity.WARNING)
                                    .scope(scope)
                                    .pattern(t.getPattern())
                                    .operationKind(t.getOperationKind())
                                    .collection(t.getCollection())
                                    .description(String.format(Locale.ROOT, "%d hits, one every %d ms on average",
                                            t.getHitCount(), interval.toMillis()))
                                    .suggestion(SmellType.THRASHING.getSuggestion())
                                    .detectedAt(now)
                                    .build());
                        }
                    });
            return findings;
        } finally {
            lock.unlock();
        }
    }

    public VolumeSignal volumeSignal() {
        Instant now = clock.instant();
        lock.lock();
        try {
            long current = bucketId(now);
            int n = volumeCounts.length;
            List<Double> rates = new ArrayList<>(n);
            for (long id = current - n + 1; id <= current; id++) {
                int slot = slotOf(id);
                long count = volumeBucketIds[slot] == id ? volumeCounts[slot] : 0L;
                rates.add(count * 60.0 / volumeBucketSeconds);
            }
            int half = n / 2;
            double previous = mean(rates.subList(0, n - half));
            double recent = mean(rates.subList(n - half, n));
            return VolumeSignal.builder()
                    .recentRate(recent)
                    .previousRate(previous)
                    .bucketRates(List.copyOf(rates))
                    .windowComplete(current - firstVolumeBucket + 1 >= n)
                    .totalReinforcements(totalReinforcements)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public ScopeSummary scopeSummary(String scope) {
        requireScope(scope);
        lock.lock();
        try {
            Map<String, Long> byOperation = new TreeMap<>();
            Map<String, Long> byCollection = new TreeMap<>();
            long totalHits = 0;
            int count = 0;
            for (Trail trail : trails.values()) {
                if (!trail.getScope().equals(scope)) {
                    continue;
                }
                count++;
                totalHits += trail.getHitCount();
                byOperation.merge(trail.getOperationKind().tagValue(), trail.getHitCount(), Long::sum);
                byCollection.merge(trail.getCollection(), trail.getHitCount(), Long::sum);
            }
            return ScopeSummary.builder()
                    .scope(scope)
                    .activeTrails(count)
                    .totalHits(totalHits)
                    .hitsByOperation(byOperation)
                    .hitsByCollection(byCollection)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public Optional<Trail> find(String scope, PatternSignature pattern) {
        lock.lock();
        try {
            Trail trail = trails.get(new TrailKey(scope, pattern.value()));
            return Optional.ofNullable(trail).map(t -> t.toBuilder().build());
        } finally {
            lock.unlock();
        }
    }

    public int activeTrailCount() {
        lock.lock();
        try {
            return trails.size();
        } finally {
            lock.unlock();
        }
    }

    private long elapsedCycles(Trail trail, Instant now) {
        Instant since = trail.getLastReinforcedAt();
        if (trail.getLastDecayedAt() != null && trail.getLastDecayedAt().isAfter(since)) {
            since = trail.getLastDecayedAt();
        }
        long elapsedMillis = Duration.between(since, now).toMillis();
        return Math.max(1L, elapsedMillis / decayInterval.toMillis());
    }

    // caller holds the lock
    private void countVolume(Instant now) {
        long id = bucketId(now);
        int slot = slotOf(id);
        if (volumeBucketIds[slot] != id) {
            volumeBucketIds[slot] = id;
            volumeCounts[slot] = 0;
        }
        volumeCounts[slot]++;
        totalReinforcements++;
    }

    private long bucketId(Instant instant) {
        return Math.floorDiv(instant.getEpochSecond(), volumeBucketSeconds);
    }

    private int slotOf(long bucketId) {
        return (int) Math.floorMod(bucketId, (long) volumeCounts.length);
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static void requireScope(String scope) {
        if (scope == null || scope.isBlank()) {
            throw new InvalidRequestException("Scope must not be blank");
        }
    }

    private record TrailKey(String scope, String pattern) {
    }
}
