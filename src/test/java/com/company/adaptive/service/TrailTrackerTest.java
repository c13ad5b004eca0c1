package com.company.adaptive.service;

import com.company.adaptive.config.AdaptiveRuntimeProperties;
import com.company.adaptive.domain.PatternSignature;
import com.company.adaptive.domain.SmellFinding;
import com.company.adaptive.domain.Trail;
import com.company.adaptive.domain.VolumeSignal;
import com.company.adaptive.domain.enums.OperationKind;
import com.company.adaptive.domain.enums.SmellType;
import com.company.adaptive.dto.request.StoreRequest;
import com.company.adaptive.dto.response.HotTrail;
import com.company.adaptive.dto.response.ScopeSummary;
import com.company.adaptive.exception.ConfigurationException;
import com.company.adaptive.exception.InvalidRequestException;
import com.company.adaptive.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TrailTrackerTest {

    private static final PatternSignature BY_AUTHOR = PatternSignature.of(OperationKind.QUERY, "articles",
            StoreRequest.builder().where(Map.of("author", "ada")).build());
    private static final PatternSignature BY_IDS = PatternSignature.of(OperationKind.QUERY, "articles",
            StoreRequest.builder().ids(List.of("1")).build());
    private static final PatternSignature INSERT = PatternSignature.of(OperationKind.INSERT, "notes",
            StoreRequest.builder().build());

    private MutableClock clock;
    private AdaptiveRuntimeProperties.Trail settings;
    private TrailTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        settings = new AdaptiveRuntimeProperties.Trail();
        tracker = new TrailTracker(settings, clock);
    }

    @Test
    void reinforcementIsClampedToCeiling() {
        for (int i = 0; i < 25; i++) {
            tracker.reinforce("s", BY_AUTHOR);
        }

        Trail trail = tracker.find("s", BY_AUTHOR).orElseThrow();
        assertThat(trail.getWeight()).isEqualTo(1.0);
        assertThat(trail.getHitCount()).isEqualTo(25);
    }

    @Test
    void decayAppliesFactorPerCycle() {
        for (int i = 0; i < 5; i++) {
            tracker.reinforce("s", BY_AUTHOR);
        }
        double initial = tracker.find("s", BY_AUTHOR).orElseThrow().getWeight();

        int cycles = 4;
        for (int i = 0; i < cycles; i++) {
            clock.advance(settings.getDecayInterval());
            tracker.decay();
        }

        assertThat(tracker.find("s", BY_AUTHOR).orElseThrow().getWeight())
                .isCloseTo(initial * Math.pow(0.9, cycles), within(1e-9));
    }

    @Test
    void oneCallCoversEveryElapsedInterval() {
        for (int i = 0; i < 5; i++) {
            tracker.reinforce("s", BY_AUTHOR);
        }

        clock.advance(settings.getDecayInterval().multipliedBy(3));
        tracker.decay();

        assertThat(tracker.find("s", BY_AUTHOR).orElseThrow().getWeight())
                .isCloseTo(0.5 * Math.pow(0.9, 3), within(1e-9));
    }

    @Test
    void trailIsPrunedOnceBelowFloor() {
        tracker.reinforce("s", BY_AUTHOR);

        // 0.1 * 0.9^n < 0.01 first holds at n = 22
        int pruned = 0;
        for (int i = 0; i < 21; i++) {
            pruned += tracker.decay();
        }
        assertThat(pruned).isZero();
        assertThat(tracker.find("s", BY_AUTHOR)).isPresent();

        assertThat(tracker.decay()).isEqualTo(1);
        assertThat(tracker.find("s", BY_AUTHOR)).isEmpty();
        assertThat(tracker.activeTrailCount()).isZero();
    }

    @Test
    void hotTrailsOrderByWeightThenHitsThenRecency() {
        // both clamp to 1.0; BY_IDS gets more hits
        for (int i = 0; i < 12; i++) {
            tracker.reinforce("s", BY_AUTHOR);
        }
        for (int i = 0; i < 15; i++) {
            tracker.reinforce("s", BY_IDS);
        }
        tracker.reinforce("s", INSERT);
        tracker.reinforce("other", INSERT);

        List<HotTrail> hot = tracker.hotTrails("s", 10);

        assertThat(hot).extracting(HotTrail::getPattern)
                .containsExactly(BY_IDS.value(), BY_AUTHOR.value(), INSERT.value());
        assertThat(tracker.hotTrails("s", 1)).hasSize(1);
    }

    @Test
    void equalWeightAndHitsPreferMostRecentlyReinforced() {
        tracker.reinforce("s", BY_AUTHOR);
        clock.advance(Duration.ofSeconds(1));
        tracker.reinforce("s", BY_IDS);

        assertThat(tracker.hotTrails("s", 2)).extracting(HotTrail::getPattern)
                .containsExactly(BY_IDS.value(), BY_AUTHOR.value());
    }

    @Test
    void flagsThrashingPatterns() {
        for (int i = 0; i < 60; i++) {
            tracker.reinforce("s", BY_AUTHOR);
            clock.advance(Duration.ofMillis(100));
        }
        for (int i = 0; i < 60; i++) {
            tracker.reinforce("s", BY_IDS);
            clock.advance(Duration.ofSeconds(5));
        }

        List<SmellFinding> smells = tracker.detectSmells("s");

        assertThat(smells).hasSize(1);
        assertThat(smells.get(0).getType()).isEqualTo(SmellType.THRASHING);
        assertThat(smells.get(0).getPattern()).isEqualTo(BY_AUTHOR.value());
    }

    @Test
    void volumeThresholdIsExclusive() {
        for (int i = 0; i < 50; i++) {
            tracker.reinforce("s", BY_AUTHOR);
        }
        assertThat(tracker.detectSmells("s")).isEmpty();

        tracker.reinforce("s", BY_AUTHOR);
        assertThat(tracker.detectSmells("s")).hasSize(1);
    }

    @Test
    void volumeSignalComparesHalves() {
        // 10 buckets of 60s; old half quiet, recent half busy
        for (int bucket = 0; bucket < 10; bucket++) {
            int hits = bucket < 5 ? 1 : 4;
            for (int i = 0; i < hits; i++) {
                tracker.reinforce("s", BY_AUTHOR);
            }
            if (bucket < 9) {
                clock.advance(Duration.ofSeconds(60));
            }
        }

        VolumeSignal signal = tracker.volumeSignal();

        assertThat(signal.isWindowComplete()).isTrue();
        assertThat(signal.getPreviousRate()).isCloseTo(1.0, within(1e-9));
        assertThat(signal.getRecentRate()).isCloseTo(4.0, within(1e-9));
        assertThat(signal.getBucketRates()).hasSize(10);
        assertThat(signal.getTotalReinforcements()).isEqualTo(25);
    }

    @Test
    void volumeWindowIsIncompleteAtStartup() {
        tracker.reinforce("s", BY_AUTHOR);
        assertThat(tracker.volumeSignal().isWindowComplete()).isFalse();
    }

    @Test
    void scopeSummaryGroupsHits() {
        tracker.reinforce("s", BY_AUTHOR);
        tracker.reinforce("s", BY_AUTHOR);
        tracker.reinforce("s", INSERT);

        ScopeSummary summary = tracker.scopeSummary("s");

        assertThat(summary.getActiveTrails()).isEqualTo(2);
        assertThat(summary.getTotalHits()).isEqualTo(3);
        assertThat(summary.getHitsByOperation()).containsEntry("query", 2L).containsEntry("insert", 1L);
        assertThat(summary.getHitsByCollection()).containsEntry("articles", 2L).containsEntry("notes", 1L);
    }

    @Test
    void rejectsInvalidInputAndConfiguration() {
        assertThatThrownBy(() -> tracker.hotTrails("s", 0)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> tracker.reinforce("", BY_AUTHOR)).isInstanceOf(InvalidRequestException.class);

        AdaptiveRuntimeProperties.Trail bad = new AdaptiveRuntimeProperties.Trail();
        bad.setDecayFactor(1.0);
        assertThatThrownBy(() -> new TrailTracker(bad, clock)).isInstanceOf(ConfigurationException.class);
    }
}
