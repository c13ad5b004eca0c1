package com.company.adaptive.service;

import com.company.adaptive.config.AdaptiveRuntimeProperties;
import com.company.adaptive.domain.ResourceSnapshot;
import com.company.adaptive.domain.enums.HealthState;
import com.company.adaptive.domain.enums.OperationKind;
import com.company.adaptive.dto.response.HealthReport;
import com.company.adaptive.exception.ConfigurationException;
import com.company.adaptive.exception.InvalidRequestException;
import com.company.adaptive.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HealthAggregatorTest {

    private MutableClock clock;
    private ResourceSnapshot nextSample;
    private HealthAggregator aggregator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        nextSample = resources(10, 20, 30);
        aggregator = new HealthAggregator(new AdaptiveRuntimeProperties.Health(), () -> nextSample, clock);
    }

    @Test
    void emptyWindowIsHealthy() {
        HealthReport report = aggregator.status();

        assertThat(report.getStatus()).isEqualTo(HealthState.HEALTHY);
        assertThat(report.getErrorRate()).isZero();
        assertThat(report.getIssues()).isEmpty();
    }

    @Test
    void errorRateAtSoftThresholdIsDegraded() {
        recordBatch(10, 1);
        assertThat(aggregator.status().getStatus()).isEqualTo(HealthState.DEGRADED);
    }

    @Test
    void errorRateJustBelowSoftThresholdIsHealthy() {
        recordBatch(11, 1);
        assertThat(aggregator.status().getStatus()).isEqualTo(HealthState.HEALTHY);
    }

    @Test
    void errorRateAtHardThresholdIsUnhealthy() {
        recordBatch(10, 5);

        HealthReport report = aggregator.status();
        assertThat(report.getStatus()).isEqualTo(HealthState.UNHEALTHY);
        assertThat(report.getIssues()).singleElement().asString().startsWith("Critical error rate");
    }

    @Test
    void errorRateJustBelowHardThresholdIsDegraded() {
        recordBatch(10, 4);
        assertThat(aggregator.status().getStatus()).isEqualTo(HealthState.DEGRADED);
    }

    @Test
    void resourceThresholdsAreInclusive() {
        nextSample = resources(80, 10, 10);
        aggregator.snapshotResources();
        assertThat(aggregator.status().getStatus()).isEqualTo(HealthState.DEGRADED);

        nextSample = resources(10, 95, 10);
        aggregator.snapshotResources();
        HealthReport report = aggregator.status();
        assertThat(report.getStatus()).isEqualTo(HealthState.UNHEALTHY);
        assertThat(report.getIssues()).containsExactly("Critical memory usage: 95.0%");

        nextSample = resources(79.9, 10, 94.9);
        aggregator.snapshotResources();
        assertThat(aggregator.status().getStatus()).isEqualTo(HealthState.DEGRADED);
    }

    @Test
    void countersRollOffTheWindow() {
        recordBatch(10, 6);

        clock.advance(Duration.ofSeconds(290));
        assertThat(aggregator.status().getWindowTotal()).isEqualTo(10);

        clock.advance(Duration.ofSeconds(10));
        HealthReport report = aggregator.status();
        assertThat(report.getWindowTotal()).isZero();
        assertThat(report.getStatus()).isEqualTo(HealthState.HEALTHY);
        assertThat(report.getLifetimeErrors()).isEqualTo(6);
        assertThat(report.getLifetimeOperations()).containsEntry("query", 10L);
    }

    @Test
    void reportsLatencyAndLastError() {
        aggregator.record(OperationKind.QUERY, 10, true);
        aggregator.record(OperationKind.INSERT, 30, false);
        aggregator.recordError("insert on notes failed: boom");

        HealthReport report = aggregator.status();

        assertThat(report.getAverageLatencyMs()).isEqualTo(20.0);
        assertThat(report.getMaxLatencyMs()).isEqualTo(30);
        assertThat(report.getWindowOperations()).containsEntry("query", 1L).containsEntry("insert", 1L);
        assertThat(report.getLastError()).isEqualTo("insert on notes failed: boom");
        assertThat(report.getLastErrorAt()).isEqualTo(clock.instant());
    }

    @Test
    void backendFailureIsUnhealthyUntilRecovered() {
        aggregator.reportBackendFailure("unreachable after 3 reconnect attempts");

        HealthReport report = aggregator.status();
        assertThat(report.getStatus()).isEqualTo(HealthState.UNHEALTHY);
        assertThat(report.isBackendAvailable()).isFalse();

        aggregator.reportBackendRecovered();
        assertThat(aggregator.status().getStatus()).isEqualTo(HealthState.HEALTHY);
    }

    @Test
    void uptimeFollowsClock() {
        clock.advance(Duration.ofSeconds(3725));

        assertThat(aggregator.uptimeSeconds()).isEqualTo(3725);
        assertThat(aggregator.status().getUptimeHuman()).isEqualTo("1h 2m 5s");
    }

    @Test
    void rejectsInvalidInput() {
        assertThatThrownBy(() -> aggregator.record(OperationKind.QUERY, -1, true))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> aggregator.record(null, 1, true))
                .isInstanceOf(InvalidRequestException.class);

        AdaptiveRuntimeProperties.Health bad = new AdaptiveRuntimeProperties.Health();
        bad.setErrorRateSoft(0.6);
        assertThatThrownBy(() -> new HealthAggregator(bad, () -> nextSample, clock))
                .isInstanceOf(ConfigurationException.class);
    }

    private void recordBatch(int total, int failures) {
        for (int i = 0; i < total; i++) {
            aggregator.record(OperationKind.QUERY, 5, i >= failures);
        }
    }

    private ResourceSnapshot resources(double cpu, double memory, double disk) {
        return ResourceSnapshot.builder()
                .cpuPercent(cpu)
                .memoryPercent(memory)
                .diskPercent(disk)
                .sampledAt(clock.instant())
                .build();
    }
}
