package com.company.adaptive.scheduled;

import com.company.adaptive.config.AdaptiveRuntimeProperties;
import com.company.adaptive.domain.ResourceSnapshot;
import com.company.adaptive.domain.enums.HealthState;
import com.company.adaptive.dto.response.HealthReport;
import com.company.adaptive.service.HealthAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Samples host resources and logs the resulting health classification.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HealthSnapshotJob implements MaintenanceJob {

    public static final String NAME = "health-snapshot";

    private final HealthAggregator healthAggregator;
    private final AdaptiveRuntimeProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public IntervalSpec intervalSpec() {
        return IntervalSpec.every(properties.getScheduler().getHealthSnapshotInterval());
    }

    @Override
    public void run() {
        ResourceSnapshot snapshot = healthAggregator.snapshotResources();
        HealthReport report = healthAggregator.status();

        if (report.getStatus() == HealthState.HEALTHY) {
            log.debug("Health snapshot: healthy (cpu={}%, memory={}%, disk={}%)",
                    snapshot.getCpuPercent(), snapshot.getMemoryPercent(), snapshot.getDiskPercent());
        } else {
            log.warn("Health check warning: {} - {}", report.getStatus(), report.getIssues());
        }
    }
}
