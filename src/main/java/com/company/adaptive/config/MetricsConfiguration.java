package com.company.adaptive.config;

import com.company.adaptive.cache.ResultCache;
import com.company.adaptive.scheduled.MaintenanceScheduler;
import com.company.adaptive.service.TrailTracker;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Gauges over the runtime's in-memory stores
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final ResultCache resultCache;
    private final TrailTracker trailTracker;
    private final MaintenanceScheduler maintenanceScheduler;

    @Bean
    public MeterBinder adaptiveRuntimeMetrics() {
        return (reg) -> {
            Gauge.builder("adaptive.cache.entries", resultCache, ResultCache::size)
                    .description("Entries held by the result cache, expired ones included until swept")
                    .register(reg);

            Gauge.builder("adaptive.trails.active", trailTracker, TrailTracker::activeTrailCount)
                    .description("Trails above the prune floor")
                    .register(reg);

            Gauge.builder("adaptive.scheduler.jobs", maintenanceScheduler, s -> s.listJobs().size())
                    .description("Scheduled maintenance jobs")
                    .register(reg);

            log.info("Adaptive runtime metrics registered");
        };
    }
}
