package com.company.adaptive.config;

import com.company.adaptive.cache.ResultCache;
import com.company.adaptive.repository.DocumentStore;
import com.company.adaptive.scheduled.BackendWatchdog;
import com.company.adaptive.scheduled.MaintenanceJob;
import com.company.adaptive.scheduled.MaintenanceScheduler;
import com.company.adaptive.service.HealthAggregator;
import com.company.adaptive.service.HostResourceProbe;
import com.company.adaptive.service.ResourceProbe;
import com.company.adaptive.service.ScalingAdvisor;
import com.company.adaptive.service.TrailTracker;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Builds the core components once, each wired explicitly with its settings.
 */
@Configuration
@EnableConfigurationProperties(AdaptiveRuntimeProperties.class)
@Slf4j
public class AdaptiveRuntimeConfig {

    private final AdaptiveRuntimeProperties properties;

    public AdaptiveRuntimeConfig(AdaptiveRuntimeProperties properties) {
        properties.validate();
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResultCache resultCache(Clock clock) {
        AdaptiveRuntimeProperties.Cache cache = properties.getCache();
        return new ResultCache(cache.getMaxEntries(), Duration.ofSeconds(cache.getDefaultTtlSeconds()), clock);
    }

    @Bean
    public TrailTracker trailTracker(Clock clock) {
        return new TrailTracker(properties.getTrail(), clock);
    }

    @Bean
    public ResourceProbe resourceProbe(Clock clock) {
        return new HostResourceProbe(clock);
    }

    @Bean
    public HealthAggregator healthAggregator(ResourceProbe resourceProbe, Clock clock) {
        return new HealthAggregator(properties.getHealth(), resourceProbe, clock);
    }

    @Bean
    public ScalingAdvisor scalingAdvisor(Clock clock) {
        return new ScalingAdvisor(properties.getScaling(), properties.getHealth().getResourceSoftPercent(), clock);
    }

    /**
     * Two threads: one for the maintenance tick, one for the watchdog.
     */
    @Bean
    public ThreadPoolTaskScheduler adaptiveTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("adaptive-maint-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(10);
        return scheduler;
    }

    @Bean(destroyMethod = "stop")
    public MaintenanceScheduler maintenanceScheduler(ThreadPoolTaskScheduler adaptiveTaskScheduler,
                                                     List<MaintenanceJob> jobs,
                                                     Clock clock,
                                                     MeterRegistry meterRegistry) {
        MaintenanceScheduler scheduler = new MaintenanceScheduler(adaptiveTaskScheduler,
                properties.getScheduler().getTickInterval(), clock, meterRegistry);
        jobs.forEach(job -> scheduler.schedule(job.name(), job.intervalSpec(), job));

        if (properties.getScheduler().isEnabled()) {
            scheduler.start();
        } else {
            log.info("Maintenance scheduler disabled; {} jobs registered but not ticking", jobs.size());
        }
        return scheduler;
    }

    @Bean(destroyMethod = "stop")
    public BackendWatchdog backendWatchdog(DocumentStore documentStore,
                                           HealthAggregator healthAggregator,
                                           ThreadPoolTaskScheduler adaptiveTaskScheduler,
                                           MeterRegistry meterRegistry) {
        AdaptiveRuntimeProperties.Watchdog settings = properties.getWatchdog();
        BackendWatchdog watchdog = new BackendWatchdog(documentStore, healthAggregator, adaptiveTaskScheduler,
                settings.getCheckInterval(), settings.getMaxReconnectAttempts(), meterRegistry);
        if (settings.isEnabled()) {
            watchdog.start();
        }
        return watchdog;
    }
}
