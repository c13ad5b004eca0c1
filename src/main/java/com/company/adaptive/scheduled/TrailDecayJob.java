package com.company.adaptive.scheduled;

import com.company.adaptive.config.AdaptiveRuntimeProperties;
import com.company.adaptive.service.TrailTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class TrailDecayJob implements MaintenanceJob {

    public static final String NAME = "trail-decay";

    private final TrailTracker trailTracker;
    private final AdaptiveRuntimeProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public IntervalSpec intervalSpec() {
        return IntervalSpec.every(properties.getTrail().getDecayInterval());
    }

    @Override
    public void run() {
        int pruned = trailTracker.decay();
        if (pruned > 0) {
            log.info("Trail decay pruned {} trails, {} active", pruned, trailTracker.activeTrailCount());
        }
    }
}
