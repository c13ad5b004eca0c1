package com.company.adaptive.scheduled;

import com.company.adaptive.cache.ResultCache;
import com.company.adaptive.config.AdaptiveRuntimeProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Active expiry sweep over the result cache.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CacheCleanupJob implements MaintenanceJob {

    public static final String NAME = "cache-cleanup";

    private final ResultCache resultCache;
    private final AdaptiveRuntimeProperties properties;
    private final MeterRegistry meterRegistry;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public IntervalSpec intervalSpec() {
        return IntervalSpec.every(properties.getScheduler().getCacheCleanupInterval());
    }

    @Override
    public void run() {
        Timer.Sample sample = Timer.start(meterRegistry);
        int removed = resultCache.cleanup();
        sample.stop(meterRegistry.timer("adaptive.cache.cleanup.duration"));

        if (removed > 0) {
            log.info("Cache cleanup completed: {} expired entries removed, {} remaining",
                    removed, resultCache.size());
        } else {
            log.debug("Cache cleanup found no expired entries");
        }
    }
}
