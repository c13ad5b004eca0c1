package com.company.adaptive.config;

import com.company.adaptive.exception.ConfigurationException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * All tunables of the adaptive runtime, bound from {@code adaptive.*}.
 * Heuristic thresholds (smells, scaling) carry sane defaults rather than derived values.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "adaptive")
public class AdaptiveRuntimeProperties {

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Trail trail = new Trail();

    @Valid
    private Smells smells = new Smells();

    @Valid
    private Health health = new Health();

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Watchdog watchdog = new Watchdog();

    @Valid
    private Scaling scaling = new Scaling();

    @Valid
    private Store store = new Store();

    @Data
    public static class Cache {
        @Positive
        private int maxEntries = 1000;

        @Positive
        private long defaultTtlSeconds = 3600;
    }

    @Data
    public static class Trail {
        @Positive
        private double reinforcementAmount = 0.1;

        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private double decayFactor = 0.9;

        @Positive
        private double pruneFloor = 0.01;

        @Positive
        private double weightCeiling = 1.0;

        @NotNull
        private Duration decayInterval = Duration.ofMinutes(10);

        @Min(1)
        private long smellVolumeThreshold = 50;

        @NotNull
        private Duration thrashingInterval = Duration.ofSeconds(2);

        @Positive
        private int volumeBucketSeconds = 60;

        @Min(2)
        private int volumeWindowBuckets = 10;
    }

    @Data
    public static class Smells {
        @Positive
        private int maxQueryResults = 100;

        @Positive
        private int maxBatchSize = 1000;

        @Positive
        private int maxFilterLength = 500;

        @Positive
        private int historySize = 1000;
    }

    @Data
    public static class Health {
        @Positive
        private int windowSeconds = 300;

        @Positive
        private int bucketSeconds = 10;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double errorRateSoft = 0.10;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double errorRateHard = 0.50;

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double resourceSoftPercent = 80.0;

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double resourceHardPercent = 95.0;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;

        @NotNull
        private Duration tickInterval = Duration.ofSeconds(1);

        @NotNull
        private Duration healthSnapshotInterval = Duration.ofMinutes(5);

        @NotNull
        private Duration cacheCleanupInterval = Duration.ofHours(1);
    }

    @Data
    public static class Watchdog {
        private boolean enabled = true;

        @NotNull
        private Duration checkInterval = Duration.ofSeconds(30);

        @Min(0)
        private int maxReconnectAttempts = 3;
    }

    @Data
    public static class Scaling {
        @DecimalMin(value = "1.0", inclusive = false)
        private double risingRatio = 1.2;

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double scaleDownResourcePercent = 30.0;

        @Positive
        private double lowVolumeRatePerMinute = 5.0;

        @Positive
        private int historySize = 100;
    }

    @Data
    public static class Store {
        /**
         * Directory whose presence signals a live persistent backend. Unset means the
         * store is purely in-memory and always reachable.
         */
        private String persistDirectory;
    }

    /**
     * Cross-field checks that annotations cannot express.
     */
    public void validate() {
        requirePositive("adaptive.trail.decay-interval", trail.getDecayInterval());
        requirePositive("adaptive.trail.thrashing-interval", trail.getThrashingInterval());
        requirePositive("adaptive.scheduler.tick-interval", scheduler.getTickInterval());
        requirePositive("adaptive.scheduler.health-snapshot-interval", scheduler.getHealthSnapshotInterval());
        requirePositive("adaptive.scheduler.cache-cleanup-interval", scheduler.getCacheCleanupInterval());
        requirePositive("adaptive.watchdog.check-interval", watchdog.getCheckInterval());

        if (trail.getPruneFloor() >= trail.getWeightCeiling()) {
            throw new ConfigurationException("adaptive.trail.prune-floor (" + trail.getPruneFloor()
                    + ") must be below weight-ceiling (" + trail.getWeightCeiling() + ")");
        }
        if (health.getErrorRateSoft() > health.getErrorRateHard()) {
            throw new ConfigurationException("adaptive.health.error-rate-soft must not exceed error-rate-hard");
        }
        if (health.getResourceSoftPercent() > health.getResourceHardPercent()) {
            throw new ConfigurationException(
                    "adaptive.health.resource-soft-percent must not exceed resource-hard-percent");
        }
        if (health.getWindowSeconds() < health.getBucketSeconds()) {
            throw new ConfigurationException("adaptive.health.window-seconds must cover at least one bucket");
        }
        if (scaling.getScaleDownResourcePercent() >= health.getResourceSoftPercent()) {
            throw new ConfigurationException(
                    "adaptive.scaling.scale-down-resource-percent must be below the soft resource ceiling");
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ConfigurationException(name + " must be a positive duration, got " + value);
        }
    }
}
