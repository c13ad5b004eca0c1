package com.company.adaptive.service;

import com.company.adaptive.config.AdaptiveRuntimeProperties;
import com.company.adaptive.domain.ResourceSnapshot;
import com.company.adaptive.domain.ScalingRecommendation;
import com.company.adaptive.domain.VolumeSignal;
import com.company.adaptive.domain.enums.ScalingDirection;
import com.company.adaptive.dto.response.HealthReport;
import com.company.adaptive.exception.ConfigurationException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a health report and a volume signal into a scaling recommendation.
 *
 * <p>Stateless: the same inputs always give the same direction, confidence and reasons.
 * Scale up needs resource pressure at or above the soft ceiling together with rising
 * volume. Scale down needs low resource usage and every bucket of a fully observed
 * volume window below the low-volume rate. Anything else holds.
 */
public class ScalingAdvisor {

    public static final String INCREASE_WORKERS = "increase_workers";
    public static final String INCREASE_MEMORY_LIMIT = "increase_memory_limit";
    public static final String DECREASE_WORKERS = "decrease_workers";
    public static final String NO_ACTION = "none";

    private final double resourceSoftPercent;
    private final double scaleDownResourcePercent;
    private final double risingRatio;
    private final double lowVolumeRatePerMinute;
    private final Clock clock;

    public ScalingAdvisor(AdaptiveRuntimeProperties.Scaling settings, double resourceSoftPercent, Clock clock) {
        if (settings.getRisingRatio() <= 1.0) {
            throw new ConfigurationException("Scaling rising ratio must be above 1.0");
        }
        if (settings.getScaleDownResourcePercent() >= resourceSoftPercent) {
            throw new ConfigurationException("Scale-down resource level must be below the soft resource ceiling");
        }
        if (settings.getLowVolumeRatePerMinute() <= 0) {
            throw new ConfigurationException("Low-volume rate must be positive");
        }
        this.resourceSoftPercent = resourceSoftPercent;
        this.scaleDownResourcePercent = settings.getScaleDownResourcePercent();
        this.risingRatio = settings.getRisingRatio();
        this.lowVolumeRatePerMinute = settings.getLowVolumeRatePerMinute();
        this.clock = clock;
    }

    public ScalingRecommendation recommend(HealthReport health, VolumeSignal volume) {
        ResourceSnapshot resources = health == null ? null : health.getResources();
        if (resources == null || volume == null) {
            return build(ScalingDirection.HOLD, 0.0,
                    List.of("No resource snapshot or volume signal available yet"), NO_ACTION);
        }

        double peak = resources.peakPercent();
        List<String> reasons = new ArrayList<>();

        if (peak >= resourceSoftPercent && isRising(volume)) {
            reasons.add(String.format(Locale.ROOT, "%s usage at %.1f%% (soft ceiling %.1f%%)",
                    dominantResource(resources), peak, resourceSoftPercent));
            reasons.add(String.format(Locale.ROOT, "Volume rising: %.2f/min vs %.2f/min", volume.getRecentRate(),
                    volume.getPreviousRate()));
            double resourceDistance = clamp((peak - resourceSoftPercent) / (100.0 - resourceSoftPercent));
            double volumeDistance = volume.getPreviousRate() == 0.0 ? 1.0
                    : clamp((volume.getRecentRate() / volume.getPreviousRate() - risingRatio) / risingRatio);
            String action = "memory".equals(dominantResource(resources)) ? INCREASE_MEMORY_LIMIT : INCREASE_WORKERS;
            return build(ScalingDirection.SCALE_UP, (resourceDistance + volumeDistance) / 2, reasons, action);
        }

        if (peak < scaleDownResourcePercent && volume.isWindowComplete() && allBucketsLow(volume)) {
            reasons.add(String.format(Locale.ROOT, "Peak resource usage %.1f%% below %.1f%%", peak, scaleDownResourcePercent));
            reasons.add(String.format(Locale.ROOT, "Volume at most %.2f/min across the window (threshold %.2f/min)",
                    volume.peakBucketRate(), lowVolumeRatePerMinute));
            double resourceDistance = clamp((scaleDownResourcePercent - peak) / scaleDownResourcePercent);
            double volumeDistance = clamp((lowVolumeRatePerMinute - volume.peakBucketRate()) / lowVolumeRatePerMinute);
            return build(ScalingDirection.SCALE_DOWN, (resourceDistance + volumeDistance) / 2, reasons,
                    DECREASE_WORKERS);
        }

        if (peak >= resourceSoftPercent) {
            reasons.add(String.format(Locale.ROOT, "Resource pressure at %.1f%% but volume is not rising", peak));
        } else if (peak < scaleDownResourcePercent) {
            reasons.add(volume.isWindowComplete()
                    ? "Resources idle but volume is not consistently low"
                    : "Resources idle but the volume window has not been observed in full");
        } else {
            reasons.add(String.format(Locale.ROOT, "Peak resource usage %.1f%% within normal range", peak));
        }
        double holdConfidence = clamp(Math.abs(resourceSoftPercent - peak) / resourceSoftPercent);
        return build(ScalingDirection.HOLD, holdConfidence, reasons, NO_ACTION);
    }

    private boolean isRising(VolumeSignal volume) {
        if (volume.getRecentRate() <= 0.0) {
            return false;
        }
        return volume.getPreviousRate() == 0.0 || volume.getRecentRate() >= volume.getPreviousRate() * risingRatio;
    }

    private boolean allBucketsLow(VolumeSignal volume) {
        return volume.getBucketRates() != null
                && volume.getBucketRates().stream().allMatch(rate -> rate < lowVolumeRatePerMinute);
    }

    private static String dominantResource(ResourceSnapshot resources) {
        double cpu = resources.getCpuPercent();
        double memory = resources.getMemoryPercent();
        double disk = resources.getDiskPercent();
        if (memory >= cpu && memory >= disk) {
            return "memory";
        }
        return cpu >= disk ? "CPU" : "disk";
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private ScalingRecommendation build(ScalingDirection direction, double confidence, List<String> reasons,
                                        String action) {
        return ScalingRecommendation.builder()
                .direction(direction)
                .confidence(confidence)
                .reasons(List.copyOf(reasons))
                .suggestedAction(action)
                .computedAt(clock.instant())
                .build();
    }
}
