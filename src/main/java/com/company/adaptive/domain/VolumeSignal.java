package com.company.adaptive.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Reinforcement volume across all scopes. Rates are reinforcements per minute;
 * {@code bucketRates} runs oldest to newest.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VolumeSignal {
    private double recentRate;
    private double previousRate;
    private List<Double> bucketRates;
    private boolean windowComplete;
    private long totalReinforcements;

    public double peakBucketRate() {
        return bucketRates == null ? 0.0
                : bucketRates.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }
}
