package com.company.adaptive.domain;

import com.company.adaptive.domain.enums.ScalingDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Derived on every request from the latest health and volume snapshots.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScalingRecommendation {
    private ScalingDirection direction;
    private double confidence;
    private List<String> reasons;
    private String suggestedAction;
    private Instant computedAt;
}
