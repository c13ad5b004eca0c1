package com.company.adaptive.dto.response;

import com.company.adaptive.domain.ResourceSnapshot;
import com.company.adaptive.domain.enums.HealthState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Consistent point-in-time view of the health aggregator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthReport {
    private HealthState status;
    private List<String> issues;

    // recent window
    private int windowSeconds;
    private Map<String, Long> windowOperations;
    private long windowTotal;
    private long windowErrors;
    private double errorRate;
    private double averageLatencyMs;
    private long maxLatencyMs;

    // since start
    private Map<String, Long> lifetimeOperations;
    private long lifetimeErrors;

    private ResourceSnapshot resources;
    private boolean backendAvailable;
    private long uptimeSeconds;
    private String uptimeHuman;
    private String lastError;
    private Instant lastErrorAt;
    private Instant timestamp;
}
