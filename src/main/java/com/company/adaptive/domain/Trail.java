package com.company.adaptive.domain;

import com.company.adaptive.domain.enums.OperationKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Reinforcement state of one (scope, pattern signature) pair.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Trail {
    private String scope;
    private String pattern;
    private OperationKind operationKind;
    private String collection;
    private double weight;
    private long hitCount;
    private Instant firstSeenAt;
    private Instant lastReinforcedAt;
    private Instant lastDecayedAt;

    /**
     * Mean time between reinforcements, or null with fewer than two hits.
     */
    public Duration averageInterval() {
        if (hitCount < 2) {
            return null;
        }
        Duration span = Duration.between(firstSeenAt, lastReinforcedAt);
        return span.dividedBy(hitCount - 1);
    }
}
