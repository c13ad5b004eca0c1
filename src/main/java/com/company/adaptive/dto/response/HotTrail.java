package com.company.adaptive.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HotTrail {
    private String pattern;
    private double weight;
    private long hitCount;
    private Instant lastReinforcedAt;
}
