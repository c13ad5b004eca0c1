package com.company.adaptive.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceSnapshot {
    private double cpuPercent;
    private double memoryPercent;
    private double diskPercent;
    private double memoryAvailableMb;
    private Instant sampledAt;

    public double peakPercent() {
        return Math.max(cpuPercent, Math.max(memoryPercent, diskPercent));
    }
}
