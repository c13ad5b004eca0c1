package com.company.adaptive.domain.enums;

public enum HealthState {
    HEALTHY(0),
    DEGRADED(1),
    UNHEALTHY(2);

    private final int level;

    HealthState(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    public boolean isWorseThan(HealthState other) {
        return this.level > other.level;
    }

    public static HealthState worst(HealthState a, HealthState b) {
        return a.isWorseThan(b) ? a : b;
    }
}
