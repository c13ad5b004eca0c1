package com.company.adaptive.domain.enums;

public enum Severity {
    INFO(1, "Informational - worth a look"),
    WARNING(2, "Warning - likely inefficiency"),
    CRITICAL(3, "Critical - immediate action required");

    private final int level;
    private final String description;

    Severity(int level, String description) {
        this.level = level;
        this.description = description;
    }

    public int getLevel() {
        return level;
    }

    public String getDescription() {
        return description;
    }

    public boolean isHigherThan(Severity other) {
        return this.level > other.level;
    }
}
