package com.infra.whatif.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordered risk scale shared by buckets and thresholds. Declaration order is the
 * comparison index: LOW=0, MEDIUM=1, HIGH=2.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    public int index() {
        return ordinal();
    }

    /**
     * Inclusive threshold rule: a level equal to the threshold blocks.
     */
    public boolean meetsOrExceeds(RiskLevel threshold) {
        return index() >= threshold.index();
    }

    public static RiskLevel max(RiskLevel a, RiskLevel b) {
        return a.index() >= b.index() ? a : b;
    }

    /**
     * Case-insensitive lookup with no trimming. Returns null for blank or unrecognized values so callers
     * can decide how to default.
     */
    public static RiskLevel parse(String value) {
        if (value == null || value.isBlank()) return null;
        String normalized = value.toUpperCase(Locale.ROOT);
        for (RiskLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        return null;
    }

    @JsonCreator
    public static RiskLevel fromJson(String value) {
        RiskLevel level = parse(value);
        if (level == null) {
            throw new IllegalArgumentException("Invalid risk level: " + value + " (expected low, medium or high)");
        }
        return level;
    }
}
