package com.infra.whatif.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Classifier's estimate of whether a change is a genuine effect or tool-generated noise.
 */
public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW,
    NOISE;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** High and medium confidence changes take part in risk evaluation. */
    public boolean isIncluded() {
        return this == HIGH || this == MEDIUM;
    }

    public static ConfidenceLevel parse(String value) {
        if (value == null || value.isBlank()) return null;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ConfidenceLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        return null;
    }
}
