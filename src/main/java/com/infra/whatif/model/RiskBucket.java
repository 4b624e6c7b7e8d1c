package com.infra.whatif.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The three independent safety dimensions. Declaration order is the reporting order
 * for failed buckets.
 */
public enum RiskBucket {
    DRIFT,
    INTENT,
    OPERATIONS;

    /** Value reported as the highest risk bucket when no bucket failed. */
    public static final String NONE = "none";

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
