package com.trendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Anomaly severity bucket, derived from the z-score. */
public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static Severity fromValue(String raw) {
        for (Severity candidate : values()) {
            if (candidate.value.equalsIgnoreCase(raw)) return candidate;
        }
        throw new IllegalArgumentException("Unknown Severity: " + raw);
    }
}
