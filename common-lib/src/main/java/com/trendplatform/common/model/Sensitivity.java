package com.trendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Caller-tunable strictness for anomaly and change-point thresholds.
 * A missing or unrecognised value is treated as {@link #MEDIUM} by the engine.
 */
public enum Sensitivity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    Sensitivity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static Sensitivity fromValue(String raw) {
        if (raw == null) return null;
        for (Sensitivity s : values()) {
            if (s.value.equalsIgnoreCase(raw.trim())) return s;
        }
        return null;
    }

    /** Resolves {@code null} to the default {@link #MEDIUM}. */
    public static Sensitivity orDefault(Sensitivity sensitivity) {
        return sensitivity != null ? sensitivity : MEDIUM;
    }
}
