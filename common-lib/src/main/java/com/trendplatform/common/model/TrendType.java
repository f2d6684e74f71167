package com.trendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification emitted in {@link TrendResult#trendType()}.
 * {@link #ANOMALY} is produced only by the anomaly strategy, {@link #VOLATILE} only by the seasonal one.
 */
public enum TrendType {
    UPWARD("upward"),
    DOWNWARD("downward"),
    STABLE("stable"),
    VOLATILE("volatile"),
    ANOMALY("anomaly");

    private final String value;

    TrendType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static TrendType fromValue(String raw) {
        for (TrendType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(raw)) return candidate;
        }
        throw new IllegalArgumentException("Unknown TrendType: " + raw);
    }
}
