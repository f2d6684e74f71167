package com.trendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PatternType {
    SEASONAL("seasonal"),
    CYCLICAL("cyclical"),
    LINEAR("linear"),
    EXPONENTIAL("exponential");

    private final String value;

    PatternType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static PatternType fromValue(String raw) {
        for (PatternType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(raw)) return candidate;
        }
        throw new IllegalArgumentException("Unknown PatternType: " + raw);
    }
}
