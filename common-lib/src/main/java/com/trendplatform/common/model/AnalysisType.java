package com.trendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Analysis strategy requested by the caller.
 *
 * <p>Unrecognised values resolve to {@link #LINEAR} rather than failing deserialization.
 */
public enum AnalysisType {
    LINEAR("linear"),
    EXPONENTIAL("exponential"),
    SEASONAL("seasonal"),
    ANOMALY("anomaly");

    private final String value;

    AnalysisType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AnalysisType fromValue(String raw) {
        if (raw == null) return null;
        for (AnalysisType type : values()) {
            if (type.value.equalsIgnoreCase(raw.trim())) return type;
        }
        return LINEAR;
    }
}
