package com.trendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the local slope changed around a change point.
 * <ul>
 *   <li>{@link #REVERSAL}     — slope changed sign</li>
 *   <li>{@link #ACCELERATION} — same sign, steeper afterwards</li>
 *   <li>{@link #DECELERATION} — same sign, flatter afterwards</li>
 * </ul>
 */
public enum ChangePointType {
    ACCELERATION("acceleration"),
    DECELERATION("deceleration"),
    REVERSAL("reversal");

    private final String value;

    ChangePointType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ChangePointType fromValue(String raw) {
        for (ChangePointType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(raw)) return candidate;
        }
        throw new IllegalArgumentException("Unknown ChangePointType: " + raw);
    }
}
