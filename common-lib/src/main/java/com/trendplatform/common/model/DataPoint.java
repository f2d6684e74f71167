package com.trendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public record DataPoint(
    @JsonProperty("timestamp") String timestamp,      // ISO-8601
    @JsonProperty("value") double value,
    @JsonProperty("metadata") Map<String, Object> metadata
) {
    public static DataPoint of(String timestamp, double value) {
        return new DataPoint(timestamp, value, null);
    }
}
