package com.trendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Pattern(
    @JsonProperty("type") PatternType type,
    @JsonProperty("period") Integer period,          // seasonal only
    @JsonProperty("amplitude") Double amplitude,     // seasonal only
    @JsonProperty("confidence") double confidence,
    @JsonProperty("description") String description
) {
    public static Pattern trend(PatternType type, double confidence, String description) {
        return new Pattern(type, null, null, confidence, description);
    }

    public static Pattern seasonal(int period, double amplitude, double confidence, String description) {
        return new Pattern(PatternType.SEASONAL, period, amplitude, confidence, description);
    }
}
