package com.trendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Closed interval {@code [start, end]} the series is restricted to before analysis.
 * Bounds are ISO-8601 strings; {@code start <= end} is not enforced — a reversed
 * window simply matches nothing.
 */
public record TimeWindow(
    @JsonProperty("start") String start,
    @JsonProperty("end") String end
) {
    public static TimeWindow of(String start, String end) {
        return new TimeWindow(start, end);
    }
}
