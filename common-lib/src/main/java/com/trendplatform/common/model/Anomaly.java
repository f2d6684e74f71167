package com.trendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Anomaly(
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("actualValue") double actualValue,
    @JsonProperty("expectedValue") double expectedValue,   // local window mean
    @JsonProperty("deviation") double deviation,           // z-score
    @JsonProperty("severity") Severity severity
) {}
