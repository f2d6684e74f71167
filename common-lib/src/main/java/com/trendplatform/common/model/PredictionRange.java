package com.trendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PredictionRange(
    @JsonProperty("min") double min,
    @JsonProperty("max") double max
) {}
