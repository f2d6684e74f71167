package com.trendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChangePoint(
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("type") ChangePointType type,
    @JsonProperty("significance") double significance     // |slope after - slope before|, 2dp
) {}
