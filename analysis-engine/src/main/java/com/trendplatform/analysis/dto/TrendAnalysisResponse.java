package com.trendplatform.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trendplatform.common.model.TrendResult;

public record TrendAnalysisResponse(
    @JsonProperty("message") String message,
    @JsonProperty("data") TrendResult data
) {
    public static TrendAnalysisResponse completed(TrendResult result) {
        return new TrendAnalysisResponse("Trend analysis completed", result);
    }
}
