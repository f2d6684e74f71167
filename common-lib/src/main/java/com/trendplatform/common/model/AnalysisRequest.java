package com.trendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public record AnalysisRequest(
    @JsonProperty("dataPoints") List<DataPoint> dataPoints,
    @JsonProperty("analysisType") AnalysisType analysisType,
    @JsonProperty("timeWindow") TimeWindow timeWindow,
    @JsonProperty("sensitivity") Sensitivity sensitivity,     // optional, defaults to MEDIUM
    @JsonProperty("parameters") Map<String, Object> parameters
) {
    public static final String DETECT_CHANGE_POINTS = "detectChangePoints";

    public static AnalysisRequest of(List<DataPoint> dataPoints, AnalysisType analysisType,
                                     TimeWindow timeWindow) {
        return new AnalysisRequest(dataPoints, analysisType, timeWindow, null, null);
    }

    /** {@code true} when {@code parameters.detectChangePoints} is set to boolean or string true. */
    public boolean changePointsRequested() {
        if (parameters == null) return false;
        Object raw = parameters.get(DETECT_CHANGE_POINTS);
        if (raw instanceof Boolean flag) return flag;
        return raw != null && "true".equalsIgnoreCase(raw.toString());
    }
}
