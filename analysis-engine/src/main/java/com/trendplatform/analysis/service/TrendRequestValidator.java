package com.trendplatform.analysis.service;

import com.trendplatform.analysis.exception.TrendRequestValidationException;
import com.trendplatform.common.model.AnalysisRequest;
import com.trendplatform.common.model.TimeWindow;

/**
 * Caller-side checks the engine assumes have already passed. Only presence is checked:
 * unparseable timestamps, reversed windows and unknown analysis types are left to the
 * engine's own fail-soft handling.
 */
public final class TrendRequestValidator {

    private TrendRequestValidator() {}

    public static void validate(AnalysisRequest request) {
        if (request == null) {
            throw new TrendRequestValidationException("Request body is required");
        }
        if (request.dataPoints() == null) {
            throw new TrendRequestValidationException("dataPoints array is required");
        }
        if (request.analysisType() == null) {
            throw new TrendRequestValidationException("analysisType is required");
        }
        TimeWindow window = request.timeWindow();
        if (window == null || window.start() == null || window.end() == null) {
            throw new TrendRequestValidationException("timeWindow with start and end is required");
        }
    }
}
