package com.trendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One forward projection of the fitted linear trend.
 *
 * @param timestamp      projected instant, ISO-8601 UTC with millisecond precision
 * @param predictedValue value of the regression line at the projected step
 * @param confidence     decays by 0.1 per step, floored at 0.1
 * @param range          symmetric band that widens by 10% of the prediction per step
 */
public record Prediction(
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("predictedValue") double predictedValue,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("range") PredictionRange range
) {}
