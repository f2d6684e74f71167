package com.trendplatform.common.trend;

/**
 * Immutable knobs of {@link TrendDetectionEngine}.
 *
 * @param predictionHorizon number of forward steps the linear strategy projects (≥ 0)
 * @param minDataPoints     points that must survive the window filter (≥ 2)
 */
public record TrendEngineSettings(int predictionHorizon, int minDataPoints) {

    public static final int DEFAULT_PREDICTION_HORIZON = 5;
    public static final int DEFAULT_MIN_DATA_POINTS = 2;

    public TrendEngineSettings {
        if (predictionHorizon < 0) {
            throw new IllegalArgumentException("predictionHorizon must be >= 0, was " + predictionHorizon);
        }
        if (minDataPoints < DEFAULT_MIN_DATA_POINTS) {
            throw new IllegalArgumentException("minDataPoints must be >= 2, was " + minDataPoints);
        }
    }

    public static TrendEngineSettings defaults() {
        return new TrendEngineSettings(DEFAULT_PREDICTION_HORIZON, DEFAULT_MIN_DATA_POINTS);
    }
}
