package com.trendplatform.common.indicator;

/**
 * Straight line {@code y = intercept + slope·x} produced by {@link SeriesStatistics#leastSquares}.
 */
public record RegressionFit(double slope, double intercept) {

    public double valueAt(double x) {
        return intercept + slope * x;
    }
}
