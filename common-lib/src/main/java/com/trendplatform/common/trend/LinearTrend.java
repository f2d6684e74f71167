package com.trendplatform.common.trend;

import com.trendplatform.common.model.TrendType;

/**
 * Output of {@link LinearTrendStrategy}.
 *
 * @param slope       value change per step
 * @param intercept   fitted value at index 0
 * @param correlation Pearson r between index and value
 * @param mean        arithmetic mean of the values
 */
public record LinearTrend(double slope, double intercept, double correlation, double mean) {

    public double confidence() {
        return Math.abs(correlation);
    }

    /** {@code |slope| / |mean|}, dividing by 1 when the mean is zero. */
    public double strength() {
        double divisor = mean == 0 ? 1.0 : Math.abs(mean);
        return Math.abs(slope) / divisor;
    }

    public double direction() {
        return Math.signum(slope);
    }

    public TrendType trendType() {
        return TrendThresholds.classifySlope(slope);
    }
}
