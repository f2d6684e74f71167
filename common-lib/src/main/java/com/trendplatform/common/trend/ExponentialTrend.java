package com.trendplatform.common.trend;

import com.trendplatform.common.model.TrendType;

/**
 * Output of {@link ExponentialTrendStrategy}; all quantities live in log space.
 *
 * @param growthRate   slope of {@code ln(value)} per step
 * @param logIntercept fitted {@code ln(value)} at index 0
 * @param rSquared     explained / total variation of {@code ln(value)}
 */
public record ExponentialTrend(double growthRate, double logIntercept, double rSquared) {

    public double confidence() {
        return Math.min(1.0, Math.sqrt(Math.max(0.0, rSquared)));
    }

    public double strength() {
        return Math.abs(growthRate);
    }

    public double direction() {
        return Math.signum(growthRate);
    }

    public TrendType trendType() {
        return TrendThresholds.classifySlope(growthRate);
    }
}
