package com.trendplatform.common.trend;

import com.trendplatform.common.model.TrendType;

/**
 * Output of {@link SeasonalTrendStrategy}.
 *
 * @param period    winning candidate period, 0 when none qualified
 * @param amplitude largest peak-to-peak range over any single cycle
 * @param score     mean lagged product at {@code period}; used as confidence without normalisation
 * @param halfDelta second-half mean minus first-half mean
 */
public record SeasonalTrend(int period, double amplitude, double score, double halfDelta) {

    public double direction() {
        return Math.signum(halfDelta);
    }

    public TrendType trendType() {
        if (score < TrendThresholds.SEASONAL_MIN_CONFIDENCE) return TrendType.VOLATILE;
        double direction = direction();
        if (Math.abs(direction) < TrendThresholds.SEASONAL_FLAT_DIRECTION) return TrendType.STABLE;
        return direction > 0 ? TrendType.UPWARD : TrendType.DOWNWARD;
    }
}
