package com.trendplatform.common.trend;

import com.trendplatform.common.indicator.RegressionFit;
import com.trendplatform.common.indicator.SeriesStatistics;

/**
 * Fits {@code value = C·e^(k·i)} by linear regression on {@code ln(value)}.
 *
 * <p>Values are floored at {@value #LOG_FLOOR} before taking the log, so zero and negative
 * observations flatten the curve instead of failing. No predictions are produced here.
 */
public final class ExponentialTrendStrategy {

    static final double LOG_FLOOR = 0.001;

    private ExponentialTrendStrategy() {}

    public static ExponentialTrend fit(double[] values) {
        double[] logValues = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            logValues[i] = Math.log(Math.max(values[i], LOG_FLOOR));
        }
        RegressionFit fit = SeriesStatistics.leastSquares(logValues);
        double rSquared = SeriesStatistics.rSquared(logValues, fit);
        return new ExponentialTrend(fit.slope(), fit.intercept(), rSquared);
    }
}
