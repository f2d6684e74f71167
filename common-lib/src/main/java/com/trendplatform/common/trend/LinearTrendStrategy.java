package com.trendplatform.common.trend;

import com.trendplatform.common.indicator.RegressionFit;
import com.trendplatform.common.indicator.SeriesStatistics;

/**
 * Least-squares line through the series, index as the x axis.
 *
 * <p>Confidence is |Pearson r|; strength is the slope relative to the mean level.
 * Only this strategy feeds the {@link PredictionGenerator}.
 */
public final class LinearTrendStrategy {

    private LinearTrendStrategy() {}

    public static LinearTrend fit(double[] values) {
        RegressionFit fit = SeriesStatistics.leastSquares(values);
        double r = SeriesStatistics.pearson(values);
        return new LinearTrend(fit.slope(), fit.intercept(), r, SeriesStatistics.mean(values));
    }
}
