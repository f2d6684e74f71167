package com.trendplatform.common.trend;

import com.trendplatform.common.indicator.SeriesStatistics;

/**
 * Autocorrelation-based period detection over a fixed set of calendar-like periods.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>For each candidate period {@code p} in {@link #CANDIDATE_PERIODS} with {@code p < n/2},
 *       score = mean of {@code v[i]·v[i+p]} over every valid {@code i}.</li>
 *   <li>The highest positive score wins. A later candidate must strictly beat the current best,
 *       so ties keep the shorter period.</li>
 *   <li>Amplitude = largest {@code max − min} across consecutive slices of length {@code p};
 *       the trailing slice may be partial.</li>
 *   <li>Overall drift = mean of the second half minus mean of the first half.</li>
 * </ol>
 *
 * <p>The score is the raw lagged product, not a normalised coefficient: it scales with the
 * square of the series level and can exceed 1.
 */
public final class SeasonalTrendStrategy {

    static final int[] CANDIDATE_PERIODS = {7, 30, 90, 365};

    private SeasonalTrendStrategy() {}

    public static SeasonalTrend detect(double[] values) {
        int n = values.length;

        int bestPeriod = 0;
        double bestScore = 0.0;
        for (int period : CANDIDATE_PERIODS) {
            if (period >= n / 2.0) continue;
            double score = laggedProduct(values, period);
            if (score > bestScore) {
                bestScore = score;
                bestPeriod = period;
            }
        }

        double amplitude = bestPeriod > 0 ? amplitude(values, bestPeriod) : 0.0;

        int mid = n / 2;
        double halfDelta = SeriesStatistics.mean(values, mid, n) - SeriesStatistics.mean(values, 0, mid);

        return new SeasonalTrend(bestPeriod, amplitude, bestScore, halfDelta);
    }

    static double laggedProduct(double[] values, int period) {
        int count = values.length - period;
        if (count <= 0) return 0.0;
        double sum = 0;
        for (int i = 0; i < count; i++) {
            sum += values[i] * values[i + period];
        }
        return sum / count;
    }

    static double amplitude(double[] values, int period) {
        double widest = 0.0;
        for (int start = 0; start < values.length; start += period) {
            int end = Math.min(start + period, values.length);
            double min = values[start];
            double max = values[start];
            for (int i = start + 1; i < end; i++) {
                min = Math.min(min, values[i]);
                max = Math.max(max, values[i]);
            }
            widest = Math.max(widest, max - min);
        }
        return widest;
    }
}
