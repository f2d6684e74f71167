package com.trendplatform.common.indicator;

/**
 * Pure calculation utilities shared by the trend strategies.
 * Input arrays are expected oldest-first; array index stands in for elapsed time.
 */
public final class SeriesStatistics {

    private SeriesStatistics() {}

    // ── Mean / dispersion ────────────────────────────────────────────────────

    public static double mean(double[] values) {
        return mean(values, 0, values.length);
    }

    /**
     * @param from inclusive
     * @param to   exclusive
     * @return arithmetic mean of {@code values[from, to)}, or 0 when the range is empty
     */
    public static double mean(double[] values, int from, int to) {
        if (to <= from) return 0.0;
        double sum = 0;
        for (int i = from; i < to; i++) sum += values[i];
        return sum / (to - from);
    }

    /**
     * Population standard deviation (divides by N, not N − 1) of {@code values[from, to)}.
     */
    public static double populationStdDev(double[] values, int from, int to) {
        if (to <= from) return 0.0;
        double mean = mean(values, from, to);
        double variance = 0;
        for (int i = from; i < to; i++) {
            double diff = values[i] - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / (to - from));
    }

    // ── Least squares against index ──────────────────────────────────────────

    /**
     * Ordinary least-squares fit of {@code values[i]} against {@code i = 0..n-1}.
     * <pre>
     *   slope     = (nΣxy − ΣxΣy) / (nΣx² − (Σx)²)
     *   intercept = (Σy − slope·Σx) / n
     * </pre>
     * Fewer than two points yield a flat line through the single value (or zero).
     */
    public static RegressionFit leastSquares(double[] values) {
        int n = values.length;
        if (n == 0) return new RegressionFit(0.0, 0.0);
        if (n == 1) return new RegressionFit(0.0, values[0]);

        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0;
        for (int i = 0; i < n; i++) {
            sumX  += i;
            sumY  += values[i];
            sumXY += i * values[i];
            sumXX += (double) i * i;
        }
        double slope = (n * sumXY - sumX * sumY) / (n * sumXX - sumX * sumX);
        double intercept = (sumY - slope * sumX) / n;
        return new RegressionFit(slope, intercept);
    }

    /**
     * Pearson correlation between index and value.
     *
     * @return r in [−1, 1]; 0 when either series has zero variance
     */
    public static double pearson(double[] values) {
        int n = values.length;
        if (n < 2 || isConstant(values)) return 0.0;

        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0, sumYY = 0;
        for (int i = 0; i < n; i++) {
            double y = values[i];
            sumX  += i;
            sumY  += y;
            sumXY += i * y;
            sumXX += (double) i * i;
            sumYY += y * y;
        }
        double numerator = n * sumXY - sumX * sumY;
        double denominator = Math.sqrt((n * sumXX - sumX * sumX) * (n * sumYY - sumY * sumY));
        if (denominator == 0 || Double.isNaN(denominator)) return 0.0;
        return numerator / denominator;
    }

    /**
     * Explained over total variation of {@code values} under {@code fit}:
     * {@code Σ(ŷ − ȳ)² / Σ(y − ȳ)²}. Returns 0 when the series has no variation.
     * A constant series returns 0 before summing; its total is not exactly 0 when the
     * level is not representable.
     */
    public static double rSquared(double[] values, RegressionFit fit) {
        if (isConstant(values)) return 0.0;
        double mean = mean(values);
        double explained = 0;
        double total = 0;
        for (int i = 0; i < values.length; i++) {
            double fitted = fit.valueAt(i);
            explained += (fitted - mean) * (fitted - mean);
            total     += (values[i] - mean) * (values[i] - mean);
        }
        if (total == 0) return 0.0;
        return explained / total;
    }

    /** True when every element equals the first (empty and single-element arrays included). */
    private static boolean isConstant(double[] values) {
        for (int i = 1; i < values.length; i++) {
            if (values[i] != values[0]) return false;
        }
        return true;
    }
}
