package com.trendplatform.common.trend;

import com.trendplatform.common.indicator.SeriesStatistics;
import com.trendplatform.common.model.Anomaly;
import com.trendplatform.common.model.Sensitivity;
import com.trendplatform.common.model.Severity;
import com.trendplatform.common.series.TimedPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Sliding-window z-score outlier detection.
 *
 * <p>Half width {@code w = min(10, n/4)}. Only indices in {@code [w, n − w)} are scored, each
 * against the mean and population standard deviation of {@code [i − w, i + w]}. The first and
 * last {@code w} points are never flagged.
 *
 * <pre>
 *   sensitivity   z threshold        severity
 *   low           3.0                z &gt; 3.0 → high
 *   medium/unset  2.0                z &gt; 2.5 → medium
 *   high          1.5                otherwise → low
 * </pre>
 */
public final class AnomalyDetectionStrategy {

    static final int MAX_HALF_WIDTH = 10;

    private AnomalyDetectionStrategy() {}

    public static AnomalyScan detect(List<TimedPoint> series, Sensitivity sensitivity) {
        int n = series.size();
        int w = Math.min(MAX_HALF_WIDTH, n / 4);
        double threshold = TrendThresholds.anomalyZThreshold(sensitivity);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) values[i] = series.get(i).value();

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = w; i < n - w; i++) {
            double mean = SeriesStatistics.mean(values, i - w, i + w + 1);
            double stdDev = SeriesStatistics.populationStdDev(values, i - w, i + w + 1);
            double zScore = stdDev == 0 ? 0.0 : Math.abs(values[i] - mean) / stdDev;

            if (zScore > threshold) {
                anomalies.add(new Anomaly(series.get(i).timestamp(), values[i], mean, zScore, severity(zScore)));
            }
        }
        return new AnomalyScan(anomalies, w, n);
    }

    static Severity severity(double zScore) {
        if (zScore > TrendThresholds.SEVERITY_HIGH_Z) return Severity.HIGH;
        if (zScore > TrendThresholds.SEVERITY_MEDIUM_Z) return Severity.MEDIUM;
        return Severity.LOW;
    }
}
