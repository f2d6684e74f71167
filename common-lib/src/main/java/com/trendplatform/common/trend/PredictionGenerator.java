package com.trendplatform.common.trend;

import com.trendplatform.common.model.Prediction;
import com.trendplatform.common.model.PredictionRange;
import com.trendplatform.common.series.TimedPoint;
import com.trendplatform.common.series.Timestamps;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Projects a {@link LinearTrend} forward by a fixed number of steps.
 *
 * <p>Step size is the average spacing of the observed series. For step {@code i}:
 * <pre>
 *   predicted  = intercept + slope·(n + i − 1)
 *   confidence = max(0.1, 1 − 0.1·i)
 *   margin     = |predicted|·0.1·i
 * </pre>
 */
public final class PredictionGenerator {

    static final long DEFAULT_STEP_MILLIS = Duration.ofDays(1).toMillis();

    private PredictionGenerator() {}

    public static List<Prediction> project(LinearTrend trend, List<TimedPoint> series, int horizon) {
        int n = series.size();
        List<Prediction> predictions = new ArrayList<>(Math.max(horizon, 0));
        if (n == 0) return predictions;

        long first = series.get(0).instant().toEpochMilli();
        long last  = series.get(n - 1).instant().toEpochMilli();
        double stepMillis = n > 1 ? (double) (last - first) / (n - 1) : DEFAULT_STEP_MILLIS;

        for (int i = 1; i <= horizon; i++) {
            double predicted  = trend.intercept() + trend.slope() * (n + i - 1);
            double confidence = Math.max(0.1, 1 - 0.1 * i);
            double margin     = Math.abs(predicted) * 0.1 * i;
            String timestamp  = Timestamps.format(last + (long) (i * stepMillis));

            predictions.add(new Prediction(timestamp, predicted, confidence,
                new PredictionRange(predicted - margin, predicted + margin)));
        }
        return predictions;
    }
}
