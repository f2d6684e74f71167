package com.trendplatform.common.trend;

import com.trendplatform.common.indicator.SeriesStatistics;
import com.trendplatform.common.model.ChangePoint;
import com.trendplatform.common.model.ChangePointType;
import com.trendplatform.common.model.Sensitivity;
import com.trendplatform.common.series.TimedPoint;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Flags indices where the local slope shifts abruptly.
 *
 * <p>At each {@code i} in {@code [2, n − 2)} the slope of the two preceding points is compared
 * with the slope of up to three points starting at {@code i}. A shift larger than the
 * sensitivity threshold (high 0.05, medium 0.1, low 0.15) is reported.
 */
public final class ChangePointDetector {

    private static final int LOOKBACK = 2;
    private static final int LOOKAHEAD = 3;

    private ChangePointDetector() {}

    public static List<ChangePoint> detect(List<TimedPoint> series, Sensitivity sensitivity) {
        double threshold = TrendThresholds.changePointThreshold(sensitivity);
        double[] values = new double[series.size()];
        for (int i = 0; i < values.length; i++) values[i] = series.get(i).value();

        List<ChangePoint> changePoints = new ArrayList<>();
        for (int i = LOOKBACK; i < values.length - LOOKBACK; i++) {
            double before = localSlope(values, i - LOOKBACK, i);
            double after  = localSlope(values, i, Math.min(values.length, i + LOOKAHEAD));
            double change = Math.abs(after - before);

            if (change > threshold) {
                changePoints.add(new ChangePoint(series.get(i).timestamp(),
                    classify(before, after), Math.round(change * 100) / 100.0));
            }
        }
        return changePoints;
    }

    static ChangePointType classify(double before, double after) {
        if (before * after < 0) return ChangePointType.REVERSAL;
        if (Math.abs(after) > Math.abs(before)) return ChangePointType.ACCELERATION;
        return ChangePointType.DECELERATION;
    }

    private static double localSlope(double[] values, int from, int to) {
        if (to - from < 2) return 0.0;
        return SeriesStatistics.leastSquares(Arrays.copyOfRange(values, from, to)).slope();
    }
}
