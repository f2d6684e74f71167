package com.trendplatform.common.trend;

import com.trendplatform.common.model.Sensitivity;
import com.trendplatform.common.model.TrendType;

/**
 * Classification cut-offs shared by the strategies.
 */
final class TrendThresholds {

    /** Slopes (or log growth rates) below this magnitude are {@link TrendType#STABLE}. */
    static final double FLAT_SLOPE = 0.01;

    static final double SEASONAL_MIN_CONFIDENCE = 0.3;
    static final double SEASONAL_FLAT_DIRECTION = 0.1;

    static final double SEVERITY_HIGH_Z   = 3.0;
    static final double SEVERITY_MEDIUM_Z = 2.5;

    private TrendThresholds() {}

    static TrendType classifySlope(double slope) {
        if (Math.abs(slope) < FLAT_SLOPE) return TrendType.STABLE;
        return slope > 0 ? TrendType.UPWARD : TrendType.DOWNWARD;
    }

    /** z-score a point must exceed to be reported as an anomaly. */
    static double anomalyZThreshold(Sensitivity sensitivity) {
        return switch (Sensitivity.orDefault(sensitivity)) {
            case LOW  -> 3.0;
            case HIGH -> 1.5;
            default   -> 2.0;
        };
    }

    /** Minimum local slope change for a change point. */
    static double changePointThreshold(Sensitivity sensitivity) {
        return switch (Sensitivity.orDefault(sensitivity)) {
            case LOW  -> 0.15;
            case HIGH -> 0.05;
            default   -> 0.1;
        };
    }
}
