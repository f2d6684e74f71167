package com.trendplatform.common.trend;

import com.trendplatform.common.model.Pattern;
import com.trendplatform.common.model.PatternType;
import com.trendplatform.common.model.Prediction;
import com.trendplatform.common.model.TrendResult;
import com.trendplatform.common.model.TrendType;

import java.util.List;
import java.util.Locale;

/**
 * Normalises each strategy's outcome into a {@link TrendResult}.
 * Fields a strategy does not produce stay {@code null}.
 */
public final class TrendResultAssembler {

    private TrendResultAssembler() {}

    public static TrendResult fromLinear(LinearTrend trend, List<Prediction> predictions) {
        TrendType type = trend.trendType();
        Pattern pattern = Pattern.trend(PatternType.LINEAR, trend.confidence(), String.format(Locale.ROOT,
            "Linear %s trend, slope %.4f per step (r=%.3f)", type.value(), trend.slope(), trend.correlation()));
        return new TrendResult(type, trend.confidence(), trend.strength(), trend.direction(),
            trend.slope(), List.of(pattern), predictions, null, null);
    }

    public static TrendResult fromExponential(ExponentialTrend trend) {
        TrendType type = trend.trendType();
        Pattern pattern = Pattern.trend(PatternType.EXPONENTIAL, trend.confidence(), String.format(Locale.ROOT,
            "Exponential %s trend, growth rate %.4f per step (R²=%.3f)", type.value(), trend.growthRate(),
            trend.rSquared()));
        return new TrendResult(type, trend.confidence(), trend.strength(), trend.direction(),
            trend.growthRate(), List.of(pattern), null, null, null);
    }

    public static TrendResult fromSeasonal(SeasonalTrend trend) {
        String description = trend.period() > 0
            ? String.format(Locale.ROOT, "Seasonal pattern with period %d and amplitude %.4f",
                trend.period(), trend.amplitude())
            : "No dominant seasonal period detected";
        Pattern pattern = Pattern.seasonal(trend.period(), trend.amplitude(), trend.score(), description);
        return new TrendResult(trend.trendType(), trend.score(), trend.amplitude(), trend.direction(),
            trend.halfDelta(), List.of(pattern), null, null, null);
    }

    public static TrendResult fromAnomalyScan(AnomalyScan scan) {
        return new TrendResult(TrendType.ANOMALY, scan.confidence(), scan.strength(), 0.0, 0.0,
            List.of(), null, List.copyOf(scan.anomalies()), null);
    }
}
