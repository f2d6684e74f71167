package com.trendplatform.common.trend;

import com.trendplatform.common.exception.TrendAnalysisException;
import com.trendplatform.common.model.AnalysisType;
import com.trendplatform.common.model.Prediction;
import com.trendplatform.common.model.Sensitivity;
import com.trendplatform.common.model.TrendResult;
import com.trendplatform.common.series.SeriesSorter;
import com.trendplatform.common.series.TimedPoint;

import java.util.List;

/**
 * Runs exactly one strategy over a chronologically sorted series.
 * A {@code null} type is analysed as {@link AnalysisType#LINEAR}.
 */
public final class TrendAnalyzer {

    private TrendAnalyzer() {}

    public static TrendResult analyze(AnalysisType type, List<TimedPoint> series,
                                      Sensitivity sensitivity, int predictionHorizon) {
        AnalysisType effective = type != null ? type : AnalysisType.LINEAR;
        double[] values = SeriesSorter.values(series);
        requireFinite(effective, values);

        return switch (effective) {
            case EXPONENTIAL -> TrendResultAssembler.fromExponential(ExponentialTrendStrategy.fit(values));
            case SEASONAL    -> TrendResultAssembler.fromSeasonal(SeasonalTrendStrategy.detect(values));
            case ANOMALY     -> TrendResultAssembler.fromAnomalyScan(AnomalyDetectionStrategy.detect(series, sensitivity));
            case LINEAR      -> {
                LinearTrend trend = LinearTrendStrategy.fit(values);
                List<Prediction> predictions = PredictionGenerator.project(trend, series, predictionHorizon);
                yield TrendResultAssembler.fromLinear(trend, predictions);
            }
        };
    }

    private static void requireFinite(AnalysisType type, double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new TrendAnalysisException(type.value(), "Non-finite value at index " + i + ": " + values[i]);
            }
        }
    }
}
