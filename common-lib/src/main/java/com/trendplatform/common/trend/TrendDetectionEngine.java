package com.trendplatform.common.trend;

import com.trendplatform.common.exception.TrendAnalysisException;
import com.trendplatform.common.model.AnalysisRequest;
import com.trendplatform.common.model.ChangePoint;
import com.trendplatform.common.model.TrendResult;
import com.trendplatform.common.series.SeriesSorter;
import com.trendplatform.common.series.TimedPoint;
import com.trendplatform.common.series.WindowFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point of the trend-detection pipeline.
 *
 * <pre>
 *   WindowFilter → SeriesSorter → TrendAnalyzer (one strategy) → [PredictionGenerator]
 *               → [ChangePointDetector] → TrendResultAssembler
 * </pre>
 *
 * <h3>Failure policy</h3>
 * <p>{@link #analyze} never throws. Fewer than {@code minDataPoints} points inside the window,
 * or any runtime failure along the pipeline, yields {@link TrendResult#empty()}. Callers cannot
 * tell "no trend" from "could not analyse" by the result alone.
 *
 * <p>Holds only immutable settings; one instance may serve concurrent requests.
 * No Spring dependencies. No I/O.
 */
public final class TrendDetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(TrendDetectionEngine.class);

    private final TrendEngineSettings settings;

    public TrendDetectionEngine(TrendEngineSettings settings) {
        this.settings = settings;
    }

    public TrendDetectionEngine() {
        this(TrendEngineSettings.defaults());
    }

    public TrendEngineSettings settings() {
        return settings;
    }

    public TrendResult analyze(AnalysisRequest request) {
        if (request == null) return TrendResult.empty();
        try {
            List<TimedPoint> windowed = WindowFilter.filter(request.dataPoints(), request.timeWindow());
            if (windowed.size() < settings.minDataPoints()) {
                log.debug("Insufficient points in window. kept={} required={}",
                    windowed.size(), settings.minDataPoints());
                return TrendResult.empty();
            }

            List<TimedPoint> series = SeriesSorter.sort(windowed);
            TrendResult result = TrendAnalyzer.analyze(request.analysisType(), series,
                request.sensitivity(), settings.predictionHorizon());

            if (request.changePointsRequested()) {
                List<ChangePoint> changePoints = ChangePointDetector.detect(series, request.sensitivity());
                result = result.withChangePoints(changePoints);
            }
            return result;
        } catch (TrendAnalysisException e) {
            log.warn("Trend analysis rejected input, returning neutral result. stage={} reason={}",
                e.getStage(), e.getMessage());
            return TrendResult.empty();
        } catch (RuntimeException e) {
            log.warn("Trend analysis failed, returning neutral result. type={}", request.analysisType(), e);
            return TrendResult.empty();
        }
    }
}
