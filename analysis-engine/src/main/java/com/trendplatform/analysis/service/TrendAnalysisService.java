package com.trendplatform.analysis.service;

import com.trendplatform.common.model.AnalysisRequest;
import com.trendplatform.common.model.TrendResult;
import com.trendplatform.common.sink.TrendResultSink;
import com.trendplatform.common.trace.TraceContextUtil;
import com.trendplatform.common.trend.TrendDetectionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Validates a request, runs the engine off the event loop and hands the result to the sink.
 */
@Service
public class TrendAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(TrendAnalysisService.class);

    private final TrendDetectionEngine engine;
    private final TrendResultSink resultSink;
    private final Clock clock;

    public TrendAnalysisService(TrendDetectionEngine engine, TrendResultSink resultSink, Clock clock) {
        this.engine = engine;
        this.resultSink = resultSink;
        this.clock = clock;
    }

    public Mono<TrendResult> analyze(AnalysisRequest request, String traceId) {
        return TraceContextUtil.withTraceId(
            Mono.fromCallable(() -> {
                    TrendRequestValidator.validate(request);
                    return run(request, traceId);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .doOnEach(signal -> {
                    if (signal.isOnError()) {
                        String id = TraceContextUtil.getTraceId(signal.getContextView());
                        TraceContextUtil.withMdc(id, () -> log.warn("Trend request not analysed. reason={}",
                            signal.getThrowable().getMessage()));
                    }
                }),
            traceId);
    }

    private TrendResult run(AnalysisRequest request, String traceId) {
        Instant started = clock.instant();
        TrendResult result = engine.analyze(request);
        long elapsedMs = Duration.between(started, clock.instant()).toMillis();

        TraceContextUtil.withMdc(traceId, () -> log.info(
            "Trend analysis complete. type={} points={} trend={} confidence={} elapsedMs={}",
            request.analysisType(), request.dataPoints().size(), result.trendType(),
            result.confidence(), elapsedMs));

        publish(traceId, request, result);
        return result;
    }

    private void publish(String traceId, AnalysisRequest request, TrendResult result) {
        try {
            resultSink.accept(traceId, request, result);
        } catch (RuntimeException e) {
            log.warn("Result sink failed (non-critical). traceId={}", traceId, e);
        }
    }
}
