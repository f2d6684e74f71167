package com.trendplatform.analysis.sink;

import com.trendplatform.common.model.AnalysisRequest;
import com.trendplatform.common.model.TrendResult;
import com.trendplatform.common.sink.TrendResultSink;
import com.trendplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default {@link TrendResultSink}: one INFO line per analysis, nothing retained.
 */
@Component
public class LoggingTrendResultSink implements TrendResultSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingTrendResultSink.class);

    @Override
    public void accept(String traceId, AnalysisRequest request, TrendResult result) {
        TraceContextUtil.withMdc(traceId, () -> log.info(
            "Trend result. type={} trend={} confidence={} patterns={} predictions={} anomalies={}",
            request.analysisType(), result.trendType(), result.confidence(),
            result.patterns().size(),
            result.predictions() == null ? 0 : result.predictions().size(),
            result.anomalies() == null ? 0 : result.anomalies().size()));
    }
}
