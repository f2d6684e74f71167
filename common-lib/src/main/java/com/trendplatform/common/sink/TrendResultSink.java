package com.trendplatform.common.sink;

import com.trendplatform.common.model.AnalysisRequest;
import com.trendplatform.common.model.TrendResult;

/**
 * Receives every completed analysis after the response has been assembled.
 *
 * <p>Current implementation: {@code LoggingTrendResultSink} in analysis-engine, which writes a
 * one-line summary. The engine itself never calls a sink; the request layer does.
 */
public interface TrendResultSink {

    /**
     * Implementations must not block and must not throw; the caller treats the sink as
     * fire-and-forget and logs any failure.
     *
     * @param traceId correlation id of the originating request
     * @param request the request as received
     * @param result  the result returned to the caller
     */
    void accept(String traceId, AnalysisRequest request, TrendResult result);
}
