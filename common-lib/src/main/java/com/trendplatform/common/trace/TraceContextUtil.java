package com.trendplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Trace-id propagation for analysis requests.
 *
 * <p>Reactor Context carries the id through the pipeline. MDC is only written around a single
 * log statement via {@link #withMdc}, never left populated on a thread.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, traceId);
 *     ...doOnEach(signal -&gt; TraceContextUtil.getTraceId(signal.getContextView()))
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private TraceContextUtil() {}

    /** Returns {@code incoming} when present, otherwise a fresh random id. */
    public static String resolve(String incoming) {
        return incoming == null || incoming.isBlank() ? UUID.randomUUID().toString() : incoming.trim();
    }

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** @return the trace id in {@code ctx}, or {@code "unknown"}; never {@code null} */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
