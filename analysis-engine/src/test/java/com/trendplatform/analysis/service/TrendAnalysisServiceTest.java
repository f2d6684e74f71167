package com.trendplatform.analysis.service;

import com.trendplatform.analysis.exception.TrendRequestValidationException;
import com.trendplatform.common.model.AnalysisRequest;
import com.trendplatform.common.model.AnalysisType;
import com.trendplatform.common.model.DataPoint;
import com.trendplatform.common.model.TimeWindow;
import com.trendplatform.common.model.TrendResult;
import com.trendplatform.common.model.TrendType;
import com.trendplatform.common.sink.TrendResultSink;
import com.trendplatform.common.trend.TrendDetectionEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TrendAnalysisServiceTest {

    private static final TimeWindow JANUARY = TimeWindow.of("2024-01-01T00:00:00Z", "2024-01-31T00:00:00Z");
    private static final List<DataPoint> RISING = List.of(
        DataPoint.of("2024-01-01T00:00:00Z", 1),
        DataPoint.of("2024-01-02T00:00:00Z", 2),
        DataPoint.of("2024-01-03T00:00:00Z", 3),
        DataPoint.of("2024-01-04T00:00:00Z", 4));

    @Mock
    private TrendResultSink resultSink;

    private TrendAnalysisService service;

    @BeforeEach
    void setUp() {
        Clock fixed = Clock.fixed(Instant.parse("2024-02-01T00:00:00Z"), ZoneOffset.UTC);
        service = new TrendAnalysisService(new TrendDetectionEngine(), resultSink, fixed);
    }

    @Test
    @DisplayName("valid request → engine result, handed to the sink with the trace id")
    void analyzesAndPublishes() {
        AnalysisRequest request = AnalysisRequest.of(RISING, AnalysisType.LINEAR, JANUARY);

        StepVerifier.create(service.analyze(request, "trace-1"))
            .assertNext(result -> {
                assertEquals(TrendType.UPWARD, result.trendType());
                assertEquals(5, result.predictions().size());
            })
            .verifyComplete();

        verify(resultSink).accept(eq("trace-1"), eq(request), any(TrendResult.class));
    }

    @Test
    @DisplayName("engine failures surface as the neutral result, not an error")
    void failSoft() {
        AnalysisRequest request = AnalysisRequest.of(
            List.of(DataPoint.of("2024-01-01T00:00:00Z", 1), DataPoint.of("2024-01-02T00:00:00Z", Double.NaN)),
            AnalysisType.LINEAR, JANUARY);

        StepVerifier.create(service.analyze(request, "trace-2"))
            .expectNext(TrendResult.empty())
            .verifyComplete();
    }

    @Test
    @DisplayName("missing analysisType → validation error, sink untouched")
    void missingType() {
        AnalysisRequest request = AnalysisRequest.of(RISING, null, JANUARY);

        StepVerifier.create(service.analyze(request, "trace-3"))
            .expectErrorSatisfies(e -> {
                assertEquals(TrendRequestValidationException.class, e.getClass());
                assertEquals("analysisType is required", e.getMessage());
            })
            .verify();

        verify(resultSink, never()).accept(any(), any(), any());
    }

    @Test
    @DisplayName("missing dataPoints or window bound → validation error")
    void missingFields() {
        StepVerifier.create(service.analyze(AnalysisRequest.of(null, AnalysisType.LINEAR, JANUARY), "t"))
            .expectError(TrendRequestValidationException.class)
            .verify();

        StepVerifier.create(service.analyze(
                AnalysisRequest.of(RISING, AnalysisType.LINEAR, TimeWindow.of("2024-01-01T00:00:00Z", null)), "t"))
            .expectError(TrendRequestValidationException.class)
            .verify();
    }

    @Test
    @DisplayName("sink failure does not fail the analysis")
    void sinkFailureIsNonCritical() {
        AnalysisRequest request = AnalysisRequest.of(RISING, AnalysisType.EXPONENTIAL, JANUARY);
        doThrow(new IllegalStateException("sink down")).when(resultSink).accept(any(), any(), any());

        StepVerifier.create(service.analyze(request, "trace-4"))
            .assertNext(result -> assertEquals(TrendType.UPWARD, result.trendType()))
            .verifyComplete();
    }
}
