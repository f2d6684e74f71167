package com.trendplatform.analysis.controller;

import com.trendplatform.analysis.dto.TrendAnalysisResponse;
import com.trendplatform.analysis.service.TrendAnalysisService;
import com.trendplatform.common.model.AnalysisRequest;
import com.trendplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/trends")
public class TrendAnalysisController {

    private static final Logger log = LoggerFactory.getLogger(TrendAnalysisController.class);

    private final TrendAnalysisService analysisService;

    public TrendAnalysisController(TrendAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/analyze")
    public Mono<ResponseEntity<TrendAnalysisResponse>> analyze(
            @RequestBody AnalysisRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        TraceContextUtil.withMdc(traceId, () -> log.info("Trend analysis requested. type={} points={}",
            request.analysisType(), request.dataPoints() == null ? null : request.dataPoints().size()));
        return analysisService.analyze(request, traceId)
            .map(result -> ResponseEntity.ok()
                .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
                .body(TrendAnalysisResponse.completed(result)));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
