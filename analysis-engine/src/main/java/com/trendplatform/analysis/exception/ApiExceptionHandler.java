package com.trendplatform.analysis.exception;

import com.trendplatform.analysis.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Shapes every failure of the request layer into the {@code {"error": ...}} envelope.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TrendRequestValidationException.class)
    public ResponseEntity<ErrorResponse> validation(TrendRequestValidationException e) {
        log.warn("Rejected trend request. reason={}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> unreadableBody(ServerWebInputException e) {
        log.warn("Unreadable trend request body. reason={}", e.getReason());
        return ResponseEntity.badRequest().body(ErrorResponse.of("Request body is missing or malformed"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception e) {
        log.error("Trend analysis endpoint error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("Internal server error", e.getMessage()));
    }
}
