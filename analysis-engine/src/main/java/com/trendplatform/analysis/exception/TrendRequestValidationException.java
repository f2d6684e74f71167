package com.trendplatform.analysis.exception;

/**
 * Request rejected before the engine runs. Maps to HTTP 400; retrying the same body will fail again.
 */
public class TrendRequestValidationException extends RuntimeException {

    public TrendRequestValidationException(String message) {
        super(message);
    }
}
