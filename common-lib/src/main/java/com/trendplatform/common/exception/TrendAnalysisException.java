package com.trendplatform.common.exception;

/**
 * Raised inside the engine when a stage cannot produce a meaningful value
 * (missing window, non-finite input). Never escapes {@code TrendDetectionEngine}:
 * the engine boundary converts it into the neutral result.
 */
public class TrendAnalysisException extends RuntimeException {
    private final String stage;

    public TrendAnalysisException(String stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    public TrendAnalysisException(String stage, String message, Throwable cause) {
        super("[" + stage + "] " + message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
