package com.trendplatform.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Normalised output of every analysis strategy.
 *
 * <p>{@code predictions}, {@code anomalies} and {@code changePoints} are {@code null} — and omitted
 * from JSON — when the strategy that ran does not produce them. They are never defaulted to empty lists.
 *
 * <p>{@code confidence} lies in [0, 1] for every strategy except seasonal, where it is the raw
 * autocorrelation score of the winning period.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrendResult(
    @JsonProperty("trendType") TrendType trendType,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("strength") double strength,
    @JsonProperty("direction") double direction,
    @JsonProperty("changeRate") double changeRate,
    @JsonProperty("patterns") List<Pattern> patterns,
    @JsonProperty("predictions") List<Prediction> predictions,
    @JsonProperty("anomalies") List<Anomaly> anomalies,
    @JsonProperty("changePoints") List<ChangePoint> changePoints
) {
    /** Neutral result returned for too little data or any internal failure. */
    public static TrendResult empty() {
        return new TrendResult(TrendType.STABLE, 0.0, 0.0, 0.0, 0.0, List.of(), null, null, null);
    }

    public TrendResult withChangePoints(List<ChangePoint> points) {
        return new TrendResult(trendType, confidence, strength, direction, changeRate,
            patterns, predictions, anomalies, points);
    }
}
