package com.trendplatform.common.series;

import com.trendplatform.common.model.DataPoint;

import java.time.Instant;

/**
 * A {@link DataPoint} paired with its parsed timestamp, so downstream stages parse once.
 */
public record TimedPoint(DataPoint point, Instant instant) {

    public double value() {
        return point.value();
    }

    public String timestamp() {
        return point.timestamp();
    }
}
