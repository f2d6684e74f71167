package com.trendplatform.common.series;

import com.trendplatform.common.exception.TrendAnalysisException;
import com.trendplatform.common.model.DataPoint;
import com.trendplatform.common.model.TimeWindow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Restricts a series to the closed interval {@code [start, end]}, preserving input order.
 *
 * <p>Points with unparseable timestamps are dropped, not reported. An unparseable bound
 * matches nothing, as does a reversed window.
 */
public final class WindowFilter {

    private WindowFilter() {}

    public static List<TimedPoint> filter(List<DataPoint> points, TimeWindow window) {
        if (window == null) {
            throw new TrendAnalysisException("window", "Time window is required");
        }
        List<TimedPoint> kept = new ArrayList<>();
        if (points == null || points.isEmpty()) return kept;

        Optional<Instant> start = Timestamps.parse(window.start());
        Optional<Instant> end   = Timestamps.parse(window.end());
        if (start.isEmpty() || end.isEmpty()) return kept;

        for (DataPoint point : points) {
            if (point == null) continue;
            Optional<Instant> at = Timestamps.parse(point.timestamp());
            if (at.isPresent() && !at.get().isBefore(start.get()) && !at.get().isAfter(end.get())) {
                kept.add(new TimedPoint(point, at.get()));
            }
        }
        return kept;
    }
}
