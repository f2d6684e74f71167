package com.trendplatform.common.series;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Chronological ordering. Every strategy treats list index as elapsed time, so this runs
 * before any of them. {@link List#sort} is stable: equal timestamps keep their input order.
 */
public final class SeriesSorter {

    private SeriesSorter() {}

    public static List<TimedPoint> sort(List<TimedPoint> points) {
        List<TimedPoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparing(TimedPoint::instant));
        return sorted;
    }

    public static double[] values(List<TimedPoint> series) {
        double[] values = new double[series.size()];
        for (int i = 0; i < values.length; i++) values[i] = series.get(i).value();
        return values;
    }
}
