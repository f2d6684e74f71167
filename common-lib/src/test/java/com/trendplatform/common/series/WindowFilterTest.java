package com.trendplatform.common.series;

import com.trendplatform.common.exception.TrendAnalysisException;
import com.trendplatform.common.model.DataPoint;
import com.trendplatform.common.model.TimeWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WindowFilterTest {

    private static final TimeWindow JANUARY = TimeWindow.of("2024-01-01T00:00:00Z", "2024-01-31T00:00:00Z");

    @Nested
    @DisplayName("filter()")
    class FilterTests {

        @Test
        @DisplayName("bounds are inclusive on both ends")
        void closedInterval() {
            List<DataPoint> points = List.of(
                DataPoint.of("2023-12-31T23:59:59Z", 1),
                DataPoint.of("2024-01-01T00:00:00Z", 2),
                DataPoint.of("2024-01-15T00:00:00Z", 3),
                DataPoint.of("2024-01-31T00:00:00Z", 4),
                DataPoint.of("2024-01-31T00:00:01Z", 5));

            List<TimedPoint> kept = WindowFilter.filter(points, JANUARY);

            assertEquals(List.of(2.0, 3.0, 4.0), kept.stream().map(TimedPoint::value).toList());
        }

        @Test
        @DisplayName("input order is preserved, not sorted")
        void preservesOrder() {
            List<DataPoint> points = List.of(
                DataPoint.of("2024-01-20T00:00:00Z", 20),
                DataPoint.of("2024-01-05T00:00:00Z", 5),
                DataPoint.of("2024-01-10T00:00:00Z", 10));

            List<TimedPoint> kept = WindowFilter.filter(points, JANUARY);

            assertEquals(List.of(20.0, 5.0, 10.0), kept.stream().map(TimedPoint::value).toList());
        }

        @Test
        @DisplayName("unparseable point timestamps are dropped")
        void unparseableExcluded() {
            List<DataPoint> points = List.of(
                DataPoint.of("not-a-date", 1),
                DataPoint.of(null, 2),
                DataPoint.of("2024-01-02T00:00:00Z", 3));

            List<TimedPoint> kept = WindowFilter.filter(points, JANUARY);

            assertEquals(1, kept.size());
            assertEquals(3.0, kept.get(0).value());
        }

        @Test
        @DisplayName("offset, local and date-only timestamps are normalised to UTC instants")
        void mixedFormats() {
            List<DataPoint> points = List.of(
                DataPoint.of("2024-01-01T02:00:00+02:00", 1),
                DataPoint.of("2024-01-10T12:30:00", 2),
                DataPoint.of("2024-01-20", 3));

            List<TimedPoint> kept = WindowFilter.filter(points, JANUARY);

            assertEquals(3, kept.size());
            assertEquals(Instant.parse("2024-01-01T00:00:00Z"), kept.get(0).instant());
            assertEquals(Instant.parse("2024-01-10T12:30:00Z"), kept.get(1).instant());
            assertEquals(Instant.parse("2024-01-20T00:00:00Z"), kept.get(2).instant());
        }

        @Test
        @DisplayName("reversed window matches nothing")
        void reversedWindow() {
            TimeWindow reversed = TimeWindow.of("2024-01-31T00:00:00Z", "2024-01-01T00:00:00Z");
            List<DataPoint> points = List.of(DataPoint.of("2024-01-15T00:00:00Z", 1));

            assertTrue(WindowFilter.filter(points, reversed).isEmpty());
        }

        @Test
        @DisplayName("unparseable window bound matches nothing")
        void unparseableBound() {
            TimeWindow broken = TimeWindow.of("yesterday", "2024-01-31T00:00:00Z");
            List<DataPoint> points = List.of(DataPoint.of("2024-01-15T00:00:00Z", 1));

            assertTrue(WindowFilter.filter(points, broken).isEmpty());
        }

        @Test
        @DisplayName("null or empty point list → empty result")
        void emptyInput() {
            assertTrue(WindowFilter.filter(null, JANUARY).isEmpty());
            assertTrue(WindowFilter.filter(Collections.emptyList(), JANUARY).isEmpty());
        }

        @Test
        @DisplayName("missing window → TrendAnalysisException")
        void missingWindow() {
            TrendAnalysisException e = assertThrows(TrendAnalysisException.class,
                () -> WindowFilter.filter(List.of(DataPoint.of("2024-01-15T00:00:00Z", 1)), null));
            assertEquals("window", e.getStage());
        }
    }

    @Nested
    @DisplayName("SeriesSorter")
    class SorterTests {

        @Test
        @DisplayName("sorts ascending and keeps equal timestamps in input order")
        void stableAscending() {
            List<DataPoint> points = List.of(
                DataPoint.of("2024-01-03T00:00:00Z", 3),
                DataPoint.of("2024-01-01T00:00:00Z", 1),
                DataPoint.of("2024-01-02T00:00:00Z", 21),
                DataPoint.of("2024-01-02T00:00:00Z", 22));

            List<TimedPoint> sorted = SeriesSorter.sort(WindowFilter.filter(points, JANUARY));

            assertEquals(List.of(1.0, 21.0, 22.0, 3.0), sorted.stream().map(TimedPoint::value).toList());
        }
    }

    @Nested
    @DisplayName("Timestamps")
    class TimestampTests {

        @Test
        @DisplayName("format() always renders milliseconds and Z")
        void formatMillis() {
            assertEquals("1970-01-01T00:00:00.000Z", Timestamps.format(0L));
            assertEquals("2024-01-05T00:00:00.000Z",
                Timestamps.format(Instant.parse("2024-01-05T00:00:00Z").toEpochMilli()));
        }

        @Test
        @DisplayName("parse() rejects blank input")
        void blank() {
            assertTrue(Timestamps.parse("  ").isEmpty());
        }
    }
}
