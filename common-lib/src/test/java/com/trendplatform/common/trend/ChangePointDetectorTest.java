package com.trendplatform.common.trend;

import com.trendplatform.common.model.ChangePoint;
import com.trendplatform.common.model.ChangePointType;
import com.trendplatform.common.model.Sensitivity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChangePointDetectorTest {

    @Test
    @DisplayName("V-shaped series → deceleration into the trough, reversals around it")
    void vShape() {
        List<ChangePoint> points = ChangePointDetector.detect(
            SeriesFixtures.timed(SeriesFixtures.daily(10, 8, 6, 4, 2, 4, 6, 8, 10)), null);

        assertEquals(List.of(ChangePointType.DECELERATION, ChangePointType.REVERSAL, ChangePointType.REVERSAL),
            points.stream().map(ChangePoint::type).toList());
        assertEquals(SeriesFixtures.day(4), points.get(1).timestamp());
        assertEquals(4.0, points.get(1).significance());
    }

    @Test
    @DisplayName("steepening series → acceleration")
    void steepening() {
        List<ChangePoint> points = ChangePointDetector.detect(
            SeriesFixtures.timed(SeriesFixtures.daily(0, 1, 2, 3, 5, 7, 9)), Sensitivity.MEDIUM);

        assertEquals(3, points.size());
        assertTrue(points.stream().allMatch(p -> p.type() == ChangePointType.ACCELERATION));
    }

    @Test
    @DisplayName("straight line → no change points")
    void straightLine() {
        assertTrue(ChangePointDetector.detect(
            SeriesFixtures.timed(SeriesFixtures.daily(12, i -> 2 * i)), Sensitivity.HIGH).isEmpty());
    }

    @Test
    @DisplayName("a 0.12 slope shift is visible at high sensitivity but not at low")
    void sensitivity() {
        var series = SeriesFixtures.timed(SeriesFixtures.daily(0, 0, 0.12, 0.24, 0.36));

        assertEquals(1, ChangePointDetector.detect(series, Sensitivity.HIGH).size());
        assertTrue(ChangePointDetector.detect(series, Sensitivity.LOW).isEmpty());
    }
}
