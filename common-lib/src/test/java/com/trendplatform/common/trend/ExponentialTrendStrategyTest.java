package com.trendplatform.common.trend;

import com.trendplatform.common.model.TrendType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialTrendStrategyTest {

    @Test
    @DisplayName("C·e^(k·i) → growth rate ≈ k, confidence ≈ 1")
    void recoversGrowthRate() {
        ExponentialTrend trend = ExponentialTrendStrategy.fit(SeriesFixtures.values(25, i -> 2.0 * Math.exp(0.1 * i)));

        assertEquals(0.1, trend.growthRate(), 1e-9);
        assertEquals(Math.log(2.0), trend.logIntercept(), 1e-9);
        assertEquals(1.0, trend.confidence(), 1e-9);
        assertEquals(0.1, trend.strength(), 1e-9);
        assertEquals(TrendType.UPWARD, trend.trendType());
    }

    @Test
    @DisplayName("decay → DOWNWARD with direction −1")
    void decay() {
        ExponentialTrend trend = ExponentialTrendStrategy.fit(SeriesFixtures.values(25, i -> 500 * Math.exp(-0.05 * i)));

        assertEquals(-0.05, trend.growthRate(), 1e-9);
        assertEquals(-1.0, trend.direction());
        assertEquals(TrendType.DOWNWARD, trend.trendType());
    }

    @Test
    @DisplayName("zero and negative values are floored, never producing NaN")
    void flooredValues() {
        ExponentialTrend trend = ExponentialTrendStrategy.fit(new double[]{0, -5, 0, -1});

        assertEquals(0.0, trend.growthRate(), 1e-12);
        assertEquals(0.0, trend.confidence());
        assertEquals(TrendType.STABLE, trend.trendType());
        assertFalse(Double.isNaN(trend.logIntercept()));
    }

    @Test
    @DisplayName("flat series at a non-representable level → zero confidence, not 1")
    void constantSeriesAtInexactLevel() {
        assertEquals(0.0, ExponentialTrendStrategy.fit(SeriesFixtures.values(10, i -> 0.1)).confidence());
        assertEquals(0.0, ExponentialTrendStrategy.fit(SeriesFixtures.values(97, i -> 0.1)).confidence());
        assertEquals(0.0, ExponentialTrendStrategy.fit(SeriesFixtures.values(25, i -> 7.7)).confidence());
        assertEquals(0.0, ExponentialTrendStrategy.fit(SeriesFixtures.values(7, i -> 123.456)).confidence());
    }
}
