package com.portfoliotracker.engine.domain;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the market and cost-relative return series.
 */
class ReturnSeriesTest {

    @Test
    void testMarket_DayOverDayChanges() {
        List<Double> returns = ReturnSeries.market(Arrays.asList(100.0, 110.0, 99.0));

        assertEquals(2, returns.size());
        assertEquals(0.1, returns.get(0), 1e-12);
        assertEquals(-0.1, returns.get(1), 1e-12);
    }

    @Test
    void testMarket_SkipsStepsFromNonPositiveClose() {
        List<Double> returns = ReturnSeries.market(Arrays.asList(0.0, 10.0, 11.0));

        assertEquals(1, returns.size());
        assertEquals(0.1, returns.get(0), 1e-12);
    }

    @Test
    void testRelativeToCost_FirstStepMeasuredFromAverageCost() {
        List<Double> returns = ReturnSeries.relativeToCost(Arrays.asList(100.0, 110.0), 80.0);

        assertEquals(2, returns.size());
        assertEquals(0.25, returns.get(0), 1e-12);
        assertEquals(0.1, returns.get(1), 1e-12);
    }

    @Test
    void testCumulativeVersusCost() {
        List<Double> performance = ReturnSeries.cumulativeVersusCost(Arrays.asList(100.0, 120.0, 90.0), 100.0);

        assertEquals(3, performance.size());
        assertEquals(0.0, performance.get(0), 1e-12);
        assertEquals(0.2, performance.get(1), 1e-12);
        assertEquals(-0.1, performance.get(2), 1e-12);
    }

    @Test
    void testCumulativeVersusCost_ZeroCostGivesZeros() {
        List<Double> performance = ReturnSeries.cumulativeVersusCost(Arrays.asList(100.0, 120.0), 0.0);

        assertEquals(Arrays.asList(0.0, 0.0), performance);
    }
}
