package com.portfoliotracker.engine.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for chart indicators and summary.
 */
class TechnicalIndicatorsTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    @Test
    void testSimpleMovingAverage_NullUntilWindowFull() {
        List<Double> sma = TechnicalIndicators.simpleMovingAverage(Arrays.asList(1.0, 2.0, 3.0, 4.0, 5.0), 3);

        assertNull(sma.get(0));
        assertNull(sma.get(1));
        assertEquals(2.0, sma.get(2), 1e-12);
        assertEquals(3.0, sma.get(3), 1e-12);
        assertEquals(4.0, sma.get(4), 1e-12);
    }

    @Test
    void testDailyReturns_FirstEntryAndZeroCloseAreNull() {
        List<Double> returns = TechnicalIndicators.dailyReturns(Arrays.asList(100.0, 110.0, 0.0, 5.0));

        assertNull(returns.get(0));
        assertEquals(0.1, returns.get(1), 1e-12);
        assertEquals(-1.0, returns.get(2), 1e-12);
        assertNull(returns.get(3), "A step from a zero close has no defined return");
    }

    @Test
    void testRollingVolatility_SampleDeviationAnnualised() {
        // Arrange
        List<Double> returns = Arrays.asList(null, 0.01, -0.01, 0.01);

        // Act
        List<Double> volatility = TechnicalIndicators.rollingVolatility(returns, 2);

        // Assert
        double expected = Math.sqrt(0.0002) * Math.sqrt(252);
        assertNull(volatility.get(0));
        assertNull(volatility.get(1), "Window holding the missing first return stays null");
        assertEquals(expected, volatility.get(2), 1e-12);
        assertEquals(expected, volatility.get(3), 1e-12);
    }

    @Test
    void testRollingVolatility_WindowTooSmall() {
        assertThrows(IllegalArgumentException.class,
                () -> TechnicalIndicators.rollingVolatility(List.of(0.01), 1));
    }

    @Test
    void testChartPoints_IndicatorsStartWhenWindowsFill() {
        // Arrange: closes 1..60
        List<PriceBar> bars = new ArrayList<>();
        for (int i = 1; i <= 60; i++) {
            bars.add(bar(START.plusDays(i - 1), i, 1000));
        }

        // Act
        List<ChartPoint> points = TechnicalIndicators.chartPoints(bars);

        // Assert
        assertEquals(60, points.size());
        assertNull(points.get(18).getSma20());
        assertEquals(10.5, points.get(19).getSma20(), 1e-9);
        assertNull(points.get(48).getSma50());
        assertEquals(25.5, points.get(49).getSma50(), 1e-9);
        assertNull(points.get(0).getDailyReturn());
        assertEquals(100.0, points.get(1).getDailyReturn(), 1e-9);
        assertNull(points.get(19).getVolatility());
        assertNotNull(points.get(20).getVolatility());
        assertEquals(START.plusDays(59), points.get(59).getDate());
    }

    @Test
    void testSummarize() {
        List<PriceBar> bars = List.of(
                bar(START, 100, 1000),
                bar(START.plusDays(1), 120, 2000),
                bar(START.plusDays(2), 90, 3000),
                bar(START.plusDays(3), 110, 4001));

        ChartSummary summary = TechnicalIndicators.summarize(bars);

        assertEquals(110.0, summary.getLatestPrice());
        assertEquals(10.0, summary.getPeriodReturn(), 1e-9);
        assertEquals(120.0, summary.getMaxPrice());
        assertEquals(90.0, summary.getMinPrice());
        assertEquals(2500L, summary.getAverageVolume());
        assertEquals(4, summary.getDataPoints());
    }

    @Test
    void testSummarize_EmptySeriesRejected() {
        assertThrows(IllegalArgumentException.class, () -> TechnicalIndicators.summarize(List.of()));
    }

    private static PriceBar bar(LocalDate date, double close, double volume) {
        return PriceBar.builder()
                .symbol("THYAO")
                .date(date)
                .open(close)
                .high(close)
                .low(close)
                .close(close)
                .volume(volume)
                .build();
    }
}
