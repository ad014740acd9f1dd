package com.portfoliotracker.engine.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for rebasing stock and index closes onto a common percentage axis.
 */
class MarketComparisonCalculatorTest {

    private static LocalDate jan(int day) {
        return LocalDate.of(2024, 1, day);
    }

    @Test
    void testChangeSeries_RelativeToFirstClose() {
        List<ComparisonPoint> points = MarketComparisonCalculator.changeSeries(closes(100, 110, 95));

        assertEquals(3, points.size());
        assertEquals(0.0, points.get(0).getChangePct(), 1e-12);
        assertEquals(10.0, points.get(1).getChangePct(), 1e-9);
        assertEquals(-5.0, points.get(2).getChangePct(), 1e-9);
        assertEquals(95.0, points.get(2).getClose());
        assertEquals(jan(3), points.get(2).getDate());
    }

    @Test
    void testChangeSeries_SingleCloseHasNoChange() {
        List<ComparisonPoint> points = MarketComparisonCalculator.changeSeries(closes(100));

        assertEquals(1, points.size());
        assertEquals(0.0, points.get(0).getChangePct());
    }

    @Test
    void testChangeSeries_ZeroBaseHasNoChange() {
        List<ComparisonPoint> points = MarketComparisonCalculator.changeSeries(closes(0, 10));

        assertEquals(0.0, points.get(1).getChangePct());
    }

    @Test
    void testCompare_DropsIndicesWithoutHistory() {
        // Arrange
        Map<String, NavigableMap<LocalDate, Double>> indices = new LinkedHashMap<>();
        indices.put("BIST 100", closes(8000, 8400));
        indices.put("BIST 30", new TreeMap<>());

        // Act
        MarketComparison comparison = MarketComparisonCalculator.compare("THYAO", "1y", closes(200, 250), indices);

        // Assert
        assertEquals("THYAO", comparison.getSymbol());
        assertEquals("1y", comparison.getPeriod());
        assertEquals(25.0, comparison.getStockData().get(1).getChangePct(), 1e-9);
        assertEquals(List.of("BIST 100"), List.copyOf(comparison.getIndices().keySet()));
        assertEquals(5.0, comparison.getIndices().get("BIST 100").get(1).getChangePct(), 1e-9);
    }

    private static NavigableMap<LocalDate, Double> closes(double... values) {
        NavigableMap<LocalDate, Double> closes = new TreeMap<>();
        for (int i = 0; i < values.length; i++) {
            closes.put(jan(i + 1), values[i]);
        }
        return closes;
    }
}
