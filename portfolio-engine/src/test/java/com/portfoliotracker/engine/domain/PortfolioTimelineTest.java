package com.portfoliotracker.engine.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static com.portfoliotracker.engine.domain.TestLedgers.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the daily valuation curve.
 */
class PortfolioTimelineTest {

    private static final Function<LocalDate, Optional<Double>> NO_FX = day -> Optional.empty();

    private static LocalDate jan(int day) {
        return LocalDate.of(2024, 1, day);
    }

    private final List<Transaction> thyaoLedger = List.of(
            deposit(10000, jan(1)),
            buy("THYAO", 50, 100, jan(5)));

    private final PriceSeries thyaoPrices = PriceSeries.builder()
            .price("THYAO", jan(5), 100)
            .price("THYAO", jan(10), 120)
            .build();

    @Test
    void testBuild_ThyaoScenario() {
        List<ValuationPoint> points = PortfolioTimeline.build(thyaoLedger, thyaoPrices, jan(1), jan(10), NO_FX);

        ValuationPoint last = points.get(points.size() - 1);
        assertEquals(jan(10), last.getDate());
        assertEquals(6000.0, last.getValue(), 1e-9);
        assertEquals(6000.0, last.getPositions().get("THYAO"), 1e-9);
        assertEquals(5000.0, last.getCashBalance(), 1e-9);

        CostBasis basis = FifoCostBasisCalculator.costBasisFifo(thyaoLedger, "THYAO", 50);
        assertEquals(5000.0, basis.getTotalCost(), 1e-9);
        assertEquals(100.0, basis.getAverageUnitCost(), 1e-9);
        assertEquals(1000.0, last.getValue() - basis.getTotalCost(), 1e-9);
        assertEquals(20.0, PerformanceMetrics.calculateTotalReturn(basis.getTotalCost(), last.getValue()), 1e-9);
    }

    @Test
    void testBuild_SkipsDaysWithoutAnyPriceAndForwardFills() {
        List<ValuationPoint> points = PortfolioTimeline.build(thyaoLedger, thyaoPrices, jan(1), jan(10), NO_FX);

        assertEquals(6, points.size());
        assertEquals(jan(5), points.get(0).getDate());
        assertEquals(5000.0, points.get(0).getValue(), 1e-9);
        // 01-09 has no close of its own and uses the 01-05 close
        assertEquals(jan(9), points.get(4).getDate());
        assertEquals(5000.0, points.get(4).getValue(), 1e-9);
    }

    @Test
    void testBuild_SeedsHoldingsFromTransactionsBeforeStart() {
        List<ValuationPoint> points = PortfolioTimeline.build(thyaoLedger, thyaoPrices, jan(8), jan(10), NO_FX);

        assertEquals(3, points.size());
        assertEquals(5000.0, points.get(0).getValue(), 1e-9);
        assertEquals(5000.0, points.get(0).getCashBalance(), 1e-9);
    }

    @Test
    void testBuild_SecondaryValueUsesRateOrZero() {
        Function<LocalDate, Optional<Double>> fx = day -> day.isBefore(jan(10)) ? Optional.empty() : Optional.of(30.0);

        List<ValuationPoint> points = PortfolioTimeline.build(thyaoLedger, thyaoPrices, jan(5), jan(10), fx);

        assertEquals(0.0, points.get(0).getSecondaryValue(), 1e-9);
        assertEquals(200.0, points.get(points.size() - 1).getSecondaryValue(), 1e-9);
    }

    @Test
    void testBuild_PointValueEqualsSumOfPositions() {
        List<Transaction> ledger = List.of(
                buy("THYAO", 12.5, 101.3, jan(2)),
                buy("ASELS", 7.25, 48.1, jan(3)),
                sell("THYAO", 2.2, 110, jan(6)),
                split("ASELS", 7.25, jan(8)));
        PriceSeries prices = PriceSeries.builder()
                .price("THYAO", jan(2), 101.37)
                .price("THYAO", jan(4), 103.91)
                .price("THYAO", jan(9), 99.13)
                .price("ASELS", jan(3), 48.77)
                .price("ASELS", jan(8), 24.51)
                .build();

        List<ValuationPoint> points = PortfolioTimeline.build(ledger, prices, jan(1), jan(12), NO_FX);

        assertFalse(points.isEmpty());
        for (ValuationPoint point : points) {
            double sum = point.getPositions().values().stream().mapToDouble(Double::doubleValue).sum();
            assertEquals(point.getValue(), sum, 1e-6);
        }
    }

    @Test
    void testBuild_IsIdempotent() {
        List<ValuationPoint> first = PortfolioTimeline.build(thyaoLedger, thyaoPrices, jan(1), jan(10), NO_FX);
        List<ValuationPoint> second = PortfolioTimeline.build(thyaoLedger, thyaoPrices, jan(1), jan(10), NO_FX);

        assertEquals(first, second);
    }

    @Test
    void testBuild_SoldOutSymbolLeavesBreakdown() {
        List<Transaction> ledger = List.of(
                buy("THYAO", 50, 100, jan(5)),
                sell("THYAO", 50, 120, jan(10)));

        List<ValuationPoint> points = PortfolioTimeline.build(ledger, thyaoPrices, jan(5), jan(10), NO_FX);

        ValuationPoint last = points.get(points.size() - 1);
        assertTrue(last.getPositions().isEmpty());
        assertEquals(0.0, last.getValue(), 1e-9);
    }

    @Test
    void testBuild_EndBeforeStartIsEmpty() {
        assertTrue(PortfolioTimeline.build(thyaoLedger, thyaoPrices, jan(10), jan(1), NO_FX).isEmpty());
    }
}
