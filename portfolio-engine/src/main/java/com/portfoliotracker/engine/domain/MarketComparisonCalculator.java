package com.portfoliotracker.engine.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;

/**
 * Rebases close series onto their first close so a stock and its benchmarks can be read on
 * one percentage axis.
 */
public final class MarketComparisonCalculator {

    private MarketComparisonCalculator() {
    }

    /**
     * Percentage change of every close against the first one. A single close, or a
     * non-positive first close, gives zero change throughout.
     */
    public static List<ComparisonPoint> changeSeries(NavigableMap<LocalDate, Double> closes) {
        List<ComparisonPoint> points = new ArrayList<>(closes.size());
        if (closes.isEmpty()) {
            return points;
        }

        double base = closes.firstEntry().getValue();
        boolean rebase = closes.size() > 1 && base > 0;
        for (Map.Entry<LocalDate, Double> entry : closes.entrySet()) {
            double change = rebase ? (entry.getValue() - base) / base * 100 : 0.0;
            points.add(new ComparisonPoint(entry.getKey(), entry.getValue(), change));
        }
        return points;
    }

    /**
     * Comparison of {@code stockCloses} with each index series. Indices keep the iteration
     * order of {@code indexCloses}; empty ones are dropped.
     */
    public static MarketComparison compare(String symbol, String period,
                                           NavigableMap<LocalDate, Double> stockCloses,
                                           Map<String, NavigableMap<LocalDate, Double>> indexCloses) {
        Map<String, List<ComparisonPoint>> indices = new LinkedHashMap<>();
        indexCloses.forEach((name, closes) -> {
            if (!closes.isEmpty()) {
                indices.put(name, changeSeries(closes));
            }
        });

        return MarketComparison.builder()
                .symbol(symbol)
                .period(period)
                .stockData(changeSeries(stockCloses))
                .indices(indices)
                .build();
    }
}
