package com.portfoliotracker.engine.domain;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Moving averages, daily returns and rolling volatility over a bar series, and the chart
 * built from them. Indicator lists are aligned with their input: an entry is null until
 * its window is full.
 */
public final class TechnicalIndicators {

    public static final int SHORT_WINDOW = 20;

    public static final int LONG_WINDOW = 50;

    public static final int VOLATILITY_WINDOW = 20;

    private TechnicalIndicators() {
    }

    /**
     * Chart rows for {@code bars}, which must be in date order.
     */
    public static List<ChartPoint> chartPoints(List<PriceBar> bars) {
        List<Double> closes = new ArrayList<>(bars.size());
        for (PriceBar bar : bars) {
            closes.add(bar.getClose());
        }

        List<Double> sma20 = simpleMovingAverage(closes, SHORT_WINDOW);
        List<Double> sma50 = simpleMovingAverage(closes, LONG_WINDOW);
        List<Double> returns = dailyReturns(closes);
        List<Double> volatility = rollingVolatility(returns, VOLATILITY_WINDOW);

        List<ChartPoint> points = new ArrayList<>(bars.size());
        for (int i = 0; i < bars.size(); i++) {
            PriceBar bar = bars.get(i);
            points.add(ChartPoint.builder()
                    .date(bar.getDate())
                    .open(bar.getOpen())
                    .high(bar.getHigh())
                    .low(bar.getLow())
                    .close(bar.getClose())
                    .volume(bar.getVolume())
                    .sma20(sma20.get(i))
                    .sma50(sma50.get(i))
                    .dailyReturn(percent(returns.get(i)))
                    .volatility(percent(volatility.get(i)))
                    .build());
        }
        return points;
    }

    /**
     * Summary over a non-empty bar series in date order.
     */
    public static ChartSummary summarize(List<PriceBar> bars) {
        if (bars.isEmpty()) {
            throw new IllegalArgumentException("Cannot summarize an empty price series");
        }

        double first = bars.get(0).getClose();
        double latest = bars.get(bars.size() - 1).getClose();
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        double volume = 0.0;
        for (PriceBar bar : bars) {
            max = Math.max(max, bar.getClose());
            min = Math.min(min, bar.getClose());
            volume += bar.getVolume();
        }

        return ChartSummary.builder()
                .latestPrice(latest)
                .periodReturn(first > 0 ? (latest - first) / first * 100 : 0.0)
                .maxPrice(max)
                .minPrice(min)
                .averageVolume((long) (volume / bars.size()))
                .dataPoints(bars.size())
                .build();
    }

    /**
     * Mean of the last {@code window} values at each position.
     */
    public static List<Double> simpleMovingAverage(List<Double> values, int window) {
        List<Double> averages = new ArrayList<>(values.size());
        Deque<Double> current = new ArrayDeque<>(window);
        double sum = 0.0;

        for (Double value : values) {
            current.addLast(value);
            sum += value;
            if (current.size() > window) {
                sum -= current.removeFirst();
            }
            averages.add(current.size() == window ? sum / window : null);
        }
        return averages;
    }

    /**
     * Fractional change from the previous close. The first entry, and any step from a
     * non-positive close, is null.
     */
    public static List<Double> dailyReturns(List<Double> closes) {
        List<Double> returns = new ArrayList<>(closes.size());
        Double previous = null;
        for (Double close : closes) {
            returns.add(previous != null && previous > 0 ? (close - previous) / previous : null);
            previous = close;
        }
        return returns;
    }

    /**
     * Annualised sample standard deviation of the last {@code window} returns, as a fraction.
     * Null while the window holds a missing return.
     */
    public static List<Double> rollingVolatility(List<Double> returns, int window) {
        if (window < 2) {
            throw new IllegalArgumentException("Volatility window must hold at least two returns: " + window);
        }

        List<Double> volatility = new ArrayList<>(returns.size());
        for (int i = 0; i < returns.size(); i++) {
            if (i + 1 < window) {
                volatility.add(null);
                continue;
            }
            List<Double> slice = returns.subList(i + 1 - window, i + 1);
            volatility.add(slice.contains(null)
                    ? null
                    : sampleStandardDeviation(slice) * Math.sqrt(PerformanceMetrics.TRADING_DAYS_PER_YEAR));
        }
        return volatility;
    }

    private static double sampleStandardDeviation(List<Double> values) {
        double mean = 0.0;
        for (double v : values) {
            mean += v;
        }
        mean /= values.size();

        double sumSquaredDiff = 0.0;
        for (double v : values) {
            sumSquaredDiff += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSquaredDiff / (values.size() - 1));
    }

    private static Double percent(Double fraction) {
        return fraction == null ? null : fraction * 100;
    }
}
