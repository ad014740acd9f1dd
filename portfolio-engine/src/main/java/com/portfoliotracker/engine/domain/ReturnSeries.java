package com.portfoliotracker.engine.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Daily return series fed to {@link PerformanceMetrics}.
 *
 * <p>The market series measures each close against the previous close. The cost-relative
 * series measures the first close against the investor's average purchase price instead, so
 * the metrics describe the investor's own experience of the position.
 */
public final class ReturnSeries {

    private ReturnSeries() {
    }

    /**
     * Day-over-day fractional price changes. Steps from a non-positive close are skipped.
     */
    public static List<Double> market(Collection<Double> closes) {
        List<Double> returns = new ArrayList<>();
        Double previous = null;
        for (Double close : closes) {
            if (previous != null && previous > 0) {
                returns.add((close - previous) / previous);
            }
            previous = close;
        }
        return returns;
    }

    /**
     * Returns starting from the average cost basis: one more entry than {@link #market}.
     */
    public static List<Double> relativeToCost(Collection<Double> closes, double averageCost) {
        List<Double> returns = new ArrayList<>();
        double previous = averageCost;
        for (Double close : closes) {
            if (previous > 0) {
                returns.add((close - previous) / previous);
            }
            previous = close;
        }
        return returns;
    }

    /**
     * Cumulative fractional performance of each close against the average cost basis.
     */
    public static List<Double> cumulativeVersusCost(Collection<Double> closes, double averageCost) {
        List<Double> performance = new ArrayList<>();
        for (Double close : closes) {
            performance.add(averageCost > 0 ? (close - averageCost) / averageCost : 0.0);
        }
        return performance;
    }
}
