package com.portfoliotracker.engine.domain;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Calculator for risk and performance metrics over daily fractional returns.
 */
@Slf4j
public class PerformanceMetrics {

    public static final int TRADING_DAYS_PER_YEAR = 252;

    public static final int DEFAULT_MIN_SAMPLE_SIZE = 5;

    /**
     * Build a full risk profile, or an insufficient-data error when fewer than
     * {@code minSampleSize} returns are available.
     */
    public static CalculationResult<RiskProfile> riskProfile(List<Double> returns, double annualizedReturn,
                                                             int minSampleSize) {
        if (returns == null || returns.size() < minSampleSize) {
            int size = returns == null ? 0 : returns.size();
            return CalculationResult.error("Insufficient data: " + size
                    + " daily returns available, at least " + minSampleSize + " required");
        }

        double volatility = calculateVolatility(returns);

        return CalculationResult.ok(RiskProfile.builder()
                .volatility(volatility)
                .annualizedReturn(annualizedReturn)
                .sharpeRatio(calculateSharpeRatio(annualizedReturn, volatility))
                .sortinoRatio(calculateSortinoRatio(returns, annualizedReturn))
                .maxDrawdown(calculateMaxDrawdown(returns))
                .var95(calculateValueAtRisk(returns, 5.0))
                .sampleSize(returns.size())
                .build());
    }

    /**
     * Risk profile on the market path, annualising the mean daily return.
     */
    public static CalculationResult<RiskProfile> riskProfile(List<Double> returns, int minSampleSize) {
        if (returns == null || returns.size() < minSampleSize) {
            return riskProfile(returns, 0.0, minSampleSize);
        }
        return riskProfile(returns, calculateAnnualizedReturn(returns), minSampleSize);
    }

    /**
     * Calculate total return percentage.
     */
    public static double calculateTotalReturn(double costBasis, double currentValue) {
        if (costBasis <= 0) {
            return 0.0;
        }
        return (currentValue - costBasis) / costBasis * 100;
    }

    /**
     * Annualised volatility in percent: population standard deviation times sqrt(252).
     */
    public static double calculateVolatility(List<Double> returns) {
        if (returns.isEmpty()) {
            return 0.0;
        }
        return standardDeviation(returns) * Math.sqrt(TRADING_DAYS_PER_YEAR) * 100;
    }

    /**
     * Compound annual growth from cost basis to current value over {@code daysHeld}, in percent.
     * Degenerate inputs (non-positive base, value or holding period, non-finite result) give 0.
     */
    public static double calculateAnnualizedReturn(double costBasis, double currentValue, long daysHeld) {
        if (daysHeld <= 0 || costBasis <= 0 || currentValue <= 0) {
            return 0.0;
        }

        double growth = Math.pow(currentValue / costBasis, 365.0 / daysHeld) - 1;
        if (Double.isNaN(growth) || Double.isInfinite(growth)) {
            log.debug("Annualized return undefined for cost {} value {} days {}", costBasis, currentValue, daysHeld);
            return 0.0;
        }
        return growth * 100;
    }

    /**
     * Annualised arithmetic mean of daily returns, in percent.
     */
    public static double calculateAnnualizedReturn(List<Double> returns) {
        if (returns.isEmpty()) {
            return 0.0;
        }
        return mean(returns) * TRADING_DAYS_PER_YEAR * 100;
    }

    /**
     * Sharpe ratio without risk-free adjustment: annualised return over annualised volatility.
     */
    public static double calculateSharpeRatio(double annualizedReturn, double volatility) {
        if (volatility == 0) {
            return 0.0;
        }
        return annualizedReturn / volatility;
    }

    /**
     * Sortino ratio: annualised return over annualised downside deviation (target 0).
     */
    public static double calculateSortinoRatio(List<Double> returns, double annualizedReturn) {
        if (returns.isEmpty()) {
            return 0.0;
        }

        double sumSquares = 0.0;
        for (double r : returns) {
            if (r < 0) {
                sumSquares += r * r;
            }
        }
        double downside = Math.sqrt(sumSquares / returns.size()) * Math.sqrt(TRADING_DAYS_PER_YEAR) * 100;

        if (downside == 0) {
            return 0.0;
        }
        return annualizedReturn / downside;
    }

    /**
     * Largest peak-to-trough decline of the wealth index built from {@code returns}, as a
     * negative percentage. Never positive.
     */
    public static double calculateMaxDrawdown(List<Double> returns) {
        double wealth = 1.0;
        double peak = Double.NEGATIVE_INFINITY;
        double maxDrawdown = 0.0;

        for (double r : returns) {
            wealth *= (1 + r);
            peak = Math.max(peak, wealth);

            if (peak > 0) {
                double drawdown = (wealth / peak - 1) * 100;
                maxDrawdown = Math.min(maxDrawdown, drawdown);
            }
        }

        return maxDrawdown;
    }

    /**
     * Historical value at risk: the {@code percentile}-th percentile of returns in percent.
     */
    public static double calculateValueAtRisk(List<Double> returns, double percentile) {
        if (returns.isEmpty()) {
            return 0.0;
        }
        List<Double> scaled = new ArrayList<>(returns.size());
        for (double r : returns) {
            scaled.add(r * 100);
        }
        return percentile(scaled, percentile);
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     */
    static double percentile(List<Double> values, double percentile) {
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(Double::compare);

        double rank = percentile / 100.0 * (sorted.size() - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted.get(lower);
        }
        double weight = rank - lower;
        return sorted.get(lower) + (sorted.get(upper) - sorted.get(lower)) * weight;
    }

    private static double mean(List<Double> values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    private static double standardDeviation(List<Double> values) {
        double mean = mean(values);
        double sumSquaredDiff = 0.0;
        for (double v : values) {
            sumSquaredDiff += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSquaredDiff / values.size());
    }
}
