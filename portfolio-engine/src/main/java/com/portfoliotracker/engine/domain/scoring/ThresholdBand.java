package com.portfoliotracker.engine.domain.scoring;

import lombok.Value;

/**
 * One row of a scoring table: a value range and the points it earns.
 */
@Value
public class ThresholdBand {

    public enum Comparison {
        BELOW,
        ABOVE,
        BETWEEN
    }

    Comparison comparison;
    double lower;
    double upper;
    int points;

    /**
     * Matches values strictly below {@code bound}.
     */
    public static ThresholdBand below(double bound, int points) {
        return new ThresholdBand(Comparison.BELOW, Double.NEGATIVE_INFINITY, bound, points);
    }

    /**
     * Matches values strictly above {@code bound}.
     */
    public static ThresholdBand above(double bound, int points) {
        return new ThresholdBand(Comparison.ABOVE, bound, Double.POSITIVE_INFINITY, points);
    }

    /**
     * Matches values in the closed range {@code [lower, upper]}.
     */
    public static ThresholdBand between(double lower, double upper, int points) {
        return new ThresholdBand(Comparison.BETWEEN, lower, upper, points);
    }

    public boolean matches(double value) {
        return switch (comparison) {
            case BELOW -> value < upper;
            case ABOVE -> value > lower;
            case BETWEEN -> value >= lower && value <= upper;
        };
    }
}
