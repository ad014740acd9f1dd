package com.portfoliotracker.engine.domain;

import java.util.Arrays;

/**
 * Price-history window used for risk analysis, charts and market comparison.
 */
public enum AnalysisPeriod {
    ONE_MONTH("1mo", 30),
    THREE_MONTHS("3mo", 90),
    SIX_MONTHS("6mo", 180),
    ONE_YEAR("1y", 365),
    TWO_YEARS("2y", 730),
    FIVE_YEARS("5y", 1825);

    private final String code;
    private final int days;

    AnalysisPeriod(String code, int days) {
        this.code = code;
        this.days = days;
    }

    public String getCode() {
        return code;
    }

    public int getDays() {
        return days;
    }

    /**
     * Resolve a period code; unknown or missing codes fall back to one year.
     */
    public static AnalysisPeriod fromCode(String code) {
        return Arrays.stream(values())
                .filter(period -> period.code.equalsIgnoreCase(code))
                .findFirst()
                .orElse(ONE_YEAR);
    }
}
