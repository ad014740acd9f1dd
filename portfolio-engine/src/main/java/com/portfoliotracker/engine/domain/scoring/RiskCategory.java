package com.portfoliotracker.engine.domain.scoring;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Buckets of the 0-100 risk score, best first. Higher scores mean lower risk.
 */
@Getter
@RequiredArgsConstructor
public enum RiskCategory {
    VERY_LOW(80, "Excellent risk-reward profile"),
    LOW(65, "Good risk-reward profile"),
    MODERATE(50, "Balanced risk-reward profile"),
    HIGH(35, "Higher risk investment"),
    VERY_HIGH(Integer.MIN_VALUE, "High risk investment");

    private final int minScore;
    private final String description;

    public static RiskCategory forScore(int score) {
        for (RiskCategory category : values()) {
            if (score >= category.minScore) {
                return category;
            }
        }
        return VERY_HIGH;
    }
}
