package com.portfoliotracker.engine.domain.scoring;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Letter grades with their minimum total score, grade points and guidance.
 * Declared from best to worst; the first grade whose minimum is met applies.
 */
@Getter
@RequiredArgsConstructor
public enum Grade {
    A_PLUS("A+", 90, 4.3, "Outstanding: Exceptional returns with minimal risk",
            "TIER_1_PREMIUM", "Core holding - maximize position"),
    A("A", 85, 4.0, "Excellent: Strong returns with low risk",
            "TIER_1", "Core holding - large position"),
    A_MINUS("A-", 80, 3.7, "Very Good: Solid returns with manageable risk",
            "TIER_2", "Strong buy - significant position"),
    B_PLUS("B+", 75, 3.3, "Good: Positive returns with moderate risk",
            "TIER_2", "Buy - moderate position"),
    B("B", 65, 3.0, "Fair: Decent returns with acceptable risk",
            "TIER_3", "Hold - maintain position"),
    B_MINUS("B-", 55, 2.7, "Below Average: Mixed performance",
            "TIER_3", "Monitor closely"),
    C_PLUS("C+", 45, 2.3, "Weak: Underperforming with elevated risk",
            "TIER_4", "Consider reducing position"),
    C("C", 35, 2.0, "Poor: Negative returns with high risk",
            "TIER_4", "Reduce position significantly"),
    D("D", 25, 1.0, "Very Poor: Large losses with very high risk",
            "TIER_5", "Consider selling"),
    F("F", Integer.MIN_VALUE, 0.0, "Failing: Severe losses with extreme risk",
            "TIER_5", "Sell immediately");

    private final String label;
    private final int minScore;
    private final double gradePoints;
    private final String description;
    private final String investmentTier;
    private final String recommendation;

    public static Grade forScore(int totalScore) {
        for (Grade grade : values()) {
            if (totalScore >= grade.minScore) {
                return grade;
            }
        }
        return F;
    }
}
