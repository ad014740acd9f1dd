package com.portfoliotracker.engine.domain.scoring;

import lombok.Value;

/**
 * Suggested position size as a share of the portfolio.
 */
@Value
public class PositionRecommendation {

    String size;
    String percentageOfPortfolio;
    String rationale;

    /**
     * Size from risk score and unrealised performance (percent).
     */
    public static PositionRecommendation recommend(int riskScore, double performance) {
        if (riskScore >= 70 && performance > 15) {
            return new PositionRecommendation("LARGE", "15-20%", "High-quality stock with strong performance");
        } else if (riskScore >= 60 && performance > 10) {
            return new PositionRecommendation("MEDIUM_LARGE", "10-15%", "Good stock with solid performance");
        } else if (riskScore >= 50 && performance > 0) {
            return new PositionRecommendation("MEDIUM", "5-10%", "Average stock, moderate allocation");
        } else if (riskScore >= 40) {
            return new PositionRecommendation("SMALL", "2-5%", "Higher risk, smaller position");
        }
        return new PositionRecommendation("MINIMAL", "1-3%",
                "High risk, very small position or consider selling");
    }
}
