package com.portfoliotracker.engine.domain.scoring;

import com.portfoliotracker.engine.domain.RiskProfile;
import lombok.Builder;
import lombok.Value;

/**
 * Scoring bundle for one held symbol.
 */
@Value
@Builder
public class PositionAssessment {

    String symbol;
    RiskProfile riskProfile;
    double currentPerformance;
    long daysHeld;
    double costBasis;
    double currentValue;
    double averagePurchasePrice;
    RiskScore riskScore;
    PerformanceGrade performanceGrade;
    InvestmentSignal investmentSignal;
    PositionRecommendation positionRecommendation;
}
