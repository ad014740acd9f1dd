package com.portfoliotracker.engine.domain.scoring;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Portfolio-level aggregate of the per-symbol assessments.
 */
@Value
@Builder
public class PortfolioInsights {

    double totalValue;
    double weightedAnnualReturn;
    double weightedVolatility;
    double averageSharpeRatio;
    String portfolioGrade;
    String portfolioGradeDescription;

    List<String> strongBuys;
    List<String> buyMore;
    List<String> holds;
    List<String> considerSells;
    int totalStocks;

    List<String> highRiskStocks;
    double highRiskExposurePercent;
    String riskLevel;

    String strategy;
    String strategyDescription;
}
