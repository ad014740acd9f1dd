package com.portfoliotracker.engine.domain.scoring;

import com.portfoliotracker.engine.domain.AnalysisPeriod;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Per-symbol assessments of the held positions, the portfolio insights drawn from them, and
 * the symbols that could not be assessed with the reason.
 */
@Value
@Builder
public class RiskReport {

    AnalysisPeriod period;
    Map<String, PositionAssessment> assessments;
    PortfolioInsights portfolioInsights;
    Map<String, String> skippedSymbols;
}
