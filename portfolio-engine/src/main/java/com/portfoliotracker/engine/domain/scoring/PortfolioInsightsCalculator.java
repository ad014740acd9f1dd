package com.portfoliotracker.engine.domain.scoring;

import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Aggregates position assessments into value-weighted portfolio figures, a portfolio grade,
 * a concentration-of-risk reading and a strategy label.
 */
public final class PortfolioInsightsCalculator {

    static final int HIGH_RISK_SCORE = 40;

    private PortfolioInsightsCalculator() {
    }

    /**
     * Empty when there are no assessments.
     */
    public static Optional<PortfolioInsights> calculate(List<PositionAssessment> assessments) {
        if (assessments.isEmpty()) {
            return Optional.empty();
        }

        double totalValue = assessments.stream().mapToDouble(PositionAssessment::getCurrentValue).sum();
        double weightedReturn = totalValue > 0
                ? assessments.stream()
                        .mapToDouble(a -> a.getRiskProfile().getAnnualizedReturn() * a.getCurrentValue())
                        .sum() / totalValue
                : 0.0;
        double weightedVolatility = totalValue > 0
                ? assessments.stream()
                        .mapToDouble(a -> a.getRiskProfile().getVolatility() * a.getCurrentValue())
                        .sum() / totalValue
                : 0.0;
        double averageSharpe = assessments.stream()
                .mapToDouble(a -> a.getRiskProfile().getSharpeRatio())
                .average()
                .orElse(0.0);

        List<String> strongBuys = symbols(assessments, a -> action(a) == SignalAction.STRONG_BUY);
        List<String> buyMore = symbols(assessments, a -> action(a) == SignalAction.BUY_MORE);
        List<String> holds = symbols(assessments, a -> action(a) == SignalAction.HOLD);
        List<String> considerSells = symbols(assessments, a -> SignalAction.SELLING.contains(action(a)));

        List<String> highRisk = symbols(assessments, a -> a.getRiskScore().getScore() < HIGH_RISK_SCORE);
        double highRiskValue = assessments.stream()
                .filter(a -> a.getRiskScore().getScore() < HIGH_RISK_SCORE)
                .mapToDouble(PositionAssessment::getCurrentValue)
                .sum();
        double highRiskExposure = totalValue > 0 ? highRiskValue / totalValue * 100 : 0.0;

        Label grade = portfolioGrade(weightedReturn, weightedVolatility, averageSharpe);
        Label strategy = strategy(strongBuys.size(), buyMore.size(), holds.size(), considerSells.size(),
                weightedReturn, weightedVolatility);

        return Optional.of(PortfolioInsights.builder()
                .totalValue(totalValue)
                .weightedAnnualReturn(weightedReturn)
                .weightedVolatility(weightedVolatility)
                .averageSharpeRatio(averageSharpe)
                .portfolioGrade(grade.getCode())
                .portfolioGradeDescription(grade.getDescription())
                .strongBuys(strongBuys)
                .buyMore(buyMore)
                .holds(holds)
                .considerSells(considerSells)
                .totalStocks(assessments.size())
                .highRiskStocks(highRisk)
                .highRiskExposurePercent(highRiskExposure)
                .riskLevel(highRiskExposure > 40 ? "HIGH" : highRiskExposure > 20 ? "MEDIUM" : "LOW")
                .strategy(strategy.getCode())
                .strategyDescription(strategy.getDescription())
                .build());
    }

    static Label portfolioGrade(double weightedReturn, double weightedVolatility, double averageSharpe) {
        if (weightedReturn > 15 && weightedVolatility < 30 && averageSharpe > 0.5) {
            return new Label("A", "Excellent portfolio performance");
        } else if (weightedReturn > 10 && weightedVolatility < 40) {
            return new Label("B+", "Good portfolio performance");
        } else if (weightedReturn > 5) {
            return new Label("B", "Fair portfolio performance");
        } else if (weightedReturn > 0) {
            return new Label("C", "Below average performance");
        }
        return new Label("D", "Poor portfolio performance");
    }

    static Label strategy(int strongBuys, int buyMore, int holds, int considerSells,
                             double weightedReturn, double weightedVolatility) {
        int total = strongBuys + buyMore + holds + considerSells;

        if (strongBuys > 0 && weightedReturn > 10) {
            return new Label("AGGRESSIVE_GROWTH",
                    "Focus on " + strongBuys + " strong performers. Consider increasing positions.");
        } else if (buyMore > total * 0.4) {
            return new Label("MODERATE_GROWTH",
                    "Good opportunity to increase positions in " + buyMore + " stocks.");
        } else if (considerSells > total * 0.3) {
            return new Label("PORTFOLIO_CLEANUP",
                    "Consider reducing or selling " + considerSells + " underperforming stocks.");
        } else if (weightedVolatility > 50) {
            return new Label("RISK_REDUCTION",
                    "High portfolio volatility. Focus on stability and risk management.");
        }
        return new Label("BALANCED_HOLD", "Maintain current positions and monitor performance.");
    }

    @Value
    static class Label {
        String code;
        String description;
    }

    private static SignalAction action(PositionAssessment assessment) {
        return assessment.getInvestmentSignal().getAction();
    }

    private static List<String> symbols(List<PositionAssessment> assessments, Predicate<PositionAssessment> filter) {
        return assessments.stream()
                .filter(filter)
                .map(PositionAssessment::getSymbol)
                .collect(Collectors.toList());
    }
}
