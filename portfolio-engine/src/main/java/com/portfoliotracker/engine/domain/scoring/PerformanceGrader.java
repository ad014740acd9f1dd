package com.portfoliotracker.engine.domain.scoring;

import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Grades a position from weighted point buckets: return 35, Sharpe 25, volatility 20,
 * drawdown 10 and Sortino 10.
 */
@RequiredArgsConstructor
public class PerformanceGrader {

    private final ScoringTables tables;

    public PerformanceGrader() {
        this(ScoringTables.DEFAULT);
    }

    /**
     * @param inputs    metrics of the position
     * @param riskScore the position's risk score, used only for the qualitative risk label
     */
    public PerformanceGrade grade(ScoringInputs inputs, int riskScore) {
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        breakdown.put("return_points", tables.getGradeReturn().score(inputs.getAnnualReturn()));
        breakdown.put("sharpe_points", tables.getGradeSharpe().score(inputs.getSharpeRatio()));
        breakdown.put("volatility_points", tables.getGradeVolatility().score(inputs.getVolatility()));
        breakdown.put("drawdown_points", tables.getGradeDrawdown().score(inputs.getMaxDrawdown()));
        breakdown.put("sortino_points", tables.getGradeSortino().score(inputs.sortinoOrDefault()));

        int total = breakdown.values().stream().mapToInt(Integer::intValue).sum();

        return PerformanceGrade.builder()
                .grade(Grade.forScore(total))
                .totalScore(total)
                .scoreBreakdown(breakdown)
                .riskQuality(riskQuality(riskScore))
                .returnQuality(returnQuality(inputs.getAnnualReturn()))
                .build();
    }

    private static String riskQuality(int riskScore) {
        if (riskScore >= 70) {
            return "Low";
        }
        return riskScore >= 50 ? "Moderate" : "High";
    }

    private static String returnQuality(double annualReturn) {
        if (annualReturn > 20) {
            return "Excellent";
        } else if (annualReturn > 10) {
            return "Good";
        } else if (annualReturn > 0) {
            return "Fair";
        }
        return "Poor";
    }
}
