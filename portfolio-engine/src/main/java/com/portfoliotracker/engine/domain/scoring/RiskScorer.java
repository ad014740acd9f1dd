package com.portfoliotracker.engine.domain.scoring;

import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sums signed band points per metric onto a neutral base and clamps the result to [0, 100].
 */
@RequiredArgsConstructor
public class RiskScorer {

    private final ScoringTables tables;

    public RiskScorer() {
        this(ScoringTables.DEFAULT);
    }

    public RiskScore score(ScoringInputs inputs) {
        Map<String, Integer> components = new LinkedHashMap<>();
        components.put("volatility", tables.getRiskVolatility().score(inputs.getVolatility()));
        components.put("sharpe_ratio", tables.getRiskSharpe().score(inputs.getSharpeRatio()));
        components.put("max_drawdown", tables.getRiskDrawdown().score(inputs.getMaxDrawdown()));
        components.put("sortino_ratio", tables.getRiskSortino().score(inputs.sortinoOrDefault()));
        components.put("beta", tables.getRiskBeta().score(inputs.betaOrDefault()));
        components.put("momentum_6m", tables.getRiskMomentum().score(inputs.momentumOrDefault()));
        components.put("annual_return", tables.getRiskAnnualReturn().score(inputs.getAnnualReturn()));

        int total = tables.getRiskBaseScore();
        for (int points : components.values()) {
            total += points;
        }
        int clamped = Math.max(0, Math.min(100, total));

        return RiskScore.builder()
                .score(clamped)
                .category(RiskCategory.forScore(clamped))
                .componentScores(components)
                .build();
    }
}
