package com.portfoliotracker.engine.domain.scoring;

import com.portfoliotracker.engine.domain.RiskProfile;
import lombok.Builder;
import lombok.Value;

/**
 * Metrics consumed by the scorers. Sortino, beta and momentum are optional; when absent the
 * scorers use 0, 1.0 and 0 respectively.
 */
@Value
@Builder(toBuilder = true)
public class ScoringInputs {

    double volatility;
    double sharpeRatio;
    double maxDrawdown;
    double annualReturn;
    Double sortinoRatio;
    Double beta;
    Double momentum6m;

    public static ScoringInputs from(RiskProfile profile) {
        return ScoringInputs.builder()
                .volatility(profile.getVolatility())
                .sharpeRatio(profile.getSharpeRatio())
                .maxDrawdown(profile.getMaxDrawdown())
                .annualReturn(profile.getAnnualizedReturn())
                .sortinoRatio(profile.getSortinoRatio())
                .build();
    }

    public double sortinoOrDefault() {
        return sortinoRatio != null ? sortinoRatio : 0.0;
    }

    public double betaOrDefault() {
        return beta != null ? beta : 1.0;
    }

    public double momentumOrDefault() {
        return momentum6m != null ? momentum6m : 0.0;
    }
}
