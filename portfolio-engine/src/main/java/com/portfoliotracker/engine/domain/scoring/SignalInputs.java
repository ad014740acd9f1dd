package com.portfoliotracker.engine.domain.scoring;

import lombok.Builder;
import lombok.Value;

/**
 * Metrics consumed by {@link InvestmentSignalGenerator}. {@code performance} is the
 * unrealised return against cost basis in percent.
 */
@Value
@Builder(toBuilder = true)
public class SignalInputs {

    double performance;
    double volatility;
    double sharpeRatio;
    double maxDrawdown;
    double annualReturn;
    long daysHeld;
    int riskScore;
    double gradePoints;
    Double momentum6m;

    public double momentumOrDefault() {
        return momentum6m != null ? momentum6m : 0.0;
    }
}
