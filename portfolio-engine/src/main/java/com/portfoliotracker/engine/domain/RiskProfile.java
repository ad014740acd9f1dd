package com.portfoliotracker.engine.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Risk and performance figures derived from a daily return series. All values except
 * {@code sharpeRatio} and {@code sortinoRatio} are percentages.
 */
@Value
@Builder
public class RiskProfile {

    double volatility;
    double annualizedReturn;
    double sharpeRatio;
    double sortinoRatio;
    double maxDrawdown;
    double var95;
    int sampleSize;
}
