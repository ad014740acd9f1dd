package com.portfoliotracker.engine.domain.scoring;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Final recommendation for a position together with the rules that produced it.
 */
@Value
@Builder
public class InvestmentSignal {

    SignalAction baseAction;
    SignalAction action;
    String strength;
    String confidence;
    int confidenceScore;
    String reasoning;
    List<FiredRule> firedRules;
}
