package com.portfoliotracker.engine.domain.scoring;

import lombok.Value;

/**
 * Audit entry for a rule that fired while generating a signal.
 */
@Value
public class FiredRule {

    String group;
    String rule;
    SignalAction actionBefore;
    SignalAction actionAfter;
    int confidenceDelta;
}
