package com.portfoliotracker.engine.domain.scoring;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.function.Predicate;

/**
 * A condition on the signal inputs with its reasoning, confidence change and action change.
 */
@Value
@Builder
public class SignalRule {

    String name;
    Predicate<SignalInputs> condition;
    @Singular
    List<String> reasons;
    int confidenceDelta;
    @Builder.Default
    ActionAdjustment adjustment = ActionAdjustment.NONE;

    public boolean matches(SignalInputs inputs) {
        return condition.test(inputs);
    }
}
