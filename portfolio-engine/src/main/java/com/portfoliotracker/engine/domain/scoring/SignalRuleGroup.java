package com.portfoliotracker.engine.domain.scoring;

import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Mutually exclusive rules over one metric; at most the first matching rule fires.
 */
@Value
public class SignalRuleGroup {

    String name;
    List<SignalRule> rules;

    public static SignalRuleGroup of(String name, SignalRule... rules) {
        return new SignalRuleGroup(name, List.of(rules));
    }

    public Optional<SignalRule> firstMatch(SignalInputs inputs) {
        return rules.stream().filter(rule -> rule.matches(inputs)).findFirst();
    }
}
