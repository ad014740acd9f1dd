package com.portfoliotracker.engine.domain.scoring;

import lombok.RequiredArgsConstructor;
import lombok.Value;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import static com.portfoliotracker.engine.domain.scoring.ActionAdjustment.unless;
import static com.portfoliotracker.engine.domain.scoring.ActionAdjustment.when;
import static com.portfoliotracker.engine.domain.scoring.SignalAction.*;

/**
 * Derives an action signal from position metrics.
 *
 * <p>The base action comes from performance against cost basis alone. Rule groups are then
 * applied in a fixed order; in each group the first matching rule adds its confidence delta
 * and may move the action. Every fired rule is recorded.
 */
@RequiredArgsConstructor
public class InvestmentSignalGenerator {

    public static final List<SignalRuleGroup> DEFAULT_RULES = List.of(
            SignalRuleGroup.of("sharpe",
                    rule("excellent_sharpe", in -> in.getSharpeRatio() > 1.5,
                            "Excellent risk-adjusted returns (Sharpe > 1.5)", 20,
                            when(EnumSet.of(HOLD, MONITOR_CLOSELY), BUY_MORE)),
                    rule("good_sharpe", in -> in.getSharpeRatio() > 1.0,
                            "Good risk-adjusted returns (Sharpe > 1.0)", 15, ActionAdjustment.NONE),
                    rule("fair_sharpe", in -> in.getSharpeRatio() > 0.5,
                            "Fair risk-adjusted returns", 5, ActionAdjustment.NONE),
                    rule("negative_sharpe", in -> in.getSharpeRatio() < 0,
                            "Poor risk-adjusted returns", -15,
                            (action, in) -> action == BUY_MORE ? HOLD
                                    : action == HOLD ? MONITOR_CLOSELY : action)),
            SignalRuleGroup.of("volatility",
                    rule("very_high_volatility", in -> in.getVolatility() > 60,
                            "Very high volatility (>60%)", -15, when(SignalAction.BUYING, BUY_SMALL)),
                    rule("high_volatility", in -> in.getVolatility() > 40,
                            "High volatility (>40%)", -10, when(STRONG_BUY, BUY_MORE)),
                    rule("low_volatility", in -> in.getVolatility() < 25,
                            "Low volatility (<25%)", 10,
                            (action, in) -> action == HOLD && in.getPerformance() > 0 ? BUY_MORE : action)),
            SignalRuleGroup.of("drawdown",
                    rule("severe_drawdown", in -> in.getMaxDrawdown() < -40,
                            "Severe historical drawdowns (-40%+)", -20, when(SignalAction.BUYING, BUY_SMALL)),
                    rule("large_drawdown", in -> in.getMaxDrawdown() < -25,
                            "Large historical drawdowns (-25%)", -10, ActionAdjustment.NONE),
                    rule("minimal_drawdown", in -> in.getMaxDrawdown() > -10,
                            "Minimal historical drawdowns", 15, ActionAdjustment.NONE)),
            SignalRuleGroup.of("holding_period",
                    rule("recent_purchase", in -> in.getDaysHeld() < 90,
                            "Recently acquired (< 3 months)", 5, ActionAdjustment.NONE),
                    SignalRule.builder()
                            .name("long_term_underperformer")
                            .condition(in -> in.getDaysHeld() > 730 && in.getPerformance() < -15)
                            .reason("Long-term holding (2+ years)")
                            .reason("Long-term underperformance suggests reconsideration")
                            .confidenceDelta(-10)
                            .build(),
                    rule("long_term_holding", in -> in.getDaysHeld() > 730,
                            "Long-term holding (2+ years)", 5, ActionAdjustment.NONE)),
            SignalRuleGroup.of("risk_score",
                    rule("very_low_risk", in -> in.getRiskScore() >= 80,
                            "Very low risk profile", 15, when(MONITOR_CLOSELY, HOLD)),
                    rule("low_risk", in -> in.getRiskScore() >= 65,
                            "Low risk profile", 10, ActionAdjustment.NONE),
                    rule("high_risk", in -> in.getRiskScore() < 40,
                            "High risk profile", -15, when(SignalAction.BUYING, BUY_SMALL))),
            SignalRuleGroup.of("grade",
                    rule("a_grade", in -> in.getGradePoints() >= 4.0,
                            "A-grade investment quality", 20, when(HOLD, BUY_MORE)),
                    rule("b_grade", in -> in.getGradePoints() >= 3.0,
                            "B-grade investment quality", 10, ActionAdjustment.NONE),
                    rule("poor_grade", in -> in.getGradePoints() < 2.0,
                            "Poor investment grade (C- or below)", -20,
                            unless(SignalAction.SELLING, REDUCE_POSITION))),
            SignalRuleGroup.of("momentum",
                    rule("positive_momentum", in -> in.momentumOrDefault() > 15,
                            "Strong positive momentum", 10, ActionAdjustment.NONE),
                    rule("negative_momentum", in -> in.momentumOrDefault() < -15,
                            "Negative momentum trend", -10, ActionAdjustment.NONE)));

    private final List<SignalRuleGroup> ruleGroups;

    public InvestmentSignalGenerator() {
        this(DEFAULT_RULES);
    }

    public InvestmentSignal generate(SignalInputs inputs) {
        BaseClassification base = classify(inputs.getPerformance());

        List<String> reasoning = new ArrayList<>();
        reasoning.add(base.getReason());
        List<FiredRule> fired = new ArrayList<>();
        int confidenceScore = base.getConfidence();
        SignalAction action = base.getAction();

        for (SignalRuleGroup group : ruleGroups) {
            Optional<SignalRule> match = group.firstMatch(inputs);
            if (match.isEmpty()) {
                continue;
            }
            SignalRule rule = match.get();
            SignalAction adjusted = rule.getAdjustment().adjust(action, inputs);

            reasoning.addAll(rule.getReasons());
            confidenceScore += rule.getConfidenceDelta();
            fired.add(new FiredRule(group.getName(), rule.getName(), action, adjusted, rule.getConfidenceDelta()));
            action = adjusted;
        }

        return InvestmentSignal.builder()
                .baseAction(base.getAction())
                .action(action)
                .strength(strength(action, confidenceScore))
                .confidence(confidenceLabel(confidenceScore))
                .confidenceScore(confidenceScore)
                .reasoning(String.join("; ", reasoning))
                .firedRules(List.copyOf(fired))
                .build();
    }

    /**
     * Initial action from performance against cost basis, before any adjustment.
     */
    static BaseClassification classify(double performance) {
        if (performance > 30) {
            return new BaseClassification(STRONG_BUY, "Exceptional performance (+30%)", 25);
        } else if (performance > 15) {
            return new BaseClassification(BUY_MORE, "Strong performance (+15%)", 20);
        } else if (performance > 5) {
            return new BaseClassification(HOLD, "Positive performance (+5%)", 10);
        } else if (performance > -10) {
            return new BaseClassification(MONITOR_CLOSELY, "Minor losses (-10%)", 5);
        } else if (performance > -25) {
            return new BaseClassification(REDUCE_POSITION, "Significant losses (-25%)", -10);
        }
        return new BaseClassification(CONSIDER_SELL, "Major losses (-25%+)", -20);
    }

    static String confidenceLabel(int confidenceScore) {
        if (confidenceScore >= 60) {
            return "VERY_HIGH";
        } else if (confidenceScore >= 40) {
            return "HIGH";
        } else if (confidenceScore >= 20) {
            return "MEDIUM";
        } else if (confidenceScore >= 0) {
            return "LOW";
        }
        return "VERY_LOW";
    }

    static String strength(SignalAction action, int confidenceScore) {
        if (confidenceScore >= 50 && SignalAction.BUYING.contains(action)) {
            return "STRONG_POSITIVE";
        } else if (confidenceScore >= 30 && (action == BUY_MORE || action == BUY_SMALL)) {
            return "POSITIVE";
        } else if (SignalAction.SELLING.contains(action)) {
            return "NEGATIVE";
        }
        return "NEUTRAL";
    }

    private static SignalRule rule(String name, Predicate<SignalInputs> condition,
                                   String reason, int confidenceDelta, ActionAdjustment adjustment) {
        return SignalRule.builder()
                .name(name)
                .condition(condition)
                .reason(reason)
                .confidenceDelta(confidenceDelta)
                .adjustment(adjustment)
                .build();
    }

    @Value
    static class BaseClassification {
        SignalAction action;
        String reason;
        int confidence;
    }
}
