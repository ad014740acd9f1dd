package com.portfoliotracker.engine.domain.scoring;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Bounded 0-100 risk score (higher is better) with the points each metric contributed.
 */
@Value
@Builder
public class RiskScore {

    int score;
    RiskCategory category;
    Map<String, Integer> componentScores;

    public String getDescription() {
        return category.getDescription();
    }
}
