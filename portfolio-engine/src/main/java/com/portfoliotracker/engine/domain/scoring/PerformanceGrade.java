package com.portfoliotracker.engine.domain.scoring;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Letter grade of a position with the point breakdown and a qualitative summary.
 */
@Value
@Builder
public class PerformanceGrade {

    @JsonIgnore
    Grade grade;
    int totalScore;
    Map<String, Integer> scoreBreakdown;
    String riskQuality;
    String returnQuality;

    public String getLabel() {
        return grade.getLabel();
    }

    public double getGradePoints() {
        return grade.getGradePoints();
    }

    public String getDescription() {
        return grade.getDescription();
    }

    public String getInvestmentTier() {
        return grade.getInvestmentTier();
    }

    public String getRecommendation() {
        return grade.getRecommendation();
    }

    public String getOverallAssessment() {
        return returnQuality + " returns with " + riskQuality.toLowerCase() + " risk";
    }
}
