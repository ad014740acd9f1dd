package com.portfoliotracker.engine.domain.scoring;

import lombok.Builder;
import lombok.Value;

import static com.portfoliotracker.engine.domain.scoring.ThresholdBand.above;
import static com.portfoliotracker.engine.domain.scoring.ThresholdBand.below;
import static com.portfoliotracker.engine.domain.scoring.ThresholdBand.between;

/**
 * Threshold tables used by the risk scorer and the grader. Volatility, drawdown and return
 * inputs are percentages; Sharpe, Sortino and beta are plain ratios.
 */
@Value
@Builder(toBuilder = true)
public class ScoringTables {

    int riskBaseScore;
    BandTable riskVolatility;
    BandTable riskSharpe;
    BandTable riskDrawdown;
    BandTable riskSortino;
    BandTable riskBeta;
    BandTable riskMomentum;
    BandTable riskAnnualReturn;

    BandTable gradeReturn;
    BandTable gradeSharpe;
    BandTable gradeVolatility;
    BandTable gradeDrawdown;
    BandTable gradeSortino;

    public static final ScoringTables DEFAULT = ScoringTables.builder()
            .riskBaseScore(50)
            .riskVolatility(BandTable.of(-20,
                    below(15, 20), below(25, 15), below(35, 10), below(50, 0), below(70, -10)))
            .riskSharpe(BandTable.of(-15,
                    above(1.5, 20), above(1.0, 15), above(0.5, 10), above(0, 5), above(-0.5, -5)))
            .riskDrawdown(BandTable.of(-20,
                    above(-5, 20), above(-10, 15), above(-20, 10), above(-35, 0), above(-50, -10)))
            .riskSortino(BandTable.of(-5,
                    above(1.0, 8), above(0.5, 5), above(0, 2)))
            .riskBeta(BandTable.of(-5,
                    between(0.8, 1.2, 8), between(0.6, 1.4, 5), below(0.6, 3)))
            .riskMomentum(BandTable.of(-9,
                    above(15, 9), above(5, 6), above(-5, 3), above(-15, -3)))
            .riskAnnualReturn(BandTable.of(-15,
                    above(25, 15), above(15, 12), above(10, 8), above(5, 5), above(0, 2), above(-10, -5)))
            .gradeReturn(BandTable.of(0,
                    above(30, 35), above(20, 30), above(15, 25), above(10, 20), above(5, 15), above(0, 10),
                    above(-10, 5)))
            .gradeSharpe(BandTable.of(0,
                    above(2.0, 25), above(1.5, 22), above(1.0, 18), above(0.5, 14), above(0, 10), above(-0.5, 5)))
            .gradeVolatility(BandTable.of(0,
                    below(15, 20), below(25, 17), below(35, 14), below(50, 10), below(70, 6)))
            .gradeDrawdown(BandTable.of(0,
                    above(-10, 10), above(-20, 8), above(-35, 5), above(-50, 2)))
            .gradeSortino(BandTable.of(0,
                    above(1.5, 10), above(1.0, 8), above(0.5, 5), above(0, 3)))
            .build();
}
