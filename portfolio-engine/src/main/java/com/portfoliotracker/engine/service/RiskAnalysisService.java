package com.portfoliotracker.engine.service;

import com.portfoliotracker.engine.domain.*;
import com.portfoliotracker.engine.domain.scoring.*;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;

/**
 * Risk and scoring pipeline over the held positions.
 *
 * <p>Returns are measured against the investor's own average cost: the first step runs from
 * the average purchase price to the first close of the window, later steps close to close.
 * The annualized return is the position's CAGR since purchase.
 */
@Service
@Slf4j
public class RiskAnalysisService {

    private static final String MDC_SYMBOL = "symbol";

    private final LedgerService ledgerService;
    private final MarketDataService marketDataService;
    private final PositionService positionService;
    private final RiskScorer riskScorer;
    private final PerformanceGrader performanceGrader;
    private final InvestmentSignalGenerator signalGenerator;
    private final EngineMetricsService metricsService;
    private final Clock clock;
    private final int minSampleSize;

    public RiskAnalysisService(LedgerService ledgerService,
                               MarketDataService marketDataService,
                               PositionService positionService,
                               RiskScorer riskScorer,
                               PerformanceGrader performanceGrader,
                               InvestmentSignalGenerator signalGenerator,
                               EngineMetricsService metricsService,
                               Clock clock,
                               @Value("${portfolio.risk.min-sample-size:5}") int minSampleSize) {
        this.ledgerService = ledgerService;
        this.marketDataService = marketDataService;
        this.positionService = positionService;
        this.riskScorer = riskScorer;
        this.performanceGrader = performanceGrader;
        this.signalGenerator = signalGenerator;
        this.metricsService = metricsService;
        this.clock = clock;
        this.minSampleSize = minSampleSize;
    }

    /**
     * Assess every held symbol over {@code period}. Symbols without enough data are skipped
     * and listed with the reason.
     *
     * @return the report, or an error when nothing is held
     */
    public CalculationResult<RiskReport> analyze(AnalysisPeriod period) {
        long startTime = System.currentTimeMillis();
        List<Transaction> ledger = ledgerService.getLedger();
        Map<String, Double> holdings = LedgerReplay.currentHoldings(ledger);
        if (holdings.isEmpty()) {
            return CalculationResult.error("No stocks currently held in portfolio");
        }

        LocalDate today = LocalDate.now(clock);
        LocalDate start = today.minusDays(period.getDays());
        PriceSeries adjusted = marketDataService.getSplitAdjustedPrices(holdings.keySet(), start, today);

        Map<String, PositionAssessment> assessments = new TreeMap<>();
        Map<String, String> skipped = new TreeMap<>();

        for (String symbol : holdings.keySet()) {
            MDC.put(MDC_SYMBOL, symbol);
            try {
                CalculationResult<PositionAssessment> assessment = assess(ledger, symbol, adjusted, today);
                if (assessment.isOk()) {
                    assessments.put(symbol, assessment.getValue());
                } else {
                    log.warn("Skipping {}: {}", symbol, assessment.getError());
                    skipped.put(symbol, assessment.getError());
                    metricsService.recordRiskSymbolSkipped();
                }
            } catch (RuntimeException e) {
                log.error("Error calculating risk metrics for {}", symbol, e);
                skipped.put(symbol, "Error calculating risk metrics: " + e.getMessage());
                metricsService.recordRiskSymbolSkipped();
            } finally {
                MDC.remove(MDC_SYMBOL);
            }
        }

        PortfolioInsights insights = PortfolioInsightsCalculator
                .calculate(new ArrayList<>(assessments.values()))
                .orElse(null);

        long elapsed = System.currentTimeMillis() - startTime;
        metricsService.recordRiskRun(elapsed);
        log.info("Risk analysis over {}: {} assessed, {} skipped in {}ms",
                period.getCode(), assessments.size(), skipped.size(), elapsed);

        return CalculationResult.ok(RiskReport.builder()
                .period(period)
                .assessments(assessments)
                .portfolioInsights(insights)
                .skippedSymbols(skipped)
                .build());
    }

    CalculationResult<PositionAssessment> assess(List<Transaction> ledger, String symbol,
                                                 PriceSeries adjusted, LocalDate today) {
        NavigableMap<LocalDate, Double> closes = adjusted.closes(symbol);
        if (closes.isEmpty()) {
            return CalculationResult.error("No price history for " + symbol);
        }

        // Adjustment only touches closes before a split, so the latest close is the raw one
        CalculationResult<PositionSummary> summaryResult =
                positionService.summarize(ledger, symbol, closes.lastEntry().getValue(), today);
        if (!summaryResult.isOk()) {
            return CalculationResult.error(summaryResult.getError());
        }
        PositionSummary summary = summaryResult.getValue();

        double averageCost = summary.getAveragePurchasePrice();
        if (closes.size() < minSampleSize || averageCost <= 0) {
            return CalculationResult.error("Insufficient data: " + closes.size()
                    + " closes, average cost " + averageCost);
        }

        List<Double> returns = ReturnSeries.relativeToCost(closes.values(), averageCost);
        CalculationResult<RiskProfile> profileResult =
                PerformanceMetrics.riskProfile(returns, summary.getAnnualizedReturn(), minSampleSize);
        if (!profileResult.isOk()) {
            return CalculationResult.error(profileResult.getError());
        }
        RiskProfile profile = profileResult.getValue();

        ScoringInputs inputs = ScoringInputs.from(profile);
        RiskScore riskScore = riskScorer.score(inputs);
        PerformanceGrade grade = performanceGrader.grade(inputs, riskScore.getScore());

        InvestmentSignal signal = signalGenerator.generate(SignalInputs.builder()
                .performance(summary.getReturnPercentage())
                .volatility(profile.getVolatility())
                .sharpeRatio(profile.getSharpeRatio())
                .maxDrawdown(profile.getMaxDrawdown())
                .annualReturn(profile.getAnnualizedReturn())
                .daysHeld(Math.max(summary.getDaysHeld(), 1))
                .riskScore(riskScore.getScore())
                .gradePoints(grade.getGradePoints())
                .build());

        log.debug("Assessed {}: risk {} grade {} signal {}",
                symbol, riskScore.getScore(), grade.getLabel(), signal.getAction());

        return CalculationResult.ok(PositionAssessment.builder()
                .symbol(symbol)
                .riskProfile(profile)
                .currentPerformance(summary.getReturnPercentage())
                .daysHeld(summary.getDaysHeld())
                .costBasis(summary.getCostBasis())
                .currentValue(summary.getCurrentValue())
                .averagePurchasePrice(averageCost)
                .riskScore(riskScore)
                .performanceGrade(grade)
                .investmentSignal(signal)
                .positionRecommendation(PositionRecommendation.recommend(
                        riskScore.getScore(), summary.getReturnPercentage()))
                .build());
    }
}
