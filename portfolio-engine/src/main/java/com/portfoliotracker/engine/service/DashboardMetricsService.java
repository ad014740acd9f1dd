package com.portfoliotracker.engine.service;

import com.portfoliotracker.engine.domain.*;
import com.portfoliotracker.engine.domain.DashboardMetrics.ConcentrationRisk;
import com.portfoliotracker.engine.domain.DashboardMetrics.PortfolioHealth;
import com.portfoliotracker.engine.domain.DashboardMetrics.PositionWeight;
import com.portfoliotracker.engine.domain.DashboardMetrics.StockPerformance;
import com.portfoliotracker.engine.infrastructure.ResultCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Dashboard metrics behind a short read-through cache, so repeated page loads within the
 * TTL see identical numbers.
 */
@Service
@Slf4j
public class DashboardMetricsService {

    static final String CACHE_KEY = "dashboard_metrics";
    static final int PERFORMANCE_WINDOW_DAYS = 30;
    static final int MOVERS_LIMIT = 5;
    static final int CONCENTRATION_POSITIONS = 3;

    private static final Comparator<StockPerformance> BEST_FIRST = Comparator
            .comparingDouble(StockPerformance::getPerformance30d)
            .thenComparingDouble(StockPerformance::getPositionValue)
            .thenComparing(StockPerformance::getSymbol)
            .reversed();

    private static final Comparator<StockPerformance> WORST_FIRST = Comparator
            .comparingDouble(StockPerformance::getPerformance30d)
            .thenComparing(Comparator.comparingDouble(StockPerformance::getPositionValue).reversed())
            .thenComparing(StockPerformance::getSymbol);

    private static final Comparator<StockPerformance> LARGEST_FIRST = Comparator
            .comparingDouble(StockPerformance::getPositionValue)
            .thenComparing(StockPerformance::getSymbol)
            .reversed();

    private final LedgerService ledgerService;
    private final MarketDataService marketDataService;
    private final PositionService positionService;
    private final ResultCache resultCache;
    private final EngineMetricsService metricsService;
    private final Clock clock;
    private final Duration cacheTtl;

    public DashboardMetricsService(LedgerService ledgerService,
                                   MarketDataService marketDataService,
                                   PositionService positionService,
                                   ResultCache resultCache,
                                   EngineMetricsService metricsService,
                                   Clock clock,
                                   @Value("${portfolio.dashboard.cache-ttl:30s}") Duration cacheTtl) {
        this.ledgerService = ledgerService;
        this.marketDataService = marketDataService;
        this.positionService = positionService;
        this.resultCache = resultCache;
        this.metricsService = metricsService;
        this.clock = clock;
        this.cacheTtl = cacheTtl;
    }

    public CalculationResult<DashboardMetrics> dashboard() {
        Optional<DashboardMetrics> cached = resultCache.get(CACHE_KEY, DashboardMetrics.class);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return CalculationResult.ok(cached.get());
        }
        metricsService.recordCacheMiss();

        CalculationResult<DashboardMetrics> result = compute();
        if (result.isOk()) {
            resultCache.set(CACHE_KEY, result.getValue(), cacheTtl);
        }
        return result;
    }

    CalculationResult<DashboardMetrics> compute() {
        List<Transaction> ledger = ledgerService.getLedger();
        Map<String, Double> holdings = LedgerReplay.currentHoldings(ledger);
        if (holdings.isEmpty()) {
            return CalculationResult.error("No stocks currently held in portfolio");
        }

        LocalDate today = LocalDate.now(clock);
        PriceSeries window = marketDataService.getSplitAdjustedPrices(
                holdings.keySet(), today.minusDays(PERFORMANCE_WINDOW_DAYS), today);

        List<StockPerformance> performances = new ArrayList<>();
        double totalValue = 0.0;

        for (Map.Entry<String, Double> holding : holdings.entrySet()) {
            String symbol = holding.getKey();
            double quantity = holding.getValue();
            double currentPrice = marketDataService.latestPrice(symbol, today).orElse(0.0);
            if (currentPrice <= 0) {
                log.warn("Could not get current price for {}. Skipping from dashboard metrics.", symbol);
                continue;
            }

            double positionValue = quantity * currentPrice;
            totalValue += positionValue;
            performances.add(performance(ledger, symbol, quantity, currentPrice, positionValue,
                    window.closes(symbol), today));
        }

        DashboardMetrics metrics = DashboardMetrics.builder()
                .asOf(today)
                .portfolioHealth(health(holdings.size(), performances, totalValue))
                .topPerformers(performances.stream()
                        .filter(p -> p.getPerformance30d() >= 0)
                        .sorted(BEST_FIRST)
                        .limit(MOVERS_LIMIT)
                        .collect(Collectors.toList()))
                .worstPerformers(performances.stream()
                        .filter(p -> p.getPerformance30d() < 0)
                        .sorted(WORST_FIRST)
                        .limit(MOVERS_LIMIT)
                        .collect(Collectors.toList()))
                .concentrationRisk(concentration(performances, totalValue))
                .build();

        log.info("Dashboard metrics computed for {} holdings, health score {}",
                holdings.size(), metrics.getPortfolioHealth().getScore());
        return CalculationResult.ok(metrics);
    }

    private StockPerformance performance(List<Transaction> ledger, String symbol, double quantity,
                                         double currentPrice, double positionValue,
                                         NavigableMap<LocalDate, Double> closes, LocalDate today) {
        StockPerformance.StockPerformanceBuilder builder = StockPerformance.builder()
                .symbol(symbol)
                .positionValue(positionValue)
                .currentPrice(currentPrice);

        CalculationResult<PositionSummary> summary = positionService.summarize(ledger, symbol, currentPrice, today);
        if (!summary.isOk()) {
            return builder.build();
        }

        if (closes.size() >= 2) {
            double startPrice = closes.firstEntry().getValue();
            double endPrice = closes.lastEntry().getValue();
            if (startPrice > 0) {
                builder.performance30d((endPrice - startPrice) / startPrice * 100);
            }
            builder.gainLoss30d((endPrice - startPrice) * quantity);
        }

        return builder
                .userReturn(summary.getValue().getReturnPercentage())
                .daysHeld(summary.getValue().getDaysHeld())
                .annualizedReturn(summary.getValue().getAnnualizedReturn())
                .build();
    }

    /**
     * Health score: up to 40 points for the number of holdings, 40 for the share of positions
     * in profit and 20 for the share rising over the window, capped at 100.
     */
    static PortfolioHealth health(int numHoldings, List<StockPerformance> performances, double totalValue) {
        int positive = (int) performances.stream().filter(p -> p.getUserReturn() > 0).count();
        int positive30d = (int) performances.stream().filter(p -> p.getPerformance30d() > 0).count();

        double diversification = Math.min(numHoldings * 10, 40);
        double performance = performances.isEmpty() ? 0 : (double) positive / performances.size() * 40;
        double momentum = performances.isEmpty() ? 0 : (double) positive30d / performances.size() * 20;
        int score = (int) Math.round(diversification + performance + momentum);

        return PortfolioHealth.builder()
                .score(Math.min(score, 100))
                .numHoldings(numHoldings)
                .positive30dPerformers(positive30d)
                .positivePerformers(positive)
                .totalPerformers(performances.size())
                .totalValue(totalValue)
                .build();
    }

    static ConcentrationRisk concentration(List<StockPerformance> performances, double totalValue) {
        if (totalValue <= 0 || performances.isEmpty()) {
            return ConcentrationRisk.none();
        }

        List<StockPerformance> top = performances.stream()
                .sorted(LARGEST_FIRST)
                .limit(CONCENTRATION_POSITIONS)
                .collect(Collectors.toList());
        double topValue = top.stream().mapToDouble(StockPerformance::getPositionValue).sum();

        return ConcentrationRisk.builder()
                .concentrated(topValue / totalValue > 0.5)
                .top3Percentage(topValue / totalValue * 100)
                .maxPositionWeight(top.get(0).getPositionValue() / totalValue * 100)
                .positions(top.stream()
                        .map(p -> new PositionWeight(p.getSymbol(), p.getPositionValue() / totalValue * 100))
                        .collect(Collectors.toList()))
                .build();
    }
}
