package com.portfoliotracker.engine.service;

import com.portfoliotracker.engine.config.EngineProperties;
import com.portfoliotracker.engine.domain.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;

/**
 * Holdings snapshots and the daily valuation curve of the portfolio.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PortfolioValuationService {

    private final LedgerService ledgerService;
    private final MarketDataService marketDataService;
    private final EngineMetricsService metricsService;
    private final EngineProperties properties;
    private final Clock clock;

    /**
     * Holdings and cash as of {@code asOf} inclusive, or today when null.
     */
    public HoldingSnapshot holdings(LocalDate asOf) {
        LocalDate date = asOf != null ? asOf : LocalDate.now(clock);
        return LedgerReplay.snapshotAsOf(ledgerService.getLedger(), date);
    }

    /**
     * Daily valuation from {@code start} to {@code end}. A null start means the first ledger
     * date, a null end means today. An empty ledger gives an empty curve.
     */
    public List<ValuationPoint> timeline(LocalDate start, LocalDate end) {
        long startTime = System.currentTimeMillis();
        List<Transaction> ledger = ledgerService.getLedger();
        if (ledger.isEmpty()) {
            log.info("Ledger is empty; no valuation curve to build");
            return List.of();
        }

        LocalDate from = start != null ? start : ledger.get(0).getDate();
        LocalDate to = end != null ? end : LocalDate.now(clock);
        if (to.isBefore(from)) {
            return List.of();
        }

        Set<String> symbols = new TreeSet<>();
        for (Transaction tx : ledger) {
            if (tx.hasSymbol() && tx.getType().affectsShares()) {
                symbols.add(tx.getSymbol());
            }
        }

        // both series start with the last close on or before the first day
        PriceSeries prices = marketDataService.getPrices(symbols, from, to);

        String pair = MarketDataService.pairSymbol(properties.getSecondaryCurrency(), properties.getBaseCurrency());
        PriceSeries fx = marketDataService.getPrices(List.of(pair), from, to);

        List<ValuationPoint> points = PortfolioTimeline.build(ledger, prices, from, to,
                day -> fx.asOf(pair, day));

        long elapsed = System.currentTimeMillis() - startTime;
        metricsService.recordValuation(elapsed);
        log.info("Built valuation curve {} to {}: {} points for {} symbols in {}ms",
                from, to, points.size(), symbols.size(), elapsed);
        return points;
    }

    /**
     * Cumulative performance of each split-adjusted close against the current average cost,
     * in percent, keyed by date.
     */
    public CalculationResult<SortedMap<LocalDate, Double>> performanceVersusCost(String symbol,
                                                                                 LocalDate start, LocalDate end) {
        List<Transaction> ledger = ledgerService.getLedger();
        LocalDate to = end != null ? end : LocalDate.now(clock);
        LocalDate from = start != null ? start : to.minusDays(365);

        double quantity = LedgerReplay.currentHoldings(ledger).getOrDefault(symbol, 0.0);
        CostBasis costBasis = FifoCostBasisCalculator.costBasisFifo(ledger, symbol, quantity);
        if (costBasis.getAverageUnitCost() <= 0) {
            return CalculationResult.error("No cost basis for " + symbol);
        }

        NavigableMap<LocalDate, Double> closes = marketDataService
                .getSplitAdjustedPrices(List.of(symbol), from, to)
                .closes(symbol);
        if (closes.isEmpty()) {
            return CalculationResult.error("No price history for " + symbol + " between " + from + " and " + to);
        }

        List<Double> performance = ReturnSeries.cumulativeVersusCost(closes.values(), costBasis.getAverageUnitCost());
        SortedMap<LocalDate, Double> byDate = new TreeMap<>();
        int i = 0;
        for (LocalDate date : closes.keySet()) {
            byDate.put(date, performance.get(i++) * 100);
        }
        return CalculationResult.ok(byDate);
    }
}
