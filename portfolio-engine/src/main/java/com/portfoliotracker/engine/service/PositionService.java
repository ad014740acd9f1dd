package com.portfoliotracker.engine.service;

import com.portfoliotracker.engine.config.EngineProperties;
import com.portfoliotracker.engine.domain.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * Position-level profit and loss: FIFO cost basis of the shares still held against their
 * latest close.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PositionService {

    private final LedgerService ledgerService;
    private final MarketDataService marketDataService;
    private final EngineProperties properties;
    private final Clock clock;

    /**
     * Summaries of every currently held symbol with portfolio totals in the base currency
     * and converted with the latest secondary-currency rate.
     */
    public PortfolioSummary portfolioSummary() {
        List<Transaction> ledger = ledgerService.getLedger();
        LocalDate today = LocalDate.now(clock);

        List<PositionSummary> positions = new ArrayList<>();
        List<String> unpriced = new ArrayList<>();
        for (Map.Entry<String, Double> holding : LedgerReplay.currentHoldings(ledger).entrySet()) {
            String symbol = holding.getKey();
            Optional<Double> price = marketDataService.latestPrice(symbol, today);
            if (price.isEmpty()) {
                log.warn("No price for {}; left out of portfolio totals", symbol);
                unpriced.add(symbol);
                continue;
            }
            summarize(ledger, symbol, price.get(), today).toOptional().ifPresent(positions::add);
        }

        double totalCost = positions.stream().mapToDouble(PositionSummary::getCostBasis).sum();
        double totalValue = positions.stream().mapToDouble(PositionSummary::getCurrentValue).sum();
        Optional<Double> rate = marketDataService.latestRate(properties.getSecondaryCurrency(),
                properties.getBaseCurrency());

        return PortfolioSummary.builder()
                .asOf(today)
                .positions(positions)
                .unpricedSymbols(unpriced)
                .totalCost(totalCost)
                .totalValue(totalValue)
                .totalProfitLoss(totalValue - totalCost)
                .totalReturnPercentage(PerformanceMetrics.calculateTotalReturn(totalCost, totalValue))
                .cashBalance(LedgerReplay.cashBalanceAsOf(ledger, today))
                .baseCurrency(properties.getBaseCurrency())
                .secondaryCurrency(properties.getSecondaryCurrency())
                .secondaryRate(rate.orElse(null))
                .totalValueSecondary(rate.map(r -> totalValue / r).orElse(0.0))
                .build();
    }

    /**
     * Performance of one symbol since purchase, priced at its latest close.
     */
    public CalculationResult<PositionSummary> performanceSincePurchase(String symbol) {
        List<Transaction> ledger = ledgerService.getLedger();
        LocalDate today = LocalDate.now(clock);
        return marketDataService.latestPrice(symbol, today)
                .map(price -> summarize(ledger, symbol, price, today))
                .orElseGet(() -> CalculationResult.error("Could not fetch current price for " + symbol));
    }

    /**
     * FIFO cost basis of the quantity of {@code symbol} currently held.
     */
    public CostBasis currentCostBasis(String symbol) {
        List<Transaction> ledger = ledgerService.getLedger();
        double quantity = LedgerReplay.currentHoldings(ledger).getOrDefault(symbol, 0.0);
        return FifoCostBasisCalculator.costBasisFifo(ledger, symbol, quantity);
    }

    /**
     * Summarize a held symbol at {@code currentPrice}. Days held count from the first BUY;
     * the annualized return is the CAGR of current value over cost basis.
     */
    public CalculationResult<PositionSummary> summarize(List<Transaction> ledger, String symbol,
                                                       double currentPrice, LocalDate today) {
        double quantity = LedgerReplay.holdingsAsOf(ledger, today).getOrDefault(symbol, 0.0);
        if (!LedgerReplay.isHeld(quantity)) {
            return CalculationResult.error("Stock not currently held: " + symbol);
        }
        if (currentPrice <= 0) {
            return CalculationResult.error("Could not fetch current price for " + symbol);
        }

        CostBasis costBasis = FifoCostBasisCalculator.costBasisFifo(ledger, symbol, quantity);
        double currentValue = quantity * currentPrice;
        double returnAmount = currentValue - costBasis.getTotalCost();

        Optional<LocalDate> firstPurchase = ledger.stream()
                .filter(tx -> tx.getType() == TransactionType.BUY && symbol.equals(tx.getSymbol()))
                .map(Transaction::getDate)
                .min(Comparator.naturalOrder());
        long daysHeld = firstPurchase.map(date -> ChronoUnit.DAYS.between(date, today)).orElse(0L);

        return CalculationResult.ok(PositionSummary.builder()
                .symbol(symbol)
                .quantity(quantity)
                .costBasis(costBasis.getTotalCost())
                .averagePurchasePrice(costBasis.getAverageUnitCost())
                .currentPrice(currentPrice)
                .currentValue(currentValue)
                .returnAmount(returnAmount)
                .returnPercentage(PerformanceMetrics.calculateTotalReturn(costBasis.getTotalCost(), currentValue))
                .firstPurchaseDate(firstPurchase.orElse(null))
                .daysHeld(daysHeld)
                .annualizedReturn(PerformanceMetrics.calculateAnnualizedReturn(
                        costBasis.getTotalCost(), currentValue, daysHeld))
                .build());
    }
}
