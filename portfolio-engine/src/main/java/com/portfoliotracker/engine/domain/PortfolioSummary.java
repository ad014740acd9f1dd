package com.portfoliotracker.engine.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Profit and loss of every held position plus portfolio totals. Totals cover stock value
 * only; cash is reported separately.
 */
@Value
@Builder
public class PortfolioSummary {

    LocalDate asOf;
    List<PositionSummary> positions;
    List<String> unpricedSymbols;
    double totalCost;
    double totalValue;
    double totalProfitLoss;
    double totalReturnPercentage;
    double cashBalance;
    String baseCurrency;
    String secondaryCurrency;
    Double secondaryRate;
    double totalValueSecondary;
}
