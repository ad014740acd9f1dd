package com.portfoliotracker.engine.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Performance of one held symbol since its first purchase, measured against FIFO cost basis.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionSummary {

    private String symbol;
    private double quantity;
    private double costBasis;
    private double averagePurchasePrice;
    private double currentPrice;
    private double currentValue;
    private double returnAmount;
    private double returnPercentage;
    private LocalDate firstPurchaseDate;
    private long daysHeld;
    private double annualizedReturn;
}
