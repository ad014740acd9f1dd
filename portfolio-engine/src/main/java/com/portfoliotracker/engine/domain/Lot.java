package com.portfoliotracker.engine.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Shares of one symbol acquired at a single unit cost. Lots are rebuilt from the ledger on
 * every calculation and never persisted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Lot {

    private String symbol;
    private double quantity;
    private double unitCost;
    private LocalDate acquisitionDate;

    public double getCost() {
        return quantity * unitCost;
    }
}
