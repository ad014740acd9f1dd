package com.portfoliotracker.engine.domain;

import lombok.Value;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Replayed share quantities and cash balance valid as of a date.
 * Quantities may be negative when the ledger oversells a symbol.
 */
@Value
public class HoldingSnapshot {

    LocalDate asOf;
    Map<String, Double> quantities;
    double cashBalance;

    public HoldingSnapshot(LocalDate asOf, Map<String, Double> quantities, double cashBalance) {
        this.asOf = asOf;
        this.quantities = Collections.unmodifiableMap(new TreeMap<>(quantities));
        this.cashBalance = cashBalance;
    }

    public double quantityOf(String symbol) {
        return quantities.getOrDefault(symbol, 0.0);
    }
}
