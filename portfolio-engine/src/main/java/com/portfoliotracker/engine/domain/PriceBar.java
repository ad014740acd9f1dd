package com.portfoliotracker.engine.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A single day of price history (OHLCV) for one symbol.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class PriceBar {

    private LocalDate date;
    private String symbol;
    private double open;
    private double high;
    private double low;
    private double close;
    private double volume;
}
