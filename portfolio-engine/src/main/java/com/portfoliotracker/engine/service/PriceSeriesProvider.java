package com.portfoliotracker.engine.service;

import com.portfoliotracker.engine.domain.PriceSeries;

import java.time.LocalDate;
import java.util.Collection;

/**
 * Source of daily closing prices.
 */
public interface PriceSeriesProvider {

    /**
     * Closing prices for {@code symbols} within {@code [start, end]}. Unknown symbols are
     * simply absent from the result; this never throws for missing data.
     */
    PriceSeries getPrices(Collection<String> symbols, LocalDate start, LocalDate end);
}
