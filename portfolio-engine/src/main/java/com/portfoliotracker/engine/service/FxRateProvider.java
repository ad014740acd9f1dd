package com.portfoliotracker.engine.service;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Source of exchange rates, quoted as units of {@code quote} per one unit of {@code base}.
 */
public interface FxRateProvider {

    Optional<Double> latestRate(String base, String quote);

    Optional<Double> rateAsOf(String base, String quote, LocalDate date);
}
