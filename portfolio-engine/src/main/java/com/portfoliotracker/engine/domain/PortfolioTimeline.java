package com.portfoliotracker.engine.domain;

import java.time.LocalDate;
import java.util.*;
import java.util.function.Function;

/**
 * Daily valuation curve built by walking the calendar and combining replayed holdings with
 * last-known prices. The walk is a pure function of its inputs, so repeated runs over the
 * same ledger and prices produce identical points.
 */
public final class PortfolioTimeline {

    private PortfolioTimeline() {
    }

    /**
     * One point per calendar day in {@code [start, end]} that has price data on or before it.
     *
     * @param ledger        the full ledger; entries before {@code start} seed the holdings
     * @param prices        closing prices per symbol
     * @param start         first day of the curve
     * @param end           last day of the curve
     * @param secondaryRate price of one unit of the secondary currency in the base currency,
     *                      as of a day; empty when unknown
     */
    public static List<ValuationPoint> build(Collection<Transaction> ledger, PriceSeries prices,
                                             LocalDate start, LocalDate end,
                                             Function<LocalDate, Optional<Double>> secondaryRate) {
        if (end.isBefore(start)) {
            return List.of();
        }

        List<Transaction> ordered = LedgerReplay.ordered(ledger);
        Map<String, Double> quantities = new TreeMap<>();
        double cash = 0.0;
        int index = 0;

        while (index < ordered.size() && ordered.get(index).getDate().isBefore(start)) {
            cash += LedgerReplay.apply(ordered.get(index), quantities);
            index++;
        }

        List<ValuationPoint> points = new ArrayList<>();
        for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
            while (index < ordered.size() && ordered.get(index).getDate().equals(day)) {
                cash += LedgerReplay.apply(ordered.get(index), quantities);
                index++;
            }

            if (!prices.hasDataOnOrBefore(day)) {
                continue;
            }

            Map<String, Double> positions = new TreeMap<>();
            double total = 0.0;
            for (Map.Entry<String, Double> holding : quantities.entrySet()) {
                if (!LedgerReplay.isHeld(holding.getValue())) {
                    continue;
                }
                Optional<Double> price = prices.asOf(holding.getKey(), day);
                if (price.isEmpty()) {
                    continue;
                }
                double positionValue = holding.getValue() * price.get();
                positions.put(holding.getKey(), positionValue);
                total += positionValue;
            }

            double rate = secondaryRate.apply(day).orElse(0.0);
            double secondary = rate > 0 ? total / rate : 0.0;

            points.add(ValuationPoint.builder()
                    .date(day)
                    .value(total)
                    .secondaryValue(secondary)
                    .positions(Collections.unmodifiableMap(positions))
                    .cashBalance(cash)
                    .build());
        }
        return points;
    }
}
