package com.portfoliotracker.engine.domain;

import java.time.LocalDate;
import java.util.*;

/**
 * Closing prices per symbol with last-known-value lookup. Non-trading days resolve to the
 * most recent close on or before the requested date.
 */
public final class PriceSeries {

    private static final PriceSeries EMPTY = new PriceSeries(Collections.emptyMap());

    private final Map<String, NavigableMap<LocalDate, Double>> closes;

    private PriceSeries(Map<String, NavigableMap<LocalDate, Double>> closes) {
        this.closes = closes;
    }

    public static PriceSeries empty() {
        return EMPTY;
    }

    /**
     * Build a series from price bars; later bars for the same symbol and date win.
     */
    public static PriceSeries fromBars(Collection<PriceBar> bars) {
        Map<String, NavigableMap<LocalDate, Double>> closes = new TreeMap<>();
        for (PriceBar bar : bars) {
            closes.computeIfAbsent(bar.getSymbol(), s -> new TreeMap<>())
                    .put(bar.getDate(), bar.getClose());
        }
        return new PriceSeries(freeze(closes));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Latest close on or before {@code date}, if any.
     */
    public Optional<Double> asOf(String symbol, LocalDate date) {
        NavigableMap<LocalDate, Double> series = closes.get(symbol);
        if (series == null) {
            return Optional.empty();
        }
        Map.Entry<LocalDate, Double> entry = series.floorEntry(date);
        return entry == null ? Optional.empty() : Optional.of(entry.getValue());
    }

    /**
     * Whether any symbol has a data point on or before {@code date}.
     */
    public boolean hasDataOnOrBefore(LocalDate date) {
        for (NavigableMap<LocalDate, Double> series : closes.values()) {
            if (series.floorKey(date) != null) {
                return true;
            }
        }
        return false;
    }

    /**
     * Closing prices of a symbol in date order; empty when the symbol is unknown.
     */
    public NavigableMap<LocalDate, Double> closes(String symbol) {
        return closes.getOrDefault(symbol, Collections.emptyNavigableMap());
    }

    public Set<String> symbols() {
        return closes.keySet();
    }

    public boolean isEmpty() {
        return closes.values().stream().allMatch(Map::isEmpty);
    }

    private static Map<String, NavigableMap<LocalDate, Double>> freeze(
            Map<String, NavigableMap<LocalDate, Double>> source) {
        Map<String, NavigableMap<LocalDate, Double>> frozen = new TreeMap<>();
        source.forEach((symbol, series) ->
                frozen.put(symbol, Collections.unmodifiableNavigableMap(new TreeMap<>(series))));
        return Collections.unmodifiableMap(frozen);
    }

    public static final class Builder {

        private final Map<String, NavigableMap<LocalDate, Double>> closes = new TreeMap<>();

        private Builder() {
        }

        public Builder price(String symbol, LocalDate date, double close) {
            closes.computeIfAbsent(symbol, s -> new TreeMap<>()).put(date, close);
            return this;
        }

        public PriceSeries build() {
            return new PriceSeries(freeze(closes));
        }
    }
}
