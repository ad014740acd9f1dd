package com.portfoliotracker.engine.service;

import com.portfoliotracker.engine.config.EngineProperties;
import com.portfoliotracker.engine.domain.CorporateActionAdjuster;
import com.portfoliotracker.engine.domain.HistoricalPrice;
import com.portfoliotracker.engine.domain.PriceBar;
import com.portfoliotracker.engine.domain.PriceSeries;
import com.portfoliotracker.engine.repository.HistoricalPriceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Service for loading price and FX history from the database.
 *
 * <p>Raw prices value the replayed holdings, which already contain the shares a split
 * added. Split-adjusted prices feed return and risk calculations, so a known split does not
 * show up as a one-day crash.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketDataService implements PriceSeriesProvider, FxRateProvider {

    private final HistoricalPriceRepository historicalPriceRepository;
    private final EngineProperties properties;
    private final Clock clock;

    /**
     * Pair symbol under which FX history is stored, e.g. {@code EURTRY=X}.
     */
    public static String pairSymbol(String base, String quote) {
        return base.toUpperCase() + quote.toUpperCase() + "=X";
    }

    /**
     * Prices from {@code start} to {@code end}, seeded with each symbol's last close on or before
     * {@code start}, so as-of lookups inside the range carry that close forward however old it is.
     */
    @Override
    @Transactional(readOnly = true)
    public PriceSeries getPrices(Collection<String> symbols, LocalDate start, LocalDate end) {
        if (symbols == null || symbols.isEmpty() || end.isBefore(start)) {
            return PriceSeries.empty();
        }

        List<PriceBar> bars = new ArrayList<>();
        historicalPriceRepository.findLatestBySymbolsOnOrBefore(symbols, start).stream()
                .map(HistoricalPrice::toPriceBar)
                .forEach(bars::add);
        bars.addAll(loadBars(symbols, start, end));
        return PriceSeries.fromBars(bars);
    }

    /**
     * Closing prices with the configured known splits applied to the history before each split.
     */
    @Transactional(readOnly = true)
    public PriceSeries getSplitAdjustedPrices(Collection<String> symbols, LocalDate start, LocalDate end) {
        Map<String, List<PriceBar>> bySymbol = loadBars(symbols, start, end).stream()
                .collect(Collectors.groupingBy(PriceBar::getSymbol, TreeMap::new, Collectors.toList()));

        List<PriceBar> adjusted = new ArrayList<>();
        bySymbol.forEach((symbol, bars) -> adjusted.addAll(applyKnownSplit(symbol, bars)));
        return PriceSeries.fromBars(adjusted);
    }

    /**
     * Daily bars of one symbol in date order, with its configured known split applied to
     * open, high, low, close and volume.
     */
    @Transactional(readOnly = true)
    public List<PriceBar> getSplitAdjustedBars(String symbol, LocalDate start, LocalDate end) {
        return applyKnownSplit(symbol, loadBars(List.of(symbol), start, end));
    }

    /**
     * Known split configured for {@code symbol}, if any.
     */
    public Optional<EngineProperties.KnownSplit> knownSplit(String symbol) {
        return Optional.ofNullable(properties.getKnownSplits().get(symbol));
    }

    /**
     * Latest raw close on or before {@code date}.
     */
    @Transactional(readOnly = true)
    public Optional<Double> latestPrice(String symbol, LocalDate date) {
        return historicalPriceRepository.findFirstBySymbolAndDateLessThanEqualOrderByDateDesc(symbol, date)
                .map(HistoricalPrice::getClose);
    }

    /**
     * Store bars, replacing any existing close for the same symbol and day.
     *
     * @return number of bars written
     */
    @Transactional
    public int savePrices(List<PriceBar> bars) {
        List<HistoricalPrice> toSave = new ArrayList<>();
        for (PriceBar bar : bars) {
            HistoricalPrice entity = HistoricalPrice.fromPriceBar(bar);
            historicalPriceRepository.findBySymbolAndDate(bar.getSymbol(), bar.getDate())
                    .ifPresent(existing -> entity.setId(existing.getId()));
            toSave.add(entity);
        }
        historicalPriceRepository.saveAll(toSave);
        log.info("Stored {} price bars", toSave.size());
        return toSave.size();
    }

    @Override
    public Optional<Double> latestRate(String base, String quote) {
        return rateAsOf(base, quote, LocalDate.now(clock));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Double> rateAsOf(String base, String quote, LocalDate date) {
        if (base.equalsIgnoreCase(quote)) {
            return Optional.of(1.0);
        }
        Optional<Double> rate = latestPrice(pairSymbol(base, quote), date)
                .filter(value -> value > 0);
        if (rate.isEmpty()) {
            log.warn("No {}/{} rate available on or before {}", base, quote, date);
        }
        return rate;
    }

    private List<PriceBar> loadBars(Collection<String> symbols, LocalDate start, LocalDate end) {
        if (symbols == null || symbols.isEmpty() || end.isBefore(start)) {
            return List.of();
        }

        List<PriceBar> bars = historicalPriceRepository.findBySymbolsAndDateRange(symbols, start, end).stream()
                .map(HistoricalPrice::toPriceBar)
                .collect(Collectors.toList());

        log.debug("Loaded {} price bars for {} symbols from {} to {}", bars.size(), symbols.size(), start, end);
        return bars;
    }

    private List<PriceBar> applyKnownSplit(String symbol, List<PriceBar> bars) {
        EngineProperties.KnownSplit split = knownSplit(symbol).orElse(null);
        if (split == null) {
            return bars;
        }
        log.debug("Adjusting {} history for {}-for-1 split on {}", symbol, split.getRatio(), split.getDate());
        return CorporateActionAdjuster.adjustForSplit(bars, split.effectiveDate(), split.getRatio());
    }
}
