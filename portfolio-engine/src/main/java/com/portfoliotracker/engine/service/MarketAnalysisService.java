package com.portfoliotracker.engine.service;

import com.portfoliotracker.engine.config.EngineProperties;
import com.portfoliotracker.engine.domain.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;

/**
 * Per-symbol market views built from stored price history: the indicator chart and the
 * comparison against benchmark indices. Both read split-adjusted history so a known split
 * does not show up as a crash.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketAnalysisService {

    private final MarketDataService marketDataService;
    private final EngineProperties properties;
    private final Clock clock;

    /**
     * Chart of {@code symbol} over the trailing {@code period}.
     *
     * @return the chart, or an error when no history is stored for the window
     */
    public CalculationResult<PriceChart> chart(String symbol, AnalysisPeriod period) {
        LocalDate today = LocalDate.now(clock);
        List<PriceBar> bars = marketDataService.getSplitAdjustedBars(symbol, today.minusDays(period.getDays()), today);
        if (bars.isEmpty()) {
            log.warn("No price history for {} over {}", symbol, period.getCode());
            return CalculationResult.error("No data found for " + symbol);
        }

        SplitInfo splitInfo = marketDataService.knownSplit(symbol)
                .map(split -> SplitInfo.applied(split.effectiveDate(), split.getRatio()))
                .orElse(SplitInfo.none());

        log.debug("Built {} chart for {} with {} points", period.getCode(), symbol, bars.size());
        return CalculationResult.ok(PriceChart.builder()
                .symbol(symbol)
                .period(period.getCode())
                .points(TechnicalIndicators.chartPoints(bars))
                .summary(TechnicalIndicators.summarize(bars))
                .splitInfo(splitInfo)
                .build());
    }

    /**
     * Cumulative change of {@code symbol} next to each configured benchmark index over the
     * trailing {@code period}. Indices without stored history are left out.
     *
     * @return the comparison, or an error when the symbol has no history for the window
     */
    public CalculationResult<MarketComparison> compareWithIndices(String symbol, AnalysisPeriod period) {
        LocalDate today = LocalDate.now(clock);
        LocalDate start = today.minusDays(period.getDays());

        NavigableMap<LocalDate, Double> stockCloses = marketDataService
                .getSplitAdjustedPrices(List.of(symbol), start, today)
                .closes(symbol);
        if (stockCloses.isEmpty()) {
            log.warn("No price history for {} over {}", symbol, period.getCode());
            return CalculationResult.error("No data found for " + symbol);
        }

        Map<String, String> benchmarks = properties.getMarketIndices();
        PriceSeries indexSeries = marketDataService.getSplitAdjustedPrices(
                new ArrayList<>(benchmarks.values()), start, today);

        Map<String, NavigableMap<LocalDate, Double>> indexCloses = new LinkedHashMap<>();
        benchmarks.forEach((name, indexSymbol) -> {
            NavigableMap<LocalDate, Double> closes = indexSeries.closes(indexSymbol);
            if (closes.isEmpty()) {
                log.warn("No history stored for index {} ({}); leaving it out", name, indexSymbol);
            }
            indexCloses.put(name, closes);
        });

        return CalculationResult.ok(MarketComparisonCalculator.compare(symbol, period.getCode(), stockCloses, indexCloses));
    }
}
