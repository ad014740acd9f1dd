package com.portfoliotracker.engine.service;

import com.portfoliotracker.engine.domain.CalculationResult;
import com.portfoliotracker.engine.domain.LedgerReplay;
import com.portfoliotracker.engine.domain.SectorAllocation;
import com.portfoliotracker.engine.domain.SectorAllocation.SectorBreakdown;
import com.portfoliotracker.engine.domain.SectorAllocation.SectorHolding;
import com.portfoliotracker.engine.infrastructure.ResultCache;
import com.portfoliotracker.engine.infrastructure.SectorInfo;
import com.portfoliotracker.engine.infrastructure.SectorInfoProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Sector allocation of the current holdings. Metadata lookups run on a small bounded pool;
 * results are merged only after every lookup has finished, and a failed lookup counts the
 * symbol as {@code Unknown}.
 */
@Service
@Slf4j
public class SectorAnalysisService {

    static final String CACHE_PREFIX = "sector:";

    private final LedgerService ledgerService;
    private final MarketDataService marketDataService;
    private final SectorInfoProvider sectorInfoProvider;
    private final ResultCache resultCache;
    private final ExecutorService sectorLookupExecutor;
    private final EngineMetricsService metricsService;
    private final Clock clock;
    private final Duration cacheTtl;

    public SectorAnalysisService(LedgerService ledgerService,
                                 MarketDataService marketDataService,
                                 SectorInfoProvider sectorInfoProvider,
                                 ResultCache resultCache,
                                 @Qualifier("sectorLookupExecutor") ExecutorService sectorLookupExecutor,
                                 EngineMetricsService metricsService,
                                 Clock clock,
                                 @Value("${portfolio.sector.cache-ttl:24h}") Duration cacheTtl) {
        this.ledgerService = ledgerService;
        this.marketDataService = marketDataService;
        this.sectorInfoProvider = sectorInfoProvider;
        this.resultCache = resultCache;
        this.sectorLookupExecutor = sectorLookupExecutor;
        this.metricsService = metricsService;
        this.clock = clock;
        this.cacheTtl = cacheTtl;
    }

    public CalculationResult<SectorAllocation> analyze() {
        Map<String, Double> holdings = LedgerReplay.currentHoldings(ledgerService.getLedger());
        if (holdings.isEmpty()) {
            return CalculationResult.error("No stocks currently held in portfolio");
        }

        LocalDate today = LocalDate.now(clock);
        List<String> symbols = new ArrayList<>(holdings.keySet());
        List<Callable<SectorInfo>> lookups = new ArrayList<>();
        for (String symbol : symbols) {
            lookups.add(() -> lookup(symbol));
        }

        List<Future<SectorInfo>> futures;
        try {
            futures = sectorLookupExecutor.invokeAll(lookups);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Sector analysis interrupted");
            return CalculationResult.error("Sector analysis interrupted");
        }

        Map<String, SectorBreakdown> sectors = new LinkedHashMap<>();
        double totalValue = 0.0;

        for (int i = 0; i < symbols.size(); i++) {
            String symbol = symbols.get(i);
            SectorInfo info = resolve(symbol, futures.get(i));
            double price = marketDataService.latestPrice(symbol, today).orElse(0.0);
            double positionValue = holdings.get(symbol) * price;
            totalValue += positionValue;

            log.debug("Sector info for {}: {} / {} (source: {})",
                    symbol, info.getSector(), info.getIndustry(), info.getSource());

            SectorBreakdown breakdown = sectors.computeIfAbsent(info.getSector(), s -> SectorBreakdown.builder()
                    .stocks(new ArrayList<>())
                    .industries(new LinkedHashMap<>())
                    .build());
            breakdown.setValue(breakdown.getValue() + positionValue);
            breakdown.getStocks().add(SectorHolding.builder()
                    .symbol(symbol)
                    .industry(info.getIndustry())
                    .value(positionValue)
                    .source(info.getSource())
                    .build());
            breakdown.getIndustries().merge(info.getIndustry(), positionValue, Double::sum);
        }

        if (totalValue > 0) {
            for (SectorBreakdown breakdown : sectors.values()) {
                breakdown.setPercentage(breakdown.getValue() / totalValue * 100);
                for (SectorHolding stock : breakdown.getStocks()) {
                    stock.setPercentage(stock.getValue() / totalValue * 100);
                }
            }
        }

        log.info("Sector analysis: {} stocks across {} sectors", holdings.size(), sectors.size());

        return CalculationResult.ok(SectorAllocation.builder()
                .sectors(sectors)
                .totalValue(totalValue)
                .diversificationScore(SectorAllocation.diversificationScore(sectors.size()))
                .numSectors(sectors.size())
                .numStocks(holdings.size())
                .build());
    }

    /**
     * Cached lookup. Only a known sector is cached, so a miss or failure is retried next time.
     */
    SectorInfo lookup(String symbol) {
        Optional<SectorInfo> cached = resultCache.get(CACHE_PREFIX + symbol, SectorInfo.class);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return cached.get();
        }
        metricsService.recordCacheMiss();

        Optional<SectorInfo> found = sectorInfoProvider.lookup(symbol);
        if (found.isPresent() && found.get().isKnown()) {
            resultCache.set(CACHE_PREFIX + symbol, found.get(), cacheTtl);
            return found.get();
        }
        return SectorInfo.unknown("not_found");
    }

    private SectorInfo resolve(String symbol, Future<SectorInfo> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SectorInfo.unknown("interrupted");
        } catch (ExecutionException e) {
            log.error("Sector lookup failed for {}", symbol, e.getCause());
            metricsService.recordSectorLookupFailure();
            return SectorInfo.unknown("error");
        }
    }
}
