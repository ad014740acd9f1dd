package com.portfoliotracker.engine.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for tracking engine computation metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class EngineMetricsService {

    private final Counter valuationsCounter;
    private final Counter riskRunsCounter;
    private final Counter riskSymbolsSkippedCounter;
    private final Counter cacheHitsCounter;
    private final Counter cacheMissesCounter;
    private final Counter sectorLookupFailuresCounter;
    private final Counter transactionsAppendedCounter;
    private final Timer valuationTimer;
    private final Timer riskTimer;

    public EngineMetricsService(MeterRegistry meterRegistry) {
        this.valuationsCounter = Counter.builder("portfolio.valuations")
                .description("Total number of valuation curves computed")
                .register(meterRegistry);

        this.riskRunsCounter = Counter.builder("portfolio.risk.runs")
                .description("Total number of portfolio risk analyses")
                .register(meterRegistry);

        this.riskSymbolsSkippedCounter = Counter.builder("portfolio.risk.symbols.skipped")
                .description("Symbols left out of a risk analysis for lack of data or errors")
                .register(meterRegistry);

        this.cacheHitsCounter = Counter.builder("portfolio.cache.hits")
                .description("Result cache hits")
                .register(meterRegistry);

        this.cacheMissesCounter = Counter.builder("portfolio.cache.misses")
                .description("Result cache misses")
                .register(meterRegistry);

        this.sectorLookupFailuresCounter = Counter.builder("portfolio.sector.lookup.failures")
                .description("Sector metadata lookups that failed and degraded to Unknown")
                .register(meterRegistry);

        this.transactionsAppendedCounter = Counter.builder("portfolio.ledger.appended")
                .description("Transactions appended to the ledger")
                .register(meterRegistry);

        this.valuationTimer = Timer.builder("portfolio.valuation.time")
                .description("Valuation curve computation time")
                .register(meterRegistry);

        this.riskTimer = Timer.builder("portfolio.risk.time")
                .description("Risk analysis computation time")
                .register(meterRegistry);

        log.info("EngineMetricsService initialized with Micrometer metrics");
    }

    public void recordValuation(long executionTimeMs) {
        valuationsCounter.increment();
        valuationTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordRiskRun(long executionTimeMs) {
        riskRunsCounter.increment();
        riskTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordRiskSymbolSkipped() {
        riskSymbolsSkippedCounter.increment();
    }

    public void recordCacheHit() {
        cacheHitsCounter.increment();
    }

    public void recordCacheMiss() {
        cacheMissesCounter.increment();
    }

    public void recordSectorLookupFailure() {
        sectorLookupFailuresCounter.increment();
    }

    public void recordTransactionAppended() {
        transactionsAppendedCounter.increment();
    }

    /**
     * Get current metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Valuations=%d, RiskRuns=%d, Skipped=%d, CacheHits=%d, CacheMisses=%d, "
                        + "SectorFailures=%d, AvgRiskTime=%.2fs",
                (long) valuationsCounter.count(),
                (long) riskRunsCounter.count(),
                (long) riskSymbolsSkippedCounter.count(),
                (long) cacheHitsCounter.count(),
                (long) cacheMissesCounter.count(),
                (long) sectorLookupFailuresCounter.count(),
                riskTimer.mean(TimeUnit.SECONDS));
    }
}
