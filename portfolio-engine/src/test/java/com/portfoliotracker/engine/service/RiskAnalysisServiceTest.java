package com.portfoliotracker.engine.service;

import com.portfoliotracker.engine.config.EngineProperties;
import com.portfoliotracker.engine.domain.AnalysisPeriod;
import com.portfoliotracker.engine.domain.CalculationResult;
import com.portfoliotracker.engine.domain.PriceSeries;
import com.portfoliotracker.engine.domain.scoring.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static com.portfoliotracker.engine.domain.TestLedgers.buy;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the per-symbol risk pipeline with the default scoring tables.
 */
@ExtendWith(MockitoExtension.class)
class RiskAnalysisServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

    @Mock
    private LedgerService ledgerService;

    @Mock
    private MarketDataService marketDataService;

    @Mock
    private EngineMetricsService metricsService;

    private Clock clock;
    private PositionService positionService;
    private RiskAnalysisService riskAnalysisService;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
        positionService = new PositionService(ledgerService, marketDataService, new EngineProperties(), clock);
        riskAnalysisService = service(new RiskScorer());
    }

    private RiskAnalysisService service(RiskScorer scorer) {
        return new RiskAnalysisService(ledgerService, marketDataService, positionService, scorer,
                new PerformanceGrader(), new InvestmentSignalGenerator(), metricsService, clock, 5);
    }

    private static PriceSeries prices() {
        PriceSeries.Builder builder = PriceSeries.builder();
        double[] thyao = {50, 52, 51, 53, 55, 60};
        for (int i = 0; i < thyao.length; i++) {
            builder.price("THYAO", TODAY.minusDays(thyao.length - 1 - i), thyao[i]);
        }
        return builder
                .price("ASELS", TODAY.minusDays(1), 40)
                .price("ASELS", TODAY, 42)
                .build();
    }

    @Test
    void testAnalyze_AssessesAndSkips() {
        // Arrange
        when(ledgerService.getLedger()).thenReturn(List.of(
                buy("THYAO", 100, 50, LocalDate.of(2023, 6, 2)),
                buy("ASELS", 10, 40, LocalDate.of(2024, 1, 2)),
                buy("GARAN", 10, 30, LocalDate.of(2024, 1, 2))));
        when(marketDataService.getSplitAdjustedPrices(any(), eq(TODAY.minusDays(365)), eq(TODAY)))
                .thenReturn(prices());

        // Act
        CalculationResult<RiskReport> result = riskAnalysisService.analyze(AnalysisPeriod.ONE_YEAR);

        // Assert
        assertTrue(result.isOk());
        RiskReport report = result.getValue();
        assertEquals(AnalysisPeriod.ONE_YEAR, report.getPeriod());
        assertEquals(1, report.getAssessments().size());

        PositionAssessment thyao = report.getAssessments().get("THYAO");
        assertEquals(6000.0, thyao.getCurrentValue(), 1e-9);
        assertEquals(20.0, thyao.getCurrentPerformance(), 1e-9);
        assertEquals(365, thyao.getDaysHeld());
        assertEquals(20.0, thyao.getRiskProfile().getAnnualizedReturn(), 1e-9);
        assertEquals(6, thyao.getRiskProfile().getSampleSize());
        assertTrue(thyao.getRiskScore().getScore() >= 0 && thyao.getRiskScore().getScore() <= 100);
        assertNotNull(thyao.getPerformanceGrade());
        assertNotNull(thyao.getInvestmentSignal());
        assertNotNull(thyao.getPositionRecommendation());

        assertTrue(report.getSkippedSymbols().get("ASELS").startsWith("Insufficient data: 2 closes"));
        assertEquals("No price history for GARAN", report.getSkippedSymbols().get("GARAN"));

        assertEquals(1, report.getPortfolioInsights().getTotalStocks());
        assertEquals(6000.0, report.getPortfolioInsights().getTotalValue(), 1e-9);

        verify(metricsService, times(2)).recordRiskSymbolSkipped();
        verify(metricsService).recordRiskRun(anyLong());
    }

    @Test
    void testAnalyze_NothingHeld() {
        when(ledgerService.getLedger()).thenReturn(List.of());

        CalculationResult<RiskReport> result = riskAnalysisService.analyze(AnalysisPeriod.SIX_MONTHS);

        assertEquals("No stocks currently held in portfolio", result.getError());
        verifyNoInteractions(marketDataService);
    }

    @Test
    void testAnalyze_FailingSymbolIsSkippedNotFatal() {
        // Arrange
        RiskScorer failing = mock(RiskScorer.class);
        when(failing.score(any())).thenThrow(new IllegalStateException("boom"));
        when(ledgerService.getLedger()).thenReturn(List.of(buy("THYAO", 100, 50, LocalDate.of(2023, 6, 2))));
        when(marketDataService.getSplitAdjustedPrices(any(), any(), any())).thenReturn(prices());

        // Act
        CalculationResult<RiskReport> result = service(failing).analyze(AnalysisPeriod.ONE_YEAR);

        // Assert
        assertTrue(result.isOk());
        assertTrue(result.getValue().getAssessments().isEmpty());
        assertNull(result.getValue().getPortfolioInsights());
        assertEquals("Error calculating risk metrics: boom", result.getValue().getSkippedSymbols().get("THYAO"));
    }
}
