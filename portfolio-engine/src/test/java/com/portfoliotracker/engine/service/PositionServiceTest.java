package com.portfoliotracker.engine.service;

import com.portfoliotracker.engine.config.EngineProperties;
import com.portfoliotracker.engine.domain.CalculationResult;
import com.portfoliotracker.engine.domain.CostBasis;
import com.portfoliotracker.engine.domain.PortfolioSummary;
import com.portfoliotracker.engine.domain.PositionSummary;
import com.portfoliotracker.engine.domain.Transaction;
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
import java.util.Optional;

import static com.portfoliotracker.engine.domain.TestLedgers.buy;
import static com.portfoliotracker.engine.domain.TestLedgers.sell;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PositionServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

    @Mock
    private LedgerService ledgerService;

    @Mock
    private MarketDataService marketDataService;

    private PositionService positionService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
        positionService = new PositionService(ledgerService, marketDataService, new EngineProperties(), clock);
    }

    @Test
    void testPortfolioSummary_TotalsAndUnpricedSymbols() {
        // Arrange
        when(ledgerService.getLedger()).thenReturn(List.of(
                buy("THYAO", 100, 50, LocalDate.of(2023, 6, 2)),
                buy("ASELS", 10, 20, LocalDate.of(2024, 1, 2))));
        when(marketDataService.latestPrice("THYAO", TODAY)).thenReturn(Optional.of(60.0));
        when(marketDataService.latestPrice("ASELS", TODAY)).thenReturn(Optional.empty());
        when(marketDataService.latestRate("EUR", "TRY")).thenReturn(Optional.of(30.0));

        // Act
        PortfolioSummary summary = positionService.portfolioSummary();

        // Assert
        assertEquals(1, summary.getPositions().size());
        assertEquals(List.of("ASELS"), summary.getUnpricedSymbols());
        assertEquals(5000.0, summary.getTotalCost(), 1e-9);
        assertEquals(6000.0, summary.getTotalValue(), 1e-9);
        assertEquals(1000.0, summary.getTotalProfitLoss(), 1e-9);
        assertEquals(20.0, summary.getTotalReturnPercentage(), 1e-9);
        assertEquals(-5200.0, summary.getCashBalance(), 1e-9);
        assertEquals(30.0, summary.getSecondaryRate());
        assertEquals(200.0, summary.getTotalValueSecondary(), 1e-9);
    }

    @Test
    void testPortfolioSummary_MissingRateLeavesSecondaryEmpty() {
        when(ledgerService.getLedger()).thenReturn(List.of(buy("THYAO", 100, 50, LocalDate.of(2023, 6, 2))));
        when(marketDataService.latestPrice("THYAO", TODAY)).thenReturn(Optional.of(60.0));
        when(marketDataService.latestRate("EUR", "TRY")).thenReturn(Optional.empty());

        PortfolioSummary summary = positionService.portfolioSummary();

        assertNull(summary.getSecondaryRate());
        assertEquals(0.0, summary.getTotalValueSecondary());
    }

    @Test
    void testSummarize_FifoBasisAfterPartialSale() {
        List<Transaction> ledger = List.of(
                buy("THYAO", 100, 50, LocalDate.of(2024, 1, 2)),
                buy("THYAO", 50, 80, LocalDate.of(2024, 2, 1)),
                sell("THYAO", 120, 90, LocalDate.of(2024, 3, 1)));

        CalculationResult<PositionSummary> result = positionService.summarize(ledger, "THYAO", 100, TODAY);

        assertTrue(result.isOk());
        PositionSummary summary = result.getValue();
        assertEquals(30.0, summary.getQuantity(), 1e-9);
        assertEquals(2400.0, summary.getCostBasis(), 1e-9);
        assertEquals(80.0, summary.getAveragePurchasePrice(), 1e-9);
        assertEquals(3000.0, summary.getCurrentValue(), 1e-9);
        assertEquals(25.0, summary.getReturnPercentage(), 1e-9);
        assertEquals(LocalDate.of(2024, 1, 2), summary.getFirstPurchaseDate());
        assertEquals(151, summary.getDaysHeld());
    }

    @Test
    void testSummarize_OneYearHoldingAnnualizesToTotalReturn() {
        List<Transaction> ledger = List.of(buy("THYAO", 100, 50, LocalDate.of(2023, 6, 2)));

        PositionSummary summary = positionService.summarize(ledger, "THYAO", 60, TODAY).getValue();

        assertEquals(365, summary.getDaysHeld());
        assertEquals(20.0, summary.getAnnualizedReturn(), 1e-9);
    }

    @Test
    void testSummarize_NotHeld() {
        CalculationResult<PositionSummary> result = positionService.summarize(List.of(), "GARAN", 10, TODAY);

        assertFalse(result.isOk());
        assertEquals("Stock not currently held: GARAN", result.getError());
    }

    @Test
    void testPerformanceSincePurchase_NoPrice() {
        when(ledgerService.getLedger()).thenReturn(List.of(buy("THYAO", 100, 50, LocalDate.of(2024, 1, 2))));
        when(marketDataService.latestPrice("THYAO", TODAY)).thenReturn(Optional.empty());

        CalculationResult<PositionSummary> result = positionService.performanceSincePurchase("THYAO");

        assertEquals("Could not fetch current price for THYAO", result.getError());
    }

    @Test
    void testCurrentCostBasis() {
        when(ledgerService.getLedger()).thenReturn(List.of(
                buy("THYAO", 100, 50, LocalDate.of(2024, 1, 2)),
                sell("THYAO", 40, 70, LocalDate.of(2024, 2, 1))));

        CostBasis basis = positionService.currentCostBasis("THYAO");

        assertEquals(3000.0, basis.getTotalCost(), 1e-9);
        assertEquals(50.0, basis.getAverageUnitCost(), 1e-9);
    }
}
