package com.portfoliotracker.engine.service;

import com.portfoliotracker.engine.domain.CalculationResult;
import com.portfoliotracker.engine.domain.CorporateActionType;
import com.portfoliotracker.engine.domain.Transaction;
import com.portfoliotracker.engine.domain.TransactionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static com.portfoliotracker.engine.domain.TestLedgers.buy;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CorporateActionServiceTest {

    private static final LocalDate BUY_DATE = LocalDate.of(2024, 1, 2);

    @Mock
    private LedgerService ledgerService;

    private CorporateActionService corporateActionService;

    @BeforeEach
    void setUp() {
        corporateActionService = new CorporateActionService(ledgerService);
        when(ledgerService.getLedger()).thenReturn(List.of(buy("THYAO", 100, 50, BUY_DATE)));
    }

    @Test
    void testApplyEvent_DividendBooksCash() {
        when(ledgerService.append(any())).thenAnswer(invocation -> invocation.getArgument(0));

        CalculationResult<Transaction> result = corporateActionService.applyEvent(
                CorporateActionType.DIVIDEND, "thyao", LocalDate.of(2024, 3, 1), 25);

        Transaction dividend = result.getValue();
        assertEquals(TransactionType.DIVIDEND, dividend.getType());
        assertEquals("THYAO", dividend.getSymbol());
        assertEquals(0.0, dividend.getQuantity());
        assertEquals(25.0, dividend.getPrice(), 1e-9);
        assertEquals("Dividend (25%)", dividend.getNote());
    }

    @Test
    void testApplyEvent_BonusIssueBooksNewShares() {
        when(ledgerService.append(any())).thenAnswer(invocation -> invocation.getArgument(0));

        CalculationResult<Transaction> result = corporateActionService.applyEvent(
                CorporateActionType.SPLIT, "THYAO", LocalDate.of(2024, 3, 1), 100);

        Transaction split = result.getValue();
        assertEquals(TransactionType.SPLIT, split.getType());
        assertEquals(100.0, split.getQuantity(), 1e-9);
        assertEquals(0.0, split.getPrice());
        assertEquals("Stock Split (2-for-1)", split.getNote());
    }

    @Test
    void testApplyEvent_SharesBoughtOnEventDateDoNotCount() {
        CalculationResult<Transaction> result = corporateActionService.applyEvent(
                CorporateActionType.DIVIDEND, "THYAO", BUY_DATE, 25);

        assertFalse(result.isOk());
        assertEquals("No shares of THYAO held on 2024-01-02 to apply the event to.", result.getError());
        verify(ledgerService, never()).append(any());
    }
}
