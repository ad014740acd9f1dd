package com.portfoliotracker.engine.service;

import com.portfoliotracker.engine.domain.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Turns a declared dividend or bonus-issue percentage into a concrete ledger transaction,
 * sized by the shares held strictly before the event date.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CorporateActionService {

    private final LedgerService ledgerService;

    /**
     * Apply an event to the ledger.
     *
     * @return the appended transaction, or an error when no shares were held before the date
     */
    @Transactional
    public CalculationResult<Transaction> applyEvent(CorporateActionType type, String symbol,
                                                     LocalDate eventDate, double percentage) {
        String normalized = symbol.trim().toUpperCase();
        double sharesHeld = LedgerReplay.holdingsBefore(ledgerService.getLedger(), normalized, eventDate);
        if (sharesHeld <= 0) {
            log.warn("Ignoring {} for {} on {}: no shares held", type, normalized, eventDate);
            return CalculationResult.error("No shares of " + normalized + " held on " + eventDate
                    + " to apply the event to.");
        }

        Transaction transaction = switch (type) {
            case DIVIDEND -> Transaction.builder()
                    .type(TransactionType.DIVIDEND)
                    .symbol(normalized)
                    .quantity(0.0)
                    .price(CorporateActionAdjuster.dividendCash(sharesHeld, percentage))
                    .date(eventDate)
                    .note("Dividend (" + format(percentage) + "%)")
                    .build();
            case SPLIT -> {
                double ratio = CorporateActionAdjuster.splitRatio(percentage);
                yield Transaction.builder()
                        .type(TransactionType.SPLIT)
                        .symbol(normalized)
                        .quantity(CorporateActionAdjuster.newShares(sharesHeld, ratio))
                        .price(0.0)
                        .date(eventDate)
                        .note("Stock Split (" + format(ratio) + "-for-1)")
                        .build();
            }
        };

        log.info("{} of {}% on {} held {} shares of {}", type, format(percentage), eventDate,
                format(sharesHeld), normalized);
        return CalculationResult.ok(ledgerService.append(transaction));
    }

    private static String format(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
