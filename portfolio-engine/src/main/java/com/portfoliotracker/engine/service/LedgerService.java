package com.portfoliotracker.engine.service;

import com.portfoliotracker.engine.config.EngineProperties;
import com.portfoliotracker.engine.domain.Transaction;
import com.portfoliotracker.engine.domain.TransactionRecord;
import com.portfoliotracker.engine.repository.TransactionRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read access to the transaction ledger plus validated appends. The calculators never
 * write to the ledger; only explicit user actions and corporate events do.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    static final String DEFAULT_ASSET_TYPE = "STOCK";

    // Open range bounds that every database date type can represent
    private static final LocalDate EARLIEST = LocalDate.of(1900, 1, 1);
    private static final LocalDate LATEST = LocalDate.of(9999, 12, 31);

    private final TransactionRecordRepository transactionRecordRepository;
    private final EngineProperties properties;
    private final EngineMetricsService metricsService;

    /**
     * The whole ledger in replay order.
     */
    @Transactional(readOnly = true)
    public List<Transaction> getLedger() {
        return toTransactions(transactionRecordRepository.findAllByOrderByDateAscIdAsc());
    }

    /**
     * Ledger entries filtered by symbol and/or inclusive date range. Null arguments do not filter.
     */
    @Transactional(readOnly = true)
    public List<Transaction> getTransactions(String symbol, LocalDate startDate, LocalDate endDate) {
        String normalized = symbol != null && !symbol.isBlank() ? symbol.toUpperCase() : null;

        if (startDate == null && endDate == null) {
            return normalized == null
                    ? getLedger()
                    : toTransactions(transactionRecordRepository.findBySymbolOrderByDateAscIdAsc(normalized));
        }

        LocalDate from = startDate != null ? startDate : EARLIEST;
        LocalDate to = endDate != null ? endDate : LATEST;
        return normalized == null
                ? toTransactions(transactionRecordRepository.findByDateBetweenOrderByDateAscIdAsc(from, to))
                : toTransactions(transactionRecordRepository
                        .findBySymbolAndDateBetweenOrderByDateAscIdAsc(normalized, from, to));
    }

    /**
     * Validate and append a transaction. Currency and asset type fall back to the base
     * currency and {@code STOCK}.
     *
     * @return the stored transaction with its id
     * @throws IllegalArgumentException if the transaction breaks a ledger invariant
     */
    @Transactional
    public Transaction append(Transaction transaction) {
        Transaction completed = transaction.toBuilder()
                .symbol(transaction.hasSymbol() ? transaction.getSymbol().trim().toUpperCase() : null)
                .currency(transaction.getCurrency() != null ? transaction.getCurrency() : properties.getBaseCurrency())
                .assetType(transaction.getAssetType() != null ? transaction.getAssetType() : DEFAULT_ASSET_TYPE)
                .build();
        completed.validate();

        TransactionRecord saved = transactionRecordRepository.save(TransactionRecord.fromTransaction(completed));
        metricsService.recordTransactionAppended();
        log.info("Appended {} transaction {} for {} on {}",
                saved.getType(), saved.getId(), saved.getSymbol() != null ? saved.getSymbol() : "cash", saved.getDate());
        return saved.toTransaction();
    }

    private List<Transaction> toTransactions(List<TransactionRecord> records) {
        return records.stream()
                .map(TransactionRecord::toTransaction)
                .collect(Collectors.toList());
    }
}
