package com.portfoliotracker.engine.repository;

import com.portfoliotracker.engine.domain.TransactionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Repository for the transaction ledger. Every listing is ordered by trade date, with ties
 * kept in insertion order.
 */
@Repository
public interface TransactionRecordRepository extends JpaRepository<TransactionRecord, Long> {

    List<TransactionRecord> findAllByOrderByDateAscIdAsc();

    List<TransactionRecord> findBySymbolOrderByDateAscIdAsc(String symbol);

    /**
     * Find ledger entries within an inclusive date range.
     */
    List<TransactionRecord> findByDateBetweenOrderByDateAscIdAsc(LocalDate startDate, LocalDate endDate);

    List<TransactionRecord> findBySymbolAndDateBetweenOrderByDateAscIdAsc(
            String symbol, LocalDate startDate, LocalDate endDate);
}
