package com.portfoliotracker.engine.repository;

import com.portfoliotracker.engine.domain.HistoricalPrice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for accessing daily price history, FX pairs included.
 */
@Repository
public interface HistoricalPriceRepository extends JpaRepository<HistoricalPrice, Long> {

    /**
     * Find prices for several symbols within a date range, ordered by symbol then date.
     */
    @Query("SELECT h FROM HistoricalPrice h WHERE h.symbol IN :symbols " +
            "AND h.date >= :startDate AND h.date <= :endDate ORDER BY h.symbol ASC, h.date ASC")
    List<HistoricalPrice> findBySymbolsAndDateRange(
            @Param("symbols") Collection<String> symbols,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate);

    /**
     * Latest price on or before a date for each of several symbols. Symbols with no history
     * up to that date are absent from the result.
     */
    @Query("SELECT h FROM HistoricalPrice h WHERE h.symbol IN :symbols AND h.date = " +
            "(SELECT MAX(p.date) FROM HistoricalPrice p WHERE p.symbol = h.symbol AND p.date <= :date)")
    List<HistoricalPrice> findLatestBySymbolsOnOrBefore(
            @Param("symbols") Collection<String> symbols,
            @Param("date") LocalDate date);

    /**
     * Latest price on or before a date.
     */
    Optional<HistoricalPrice> findFirstBySymbolAndDateLessThanEqualOrderByDateDesc(String symbol, LocalDate date);

    Optional<HistoricalPrice> findBySymbolAndDate(String symbol, LocalDate date);
}
