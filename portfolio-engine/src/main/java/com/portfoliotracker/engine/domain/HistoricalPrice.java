package com.portfoliotracker.engine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Entity representing a day of price history stored in the database.
 * FX history uses the same table under pair symbols such as {@code EURTRY=X}.
 */
@Entity
@Table(name = "historical_prices", uniqueConstraints = {
        @UniqueConstraint(name = "uk_price_symbol_date", columnNames = { "symbol", "price_date" })
}, indexes = {
        @Index(name = "idx_price_symbol_date", columnList = "symbol, price_date")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoricalPrice {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "symbol", nullable = false, length = 20)
    private String symbol;

    @Column(name = "price_date", nullable = false)
    private LocalDate date;

    @Column(name = "open_price")
    private Double open;

    @Column(name = "high_price")
    private Double high;

    @Column(name = "low_price")
    private Double low;

    @Column(name = "close_price", nullable = false)
    private Double close;

    @Column(name = "volume")
    private Double volume;

    /**
     * Convert entity to domain PriceBar object. Missing OHLC fields fall back to the close.
     */
    public PriceBar toPriceBar() {
        return PriceBar.builder()
                .date(this.date)
                .symbol(this.symbol)
                .open(this.open != null ? this.open : this.close)
                .high(this.high != null ? this.high : this.close)
                .low(this.low != null ? this.low : this.close)
                .close(this.close)
                .volume(this.volume != null ? this.volume : 0.0)
                .build();
    }

    /**
     * Create entity from domain PriceBar object.
     */
    public static HistoricalPrice fromPriceBar(PriceBar bar) {
        return HistoricalPrice.builder()
                .symbol(bar.getSymbol())
                .date(bar.getDate())
                .open(bar.getOpen())
                .high(bar.getHigh())
                .low(bar.getLow())
                .close(bar.getClose())
                .volume(bar.getVolume())
                .build();
    }
}
