package com.portfoliotracker.engine.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Entity representing a ledger transaction stored in the database.
 * This is the persistent version of {@link Transaction}.
 */
@Entity
@Table(name = "ledger_transactions", indexes = {
        @Index(name = "idx_tx_symbol_date", columnList = "symbol, trade_date"),
        @Index(name = "idx_tx_trade_date", columnList = "trade_date")
})
@EntityListeners(AuditingEntityListener.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransactionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "tx_type", nullable = false, length = 20)
    private TransactionType type;

    @Column(name = "symbol", length = 20)
    private String symbol;

    @Column(name = "quantity", nullable = false)
    private Double quantity;

    @Column(name = "price")
    private Double price;

    @Column(name = "trade_date", nullable = false)
    private LocalDate date;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "asset_type", nullable = false, length = 20)
    private String assetType;

    @Column(name = "note", length = 500)
    private String note;

    @CreatedDate
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    /**
     * Convert entity to domain Transaction object.
     */
    public Transaction toTransaction() {
        return Transaction.builder()
                .id(this.id)
                .type(this.type)
                .symbol(this.symbol)
                .quantity(this.quantity != null ? this.quantity : 0.0)
                .price(this.price)
                .date(this.date)
                .currency(this.currency)
                .assetType(this.assetType)
                .note(this.note)
                .build();
    }

    /**
     * Create entity from domain Transaction object.
     */
    public static TransactionRecord fromTransaction(Transaction tx) {
        return TransactionRecord.builder()
                .type(tx.getType())
                .symbol(tx.hasSymbol() ? tx.getSymbol().toUpperCase() : null)
                .quantity(tx.getQuantity())
                .price(tx.getPrice())
                .date(tx.getDate())
                .currency(tx.getCurrency())
                .assetType(tx.getAssetType())
                .note(tx.getNote())
                .build();
    }
}
