package com.portfoliotracker.engine.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.portfoliotracker.engine.domain.Transaction;
import com.portfoliotracker.engine.domain.TransactionType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Request DTO for appending a transaction to the ledger. Type-specific rules (a BUY needs a
 * symbol and a positive price, a deposit must not carry a symbol) are checked by the ledger.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransactionRequest {

    @NotNull(message = "Transaction type is required")
    private TransactionType type;

    @Size(max = 20, message = "Symbol must be at most 20 characters")
    private String symbol;

    @NotNull(message = "Quantity is required")
    @PositiveOrZero(message = "Quantity must not be negative")
    private Double quantity;

    @PositiveOrZero(message = "Price must not be negative")
    private Double price;

    @NotNull(message = "Date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate date;

    @Size(min = 3, max = 3, message = "Currency must be a 3-letter code")
    private String currency;

    private String assetType;

    private String note;

    public Transaction toTransaction() {
        return Transaction.builder()
                .type(type)
                .symbol(symbol)
                .quantity(quantity)
                .price(price)
                .date(date)
                .currency(currency)
                .assetType(assetType)
                .note(note)
                .build();
    }
}
