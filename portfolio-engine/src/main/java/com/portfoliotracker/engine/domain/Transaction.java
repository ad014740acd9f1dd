package com.portfoliotracker.engine.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Immutable ledger fact. For {@link TransactionType#DIVIDEND} the price holds the total
 * cash amount; for {@link TransactionType#SPLIT} the quantity holds the net new shares.
 */
@Value
@Builder(toBuilder = true)
public class Transaction {

    Long id;
    TransactionType type;
    String symbol;
    double quantity;
    Double price;
    LocalDate date;
    String currency;
    String assetType;
    String note;

    /**
     * Check the invariants a transaction must satisfy before it is appended to the ledger.
     *
     * @throws IllegalArgumentException describing the first violated invariant
     */
    public void validate() {
        if (type == null) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        if (date == null) {
            throw new IllegalArgumentException("Transaction date is required");
        }

        switch (type) {
            case BUY, SELL -> {
                if (!hasSymbol()) {
                    throw new IllegalArgumentException(type + " requires a symbol");
                }
                if (quantity <= 0) {
                    throw new IllegalArgumentException(type + " requires a positive quantity");
                }
                if (type == TransactionType.BUY && (price == null || price <= 0)) {
                    throw new IllegalArgumentException("BUY requires a positive price");
                }
            }
            case DEPOSIT, WITHDRAWAL -> {
                if (hasSymbol()) {
                    throw new IllegalArgumentException(type + " must not carry a symbol");
                }
                if (quantity <= 0) {
                    throw new IllegalArgumentException(type + " requires a positive amount");
                }
            }
            case DIVIDEND, SPLIT, CAPITAL_INCREASE, RIGHTS_ISSUE -> {
                if (!hasSymbol()) {
                    throw new IllegalArgumentException(type + " requires a symbol");
                }
            }
        }
    }

    public boolean hasSymbol() {
        return symbol != null && !symbol.isBlank();
    }

    /**
     * Cash amount moved by this transaction, positive when cash flows into the account.
     */
    public double cashEffect() {
        double unitPrice = price != null ? price : 0.0;
        return switch (type) {
            case BUY, RIGHTS_ISSUE -> -quantity * unitPrice;
            case SELL -> quantity * unitPrice;
            case DEPOSIT -> quantity;
            case WITHDRAWAL -> -quantity;
            case DIVIDEND -> unitPrice;
            case SPLIT, CAPITAL_INCREASE -> 0.0;
        };
    }

    /**
     * Signed change this transaction applies to the share count of its symbol.
     */
    public double shareEffect() {
        if (!type.affectsShares()) {
            return 0.0;
        }
        return type == TransactionType.SELL ? -quantity : quantity;
    }
}
