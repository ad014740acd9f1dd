package com.portfoliotracker.engine.domain;

/**
 * Kinds of events recorded on the portfolio ledger.
 */
public enum TransactionType {
    BUY,
    SELL,
    DEPOSIT,
    WITHDRAWAL,
    DIVIDEND,
    SPLIT,
    CAPITAL_INCREASE,
    RIGHTS_ISSUE;

    /**
     * Whether the event changes the share count of its symbol.
     */
    public boolean affectsShares() {
        return this == BUY || this == SELL || this == SPLIT
                || this == CAPITAL_INCREASE || this == RIGHTS_ISSUE;
    }

    /**
     * Bonus-style events that add shares without a purchase price.
     */
    public boolean isShareBonus() {
        return this == SPLIT || this == CAPITAL_INCREASE;
    }
}
