package com.portfoliotracker.engine.domain;

import java.time.LocalDate;
import java.util.*;
import java.util.function.Predicate;

/**
 * Rebuilds share quantities and cash balance by replaying the ledger in date order.
 * Transactions dated the same day keep their ledger (insertion) order.
 */
public final class LedgerReplay {

    /**
     * Quantities at or below this threshold are treated as floating-point residue, not holdings.
     */
    public static final double HOLDING_EPSILON = 1e-3;

    private LedgerReplay() {
    }

    /**
     * Stable date ordering of the ledger.
     */
    public static List<Transaction> ordered(Collection<Transaction> ledger) {
        List<Transaction> ordered = new ArrayList<>(ledger);
        ordered.sort(Comparator.comparing(Transaction::getDate));
        return ordered;
    }

    /**
     * Share quantity per symbol after every transaction dated on or before {@code date}.
     * Oversold symbols come back negative.
     */
    public static Map<String, Double> holdingsAsOf(Collection<Transaction> ledger, LocalDate date) {
        return replay(ledger, tx -> !tx.getDate().isAfter(date)).getQuantities();
    }

    /**
     * Cash balance after every transaction dated on or before {@code date}.
     */
    public static double cashBalanceAsOf(Collection<Transaction> ledger, LocalDate date) {
        return replay(ledger, tx -> !tx.getDate().isAfter(date)).getCashBalance();
    }

    /**
     * Shares of {@code symbol} held strictly before {@code date}.
     */
    public static double holdingsBefore(Collection<Transaction> ledger, String symbol, LocalDate date) {
        return replay(ledger, tx -> tx.getDate().isBefore(date)).quantityOf(symbol);
    }

    /**
     * Holdings and cash after every transaction dated on or before {@code date}.
     */
    public static HoldingSnapshot snapshotAsOf(Collection<Transaction> ledger, LocalDate date) {
        HoldingSnapshot all = replay(ledger, tx -> !tx.getDate().isAfter(date));
        return new HoldingSnapshot(date, all.getQuantities(), all.getCashBalance());
    }

    /**
     * Symbols whose replayed quantity over the whole ledger exceeds {@link #HOLDING_EPSILON}.
     */
    public static Map<String, Double> currentHoldings(Collection<Transaction> ledger) {
        return held(replay(ledger, tx -> true).getQuantities());
    }

    /**
     * Keep only the entries that count as currently held.
     */
    public static Map<String, Double> held(Map<String, Double> quantities) {
        Map<String, Double> held = new TreeMap<>();
        quantities.forEach((symbol, quantity) -> {
            if (isHeld(quantity)) {
                held.put(symbol, quantity);
            }
        });
        return held;
    }

    public static boolean isHeld(double quantity) {
        return quantity > HOLDING_EPSILON;
    }

    /**
     * Apply one transaction to running quantities, returning its cash effect.
     */
    public static double apply(Transaction tx, Map<String, Double> quantities) {
        if (tx.getType().affectsShares() && tx.hasSymbol()) {
            quantities.merge(tx.getSymbol(), tx.shareEffect(), Double::sum);
        }
        return tx.cashEffect();
    }

    private static HoldingSnapshot replay(Collection<Transaction> ledger, Predicate<Transaction> include) {
        Map<String, Double> quantities = new TreeMap<>();
        double cash = 0.0;
        LocalDate last = null;

        for (Transaction tx : ordered(ledger)) {
            if (!include.test(tx)) {
                continue;
            }
            cash += apply(tx, quantities);
            last = tx.getDate();
        }

        return new HoldingSnapshot(last, quantities, cash);
    }
}
