package com.portfoliotracker.engine.domain;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * First-in, first-out cost basis attribution over a symbol's ledger history.
 *
 * <p>Split and capital-increase events add a zero-cost lot for the net new shares instead of
 * rescaling the existing lots. This lowers the average cost of the remaining position in the
 * same way, but it also means a sell after a split consumes full-cost pre-split lots first.
 */
@Slf4j
public final class FifoCostBasisCalculator {

    private FifoCostBasisCalculator() {
    }

    /**
     * Lots still open for {@code symbol} after replaying every buy, sell and split in order.
     */
    public static List<Lot> openLots(Collection<Transaction> ledger, String symbol) {
        Deque<Lot> queue = new ArrayDeque<>();

        for (Transaction tx : LedgerReplay.ordered(ledger)) {
            if (!symbol.equals(tx.getSymbol())) {
                continue;
            }

            switch (tx.getType()) {
                case BUY, RIGHTS_ISSUE -> queue.addLast(Lot.builder()
                        .symbol(symbol)
                        .quantity(tx.getQuantity())
                        .unitCost(tx.getPrice() != null ? tx.getPrice() : 0.0)
                        .acquisitionDate(tx.getDate())
                        .build());
                case SPLIT, CAPITAL_INCREASE -> {
                    if (tx.getQuantity() > 0) {
                        queue.addLast(Lot.builder()
                                .symbol(symbol)
                                .quantity(tx.getQuantity())
                                .unitCost(0.0)
                                .acquisitionDate(tx.getDate())
                                .build());
                    }
                }
                case SELL -> consume(queue, tx);
                default -> {
                    // cash-only events leave lots untouched
                }
            }
        }

        List<Lot> lots = new ArrayList<>(queue.size());
        queue.forEach(lot -> lots.add(lot.toBuilder().build()));
        return lots;
    }

    /**
     * Cost of the oldest {@code quantityToPrice} shares among the open lots of {@code symbol}.
     * Returns {@link CostBasis#ZERO} when the quantity is not positive.
     */
    public static CostBasis costBasisFifo(Collection<Transaction> ledger, String symbol, double quantityToPrice) {
        if (quantityToPrice <= 0) {
            return CostBasis.ZERO;
        }

        double needed = quantityToPrice;
        double totalCost = 0.0;
        double covered = 0.0;

        for (Lot lot : openLots(ledger, symbol)) {
            if (needed <= 0) {
                break;
            }
            double take = Math.min(needed, lot.getQuantity());
            totalCost += take * lot.getUnitCost();
            needed -= take;
            covered += take;
        }

        if (needed > LedgerReplay.HOLDING_EPSILON) {
            log.debug("Open lots of {} cover only {} of {} shares", symbol, covered, quantityToPrice);
        }

        double average = covered > 0 ? totalCost / covered : 0.0;
        return new CostBasis(totalCost, average);
    }

    private static void consume(Deque<Lot> queue, Transaction sell) {
        double remaining = sell.getQuantity();

        while (remaining > 0 && !queue.isEmpty()) {
            Lot oldest = queue.peekFirst();
            if (oldest.getQuantity() <= remaining) {
                remaining -= oldest.getQuantity();
                queue.pollFirst();
            } else {
                oldest.setQuantity(oldest.getQuantity() - remaining);
                remaining = 0;
            }
        }

        if (remaining > 0) {
            log.debug("Sell of {} {} on {} exceeds open lots by {}",
                    sell.getQuantity(), sell.getSymbol(), sell.getDate(), remaining);
        }
    }
}
