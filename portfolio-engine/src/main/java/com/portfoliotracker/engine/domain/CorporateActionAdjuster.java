package com.portfoliotracker.engine.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalises price history around splits and converts percentage-style corporate events
 * into concrete cash amounts and share counts.
 */
public final class CorporateActionAdjuster {

    private CorporateActionAdjuster() {
    }

    /**
     * Put bars dated strictly before {@code splitDate} onto the post-split share count:
     * prices are divided by {@code ratio} and volume multiplied by it. The input is not modified.
     */
    public static List<PriceBar> adjustForSplit(List<PriceBar> series, LocalDate splitDate, double ratio) {
        if (ratio <= 0) {
            throw new IllegalArgumentException("Split ratio must be positive: " + ratio);
        }

        List<PriceBar> adjusted = new ArrayList<>(series.size());
        for (PriceBar bar : series) {
            if (bar.getDate().isBefore(splitDate)) {
                adjusted.add(bar.toBuilder()
                        .open(bar.getOpen() / ratio)
                        .high(bar.getHigh() / ratio)
                        .low(bar.getLow() / ratio)
                        .close(bar.getClose() / ratio)
                        .volume(bar.getVolume() * ratio)
                        .build());
            } else {
                adjusted.add(bar.toBuilder().build());
            }
        }
        return adjusted;
    }

    /**
     * Split ratio for a bonus issue declared as a percentage, e.g. 100% gives 2.0.
     */
    public static double splitRatio(double percentage) {
        return 1.0 + percentage / 100.0;
    }

    /**
     * Net new shares a holder of {@code sharesHeld} receives from a split of {@code ratio}.
     */
    public static double newShares(double sharesHeld, double ratio) {
        return sharesHeld * (ratio - 1.0);
    }

    /**
     * Total dividend cash for {@code sharesHeld} at a payout declared as a percentage.
     */
    public static double dividendCash(double sharesHeld, double percentage) {
        return sharesHeld * (percentage / 100.0);
    }
}
