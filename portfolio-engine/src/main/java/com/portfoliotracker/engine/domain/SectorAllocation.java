package com.portfoliotracker.engine.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Sector and industry split of the current holdings by market value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SectorAllocation {

    private Map<String, SectorBreakdown> sectors;
    private double totalValue;
    private int diversificationScore;
    private int numSectors;
    private int numStocks;

    /**
     * Diversification score from the number of distinct sectors: 0 for at most one,
     * 40 up to three, 70 up to five, 90 beyond.
     */
    public static int diversificationScore(int sectorCount) {
        if (sectorCount <= 1) {
            return 0;
        } else if (sectorCount <= 3) {
            return 40;
        } else if (sectorCount <= 5) {
            return 70;
        }
        return 90;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class SectorBreakdown {
        private double value;
        private double percentage;
        private List<SectorHolding> stocks;
        private Map<String, Double> industries;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class SectorHolding {
        private String symbol;
        private String industry;
        private double value;
        private double percentage;
        private String source;
    }
}
