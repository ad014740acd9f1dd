package com.portfoliotracker.engine.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured engine settings bound from {@code portfolio.*}.
 */
@Data
@ConfigurationProperties(prefix = "portfolio")
public class EngineProperties {

    /**
     * Currency the ledger and prices are denominated in.
     */
    private String baseCurrency = "TRY";

    /**
     * Currency the valuation curve is additionally reported in.
     */
    private String secondaryCurrency = "EUR";

    /**
     * Splits applied to price history before returns are computed, keyed by symbol.
     */
    private Map<String, KnownSplit> knownSplits = new LinkedHashMap<>();

    /**
     * Benchmark indices for market comparison: display name to the symbol their history is
     * stored under.
     */
    private Map<String, String> marketIndices = new LinkedHashMap<>();

    private Sector sector = new Sector();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class KnownSplit {
        /**
         * ISO date of the split; prices strictly before it are adjusted.
         */
        private String date;
        private double ratio;

        public LocalDate effectiveDate() {
            return LocalDate.parse(date);
        }
    }

    @Data
    public static class Sector {
        private Map<String, SectorMapping> mappings = new LinkedHashMap<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SectorMapping {
        private String sector;
        private String industry;
    }
}
