package com.portfoliotracker.engine.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * At-a-glance portfolio health: a health score, the best and worst 30-day movers and the
 * weight of the largest positions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DashboardMetrics {

    private LocalDate asOf;
    private PortfolioHealth portfolioHealth;
    private List<StockPerformance> topPerformers;
    private List<StockPerformance> worstPerformers;
    private ConcentrationRisk concentrationRisk;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class PortfolioHealth {
        private int score;
        private int numHoldings;
        private int positive30dPerformers;
        private int positivePerformers;
        private int totalPerformers;
        private double totalValue;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class StockPerformance {
        private String symbol;
        private double positionValue;
        private double performance30d;
        private double gainLoss30d;
        private double currentPrice;
        private double userReturn;
        private long daysHeld;
        private double annualizedReturn;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class ConcentrationRisk {
        private boolean concentrated;
        private double top3Percentage;
        private double maxPositionWeight;
        private List<PositionWeight> positions;

        public static ConcentrationRisk none() {
            return new ConcentrationRisk(false, 0.0, 0.0, List.of());
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PositionWeight {
        private String symbol;
        private double weight;
    }
}
