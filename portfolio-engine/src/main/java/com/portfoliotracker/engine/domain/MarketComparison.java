package com.portfoliotracker.engine.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Cumulative change of a symbol next to benchmark indices over the same window. Indices
 * are keyed by display name; an index without stored history is left out.
 */
@Value
@Builder
public class MarketComparison {

    String symbol;
    String period;
    List<ComparisonPoint> stockData;
    Map<String, List<ComparisonPoint>> indices;
}
