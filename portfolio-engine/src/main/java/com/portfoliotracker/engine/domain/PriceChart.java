package com.portfoliotracker.engine.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Split-adjusted daily history of one symbol with technical indicators.
 */
@Value
@Builder
public class PriceChart {

    String symbol;
    String period;
    List<ChartPoint> points;
    ChartSummary summary;
    SplitInfo splitInfo;
}
