package com.portfoliotracker.engine.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Headline figures of a price chart. {@code periodReturn} is the percentage change from the
 * first to the last close.
 */
@Value
@Builder
public class ChartSummary {

    double latestPrice;
    double periodReturn;
    double maxPrice;
    double minPrice;
    long averageVolume;
    int dataPoints;
}
