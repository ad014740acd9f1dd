package com.portfoliotracker.engine.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One day of a price chart: the bar itself plus indicators, which stay null until their
 * window has filled. Daily return and volatility are percentages.
 */
@Value
@Builder
public class ChartPoint {

    LocalDate date;
    double open;
    double high;
    double low;
    double close;
    double volume;
    Double sma20;
    Double sma50;
    Double dailyReturn;
    Double volatility;
}
