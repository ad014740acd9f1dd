package com.portfoliotracker.engine.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * Portfolio value for one calendar day. {@code value} is the sum of {@code positions};
 * cash is reported alongside and not included.
 */
@Value
@Builder
public class ValuationPoint {

    LocalDate date;
    double value;
    double secondaryValue;
    Map<String, Double> positions;
    double cashBalance;
}
