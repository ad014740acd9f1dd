package com.portfoliotracker.engine.domain;

import lombok.Value;

/**
 * Cost attributed to a holding by FIFO lot consumption.
 */
@Value
public class CostBasis {

    public static final CostBasis ZERO = new CostBasis(0.0, 0.0);

    double totalCost;
    double averageUnitCost;
}
