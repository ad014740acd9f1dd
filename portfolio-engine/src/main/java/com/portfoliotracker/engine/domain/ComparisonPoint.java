package com.portfoliotracker.engine.domain;

import lombok.Value;

import java.time.LocalDate;

/**
 * A close and its percentage change since the first close of the window.
 */
@Value
public class ComparisonPoint {

    LocalDate date;
    double close;
    double changePct;
}
