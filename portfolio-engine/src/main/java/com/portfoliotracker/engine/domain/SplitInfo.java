package com.portfoliotracker.engine.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Known split applied to a chart's history, if any.
 */
@Value
@Builder
public class SplitInfo {

    private static final SplitInfo NONE = SplitInfo.builder().hasSplit(false).build();

    boolean hasSplit;
    LocalDate splitDate;
    Double splitRatio;
    String note;

    public static SplitInfo none() {
        return NONE;
    }

    public static SplitInfo applied(LocalDate splitDate, double splitRatio) {
        return SplitInfo.builder()
                .hasSplit(true)
                .splitDate(splitDate)
                .splitRatio(splitRatio)
                .note("Historical prices have been adjusted for stock split")
                .build();
    }
}
