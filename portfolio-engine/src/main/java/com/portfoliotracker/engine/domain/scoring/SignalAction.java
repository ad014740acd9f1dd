package com.portfoliotracker.engine.domain.scoring;

import java.util.EnumSet;
import java.util.Set;

/**
 * Recommended action for a position.
 */
public enum SignalAction {
    STRONG_BUY,
    BUY_MORE,
    BUY_SMALL,
    HOLD,
    MONITOR_CLOSELY,
    REDUCE_POSITION,
    CONSIDER_SELL;

    public static final Set<SignalAction> BUYING = EnumSet.of(STRONG_BUY, BUY_MORE);

    public static final Set<SignalAction> SELLING = EnumSet.of(REDUCE_POSITION, CONSIDER_SELL);
}
