package com.portfoliotracker.engine.domain;

/**
 * Percentage-declared corporate events that can be turned into ledger entries.
 */
public enum CorporateActionType {
    /**
     * Cash dividend of a percentage of nominal value per share.
     */
    DIVIDEND,
    /**
     * Bonus issue: a percentage of new shares per share held.
     */
    SPLIT
}
