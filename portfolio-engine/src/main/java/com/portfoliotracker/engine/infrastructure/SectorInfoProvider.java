package com.portfoliotracker.engine.infrastructure;

import java.util.Optional;

/**
 * External source of sector metadata. Implementations may block and may throw; callers
 * treat a failure as an unknown sector.
 */
public interface SectorInfoProvider {

    /**
     * Look up the classification of {@code symbol}.
     *
     * @return the classification, or empty if the source has none
     */
    Optional<SectorInfo> lookup(String symbol);
}
