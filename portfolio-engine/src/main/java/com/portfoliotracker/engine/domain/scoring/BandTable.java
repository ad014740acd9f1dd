package com.portfoliotracker.engine.domain.scoring;

import lombok.Value;

import java.util.List;

/**
 * Ordered threshold bands; the first matching band decides the points, otherwise the
 * fallback applies.
 */
@Value
public class BandTable {

    List<ThresholdBand> bands;
    int fallbackPoints;

    public static BandTable of(int fallbackPoints, ThresholdBand... bands) {
        return new BandTable(List.of(bands), fallbackPoints);
    }

    public int score(double value) {
        for (ThresholdBand band : bands) {
            if (band.matches(value)) {
                return band.getPoints();
            }
        }
        return fallbackPoints;
    }

    /**
     * Largest number of points this table can award.
     */
    public int maxPoints() {
        int max = fallbackPoints;
        for (ThresholdBand band : bands) {
            max = Math.max(max, band.getPoints());
        }
        return max;
    }
}
