package com.portfoliotracker.engine.infrastructure;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sector and industry classification of a symbol, with where it came from.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class SectorInfo {

    public static final String UNKNOWN = "Unknown";

    private String sector;
    private String industry;
    private String source;

    public static SectorInfo unknown(String source) {
        return new SectorInfo(UNKNOWN, UNKNOWN, source);
    }

    @JsonIgnore
    public boolean isKnown() {
        return sector != null && !sector.isBlank() && !UNKNOWN.equals(sector);
    }
}
