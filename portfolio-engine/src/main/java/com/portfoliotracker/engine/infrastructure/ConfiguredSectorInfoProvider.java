package com.portfoliotracker.engine.infrastructure;

import com.portfoliotracker.engine.config.EngineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Sector metadata read from {@code portfolio.sector.mappings}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfiguredSectorInfoProvider implements SectorInfoProvider {

    private final EngineProperties properties;

    @Override
    public Optional<SectorInfo> lookup(String symbol) {
        EngineProperties.SectorMapping mapping = properties.getSector().getMappings().get(symbol);
        if (mapping == null) {
            log.debug("No sector mapping configured for {}", symbol);
            return Optional.empty();
        }
        return Optional.of(SectorInfo.builder()
                .sector(mapping.getSector())
                .industry(mapping.getIndustry() != null ? mapping.getIndustry() : SectorInfo.UNKNOWN)
                .source("configuration")
                .build());
    }
}
