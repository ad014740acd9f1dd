package com.portfoliotracker.engine.config;

import com.portfoliotracker.engine.domain.scoring.InvestmentSignalGenerator;
import com.portfoliotracker.engine.domain.scoring.PerformanceGrader;
import com.portfoliotracker.engine.domain.scoring.RiskScorer;
import com.portfoliotracker.engine.domain.scoring.ScoringTables;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Engine-wide beans: the clock that defines "today" and the scorers built from the
 * default scoring tables.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ScoringTables scoringTables() {
        return ScoringTables.DEFAULT;
    }

    @Bean
    public RiskScorer riskScorer(ScoringTables scoringTables) {
        return new RiskScorer(scoringTables);
    }

    @Bean
    public PerformanceGrader performanceGrader(ScoringTables scoringTables) {
        return new PerformanceGrader(scoringTables);
    }

    @Bean
    public InvestmentSignalGenerator investmentSignalGenerator() {
        return new InvestmentSignalGenerator();
    }
}
