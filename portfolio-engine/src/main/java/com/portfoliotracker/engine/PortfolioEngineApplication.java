package com.portfoliotracker.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Portfolio Engine service.
 * Replays the transaction ledger and serves holdings, valuation and risk analytics.
 */
@SpringBootApplication
public class PortfolioEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortfolioEngineApplication.class, args);
    }

}
