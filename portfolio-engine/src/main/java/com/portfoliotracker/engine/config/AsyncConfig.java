package com.portfoliotracker.engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool for blocking sector metadata lookups.
 */
@Configuration
public class AsyncConfig {

    @Value("${portfolio.sector.worker-threads:2}")
    private int sectorWorkerThreads;

    @Bean(name = "sectorLookupExecutor", destroyMethod = "shutdown")
    public ExecutorService sectorLookupExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(sectorWorkerThreads,
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("SectorLookup-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
    }
}
