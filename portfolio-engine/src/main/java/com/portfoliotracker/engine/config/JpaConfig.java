package com.portfoliotracker.engine.config;

import com.portfoliotracker.engine.domain.TransactionRecord;
import com.portfoliotracker.engine.repository.TransactionRecordRepository;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * JPA configuration for the ledger and price history. Audit timestamps on ledger rows come
 * from the engine clock.
 */
@Configuration
@EntityScan(basePackageClasses = TransactionRecord.class)
@EnableJpaRepositories(basePackageClasses = TransactionRecordRepository.class)
@EnableJpaAuditing(dateTimeProviderRef = "ledgerAuditTimeProvider")
@EnableTransactionManagement
public class JpaConfig {

    @Bean
    public DateTimeProvider ledgerAuditTimeProvider(Clock clock) {
        return () -> Optional.of(LocalDateTime.now(clock));
    }
}
