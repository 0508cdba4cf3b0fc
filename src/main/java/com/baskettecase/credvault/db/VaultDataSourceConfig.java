package com.baskettecase.credvault.db;

import com.baskettecase.credvault.config.VaultProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Configuration for the vault database connection.
 *
 * This database stores credentials and their audit log, so the pool is writable.
 */
@Slf4j
@Configuration
public class VaultDataSourceConfig {

    /**
     * Create the vault DataSource
     */
    @Bean(destroyMethod = "close")
    public HikariDataSource vaultDataSource(VaultProperties properties) {
        VaultProperties.Datasource settings = properties.getDatasource();

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(settings.getUrl());
        config.setUsername(settings.getUsername());
        config.setPassword(settings.getPassword());
        config.setPoolName("credvault-pool");

        // Small pool: one short transaction per vault operation
        config.setMaximumPoolSize(settings.getMaximumPoolSize());
        config.setMinimumIdle(1);
        config.setConnectionTimeout(settings.getConnectionTimeoutMs());
        config.setValidationTimeout(5000);

        // IMPORTANT: This connection must be writable for DDL/DML operations
        config.setReadOnly(false);
        config.setAutoCommit(true);

        HikariDataSource dataSource = new HikariDataSource(config);
        log.info("✅ Created connection pool '{}' for {} (max={})",
            config.getPoolName(), settings.getUrl(), config.getMaximumPoolSize());

        return dataSource;
    }

    @Bean
    public JdbcTemplate vaultJdbcTemplate(DataSource vaultDataSource) {
        return new JdbcTemplate(vaultDataSource);
    }

    @Bean
    public PlatformTransactionManager vaultTransactionManager(DataSource vaultDataSource) {
        return new DataSourceTransactionManager(vaultDataSource);
    }

    /**
     * Transactions for primary vault writes
     */
    @Bean
    public TransactionTemplate vaultTransactionTemplate(PlatformTransactionManager vaultTransactionManager) {
        return new TransactionTemplate(vaultTransactionManager);
    }

    @Bean
    public Clock vaultClock() {
        return Clock.systemUTC();
    }
}
