package com.baskettecase.credvault.db;

import com.baskettecase.credvault.config.VaultProperties;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * In-memory H2 databases and settings for vault tests.
 */
public class VaultTestHarness {

    public static final String MASTER_KEY = "test-master-key-0123456789abcdef";

    /**
     * Settings pointing at a fresh, uniquely named H2 database in PostgreSQL mode
     */
    public static VaultProperties newProperties() {
        VaultProperties properties = new VaultProperties();
        properties.getSecurity().setMasterKey(MASTER_KEY);
        properties.getDatasource().setUrl("jdbc:h2:mem:vault-" + UUID.randomUUID() +
            ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        properties.getDatasource().setUsername("sa");
        properties.getDatasource().setPassword("");
        return properties;
    }

    /**
     * @return a pooled H2 data source with the vault tables created
     */
    public static HikariDataSource newDatabase(VaultProperties properties) {
        HikariDataSource dataSource = new VaultDataSourceConfig().vaultDataSource(properties);
        new VaultSchemaInitializer(new JdbcTemplate(dataSource)).initialize();
        return dataSource;
    }

    /**
     * Clock that only moves when told to
     */
    public static class MutableClock extends Clock {

        private Instant now;

        public MutableClock(Instant start) {
            this.now = start;
        }

        public void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
