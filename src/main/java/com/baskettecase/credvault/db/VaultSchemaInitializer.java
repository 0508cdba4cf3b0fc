package com.baskettecase.credvault.db;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the vault tables and indexes when they do not exist yet.
 *
 * The DDL sticks to what PostgreSQL and H2 both accept.
 */
@Slf4j
@Component
public class VaultSchemaInitializer {

    private final JdbcTemplate jdbcTemplate;

    public VaultSchemaInitializer(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @PostConstruct
    public void initialize() {
        try {
            createCredentialsTable();
            createAuditLogTable();
            log.info("✅ Vault tables initialized");
        } catch (Exception e) {
            log.error("❌ Failed to initialize vault tables", e);
            throw e;
        }
    }

    private void createCredentialsTable() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS vault_credentials (
                id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                connection_hash VARCHAR(64) NOT NULL,
                name VARCHAR(255) NOT NULL,
                host VARCHAR(255) NOT NULL,
                port INTEGER NOT NULL,
                database_name VARCHAR(255) NOT NULL,
                username VARCHAR(255) NOT NULL,
                engine_type VARCHAR(50) NOT NULL,
                encrypted_secret TEXT NOT NULL,
                encryption_salt VARCHAR(32) NOT NULL,
                created_at TIMESTAMP NOT NULL,
                updated_at TIMESTAMP,
                last_used TIMESTAMP,
                owner_session VARCHAR(255),
                is_active BOOLEAN NOT NULL DEFAULT TRUE
            )
            """);

        // One row per connection, active or soft-deleted
        jdbcTemplate.execute("""
            CREATE UNIQUE INDEX IF NOT EXISTS vault_credentials_hash_idx
            ON vault_credentials(connection_hash)
            """);
        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS vault_credentials_session_idx
            ON vault_credentials(owner_session, is_active)
            """);
    }

    private void createAuditLogTable() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS vault_audit_log (
                id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                credential_id BIGINT,
                connection_hash VARCHAR(64),
                operation VARCHAR(32) NOT NULL,
                success BOOLEAN NOT NULL,
                error_message TEXT,
                owner_session VARCHAR(255),
                ip_address VARCHAR(45),
                user_agent TEXT,
                occurred_at TIMESTAMP NOT NULL,
                metadata_json TEXT
            )
            """);
        // Tables created before request origins were recorded
        jdbcTemplate.execute("ALTER TABLE vault_audit_log ADD COLUMN IF NOT EXISTS ip_address VARCHAR(45)");
        jdbcTemplate.execute("ALTER TABLE vault_audit_log ADD COLUMN IF NOT EXISTS user_agent TEXT");

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS vault_audit_log_credential_idx
            ON vault_audit_log(credential_id)
            """);
    }
}
