package com.baskettecase.credvault.credential;

import com.baskettecase.credvault.identity.EngineType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for credential persistence.
 *
 * connection_hash carries a unique index over all rows, active or not: a soft-deleted row
 * keeps its hash slot until it is reactivated, so two rows can never share a connection.
 */
@Slf4j
@Repository
public class CredentialRepository {

    private final JdbcTemplate jdbcTemplate;

    public CredentialRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<Credential> ROW_MAPPER = new RowMapper<Credential>() {
        @Override
        public Credential mapRow(ResultSet rs, int rowNum) throws SQLException {
            Credential credential = new Credential();
            credential.setId(rs.getLong("id"));
            credential.setConnectionHash(rs.getString("connection_hash"));
            credential.setName(rs.getString("name"));
            credential.setHost(rs.getString("host"));
            credential.setPort(rs.getInt("port"));
            credential.setDatabase(rs.getString("database_name"));
            credential.setUsername(rs.getString("username"));
            credential.setEngineType(engineType(rs.getString("engine_type")));
            credential.setEncryptedSecret(rs.getString("encrypted_secret"));
            credential.setEncryptionSalt(rs.getString("encryption_salt"));
            credential.setOwnerSession(rs.getString("owner_session"));
            credential.setActive(rs.getBoolean("is_active"));
            credential.setCreatedAt(toInstant(rs.getTimestamp("created_at")));
            credential.setUpdatedAt(toInstant(rs.getTimestamp("updated_at")));
            credential.setLastUsed(toInstant(rs.getTimestamp("last_used")));
            return credential;
        }
    };

    /**
     * Insert a new credential and return its generated id
     */
    public long insert(Credential credential) {
        String sql = """
            INSERT INTO vault_credentials (
                connection_hash, name, host, port, database_name, username, engine_type,
                encrypted_secret, encryption_salt,
                created_at, updated_at, last_used, owner_session, is_active
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
            ps.setString(1, credential.getConnectionHash());
            ps.setString(2, credential.getName());
            ps.setString(3, credential.getHost());
            ps.setInt(4, credential.getPort());
            ps.setString(5, credential.getDatabase());
            ps.setString(6, credential.getUsername());
            ps.setString(7, credential.getEngineType().getWireName());
            ps.setString(8, credential.getEncryptedSecret());
            ps.setString(9, credential.getEncryptionSalt());
            ps.setTimestamp(10, toTimestamp(credential.getCreatedAt()));
            ps.setTimestamp(11, toTimestamp(credential.getUpdatedAt()));
            ps.setTimestamp(12, toTimestamp(credential.getLastUsed()));
            ps.setString(13, credential.getOwnerSession());
            ps.setBoolean(14, credential.isActive());
            return ps;
        }, keyHolder);

        long id = generatedId(keyHolder);
        credential.setId(id);
        log.debug("Inserted credential {} ({})", id, credential.getName());
        return id;
    }

    /**
     * Reactivate a soft-deleted credential with a new name, secret and owner.
     * Only matches a row that is still inactive, so a concurrent reactivation makes this return 0.
     */
    public int reactivate(Credential credential) {
        String sql = """
            UPDATE vault_credentials
            SET name = ?, encrypted_secret = ?, encryption_salt = ?,
                updated_at = ?, last_used = ?, owner_session = ?, is_active = true
            WHERE id = ? AND is_active = false
            """;

        return jdbcTemplate.update(sql,
            credential.getName(),
            credential.getEncryptedSecret(),
            credential.getEncryptionSalt(),
            toTimestamp(credential.getUpdatedAt()),
            toTimestamp(credential.getLastUsed()),
            credential.getOwnerSession(),
            credential.getId()
        );
    }

    /**
     * Find by connection hash, active or not
     */
    public Optional<Credential> findByHash(String connectionHash) {
        String sql = "SELECT * FROM vault_credentials WHERE connection_hash = ?";
        return first(jdbcTemplate.query(sql, ROW_MAPPER, connectionHash));
    }

    public Optional<Credential> findActiveByHash(String connectionHash) {
        String sql = "SELECT * FROM vault_credentials WHERE connection_hash = ? AND is_active = true";
        return first(jdbcTemplate.query(sql, ROW_MAPPER, connectionHash));
    }

    /**
     * Find by id, active or not
     */
    public Optional<Credential> findById(long id) {
        String sql = "SELECT * FROM vault_credentials WHERE id = ?";
        return first(jdbcTemplate.query(sql, ROW_MAPPER, id));
    }

    public Optional<Credential> findActiveById(long id) {
        String sql = "SELECT * FROM vault_credentials WHERE id = ? AND is_active = true";
        return first(jdbcTemplate.query(sql, ROW_MAPPER, id));
    }

    /**
     * Active credentials visible to a session (its own plus global ones), most recently used first.
     * A null session returns every active credential.
     */
    public List<Credential> findActiveVisibleTo(String ownerSession) {
        if (ownerSession == null) {
            String sql = """
                SELECT * FROM vault_credentials
                WHERE is_active = true
                ORDER BY last_used DESC NULLS LAST, id DESC
                """;
            return jdbcTemplate.query(sql, ROW_MAPPER);
        }

        String sql = """
            SELECT * FROM vault_credentials
            WHERE is_active = true AND (owner_session IS NULL OR owner_session = ?)
            ORDER BY last_used DESC NULLS LAST, id DESC
            """;
        return jdbcTemplate.query(sql, ROW_MAPPER, ownerSession);
    }

    /**
     * Update last used timestamp
     */
    public void updateLastUsed(long id, Instant lastUsed) {
        String sql = "UPDATE vault_credentials SET last_used = ? WHERE id = ?";
        jdbcTemplate.update(sql, toTimestamp(lastUsed), id);
    }

    /**
     * Update last used timestamp of the active credential with this hash
     *
     * @return number of rows touched (0 or 1)
     */
    public int touchByHash(String connectionHash, Instant lastUsed) {
        String sql = "UPDATE vault_credentials SET last_used = ? WHERE connection_hash = ? AND is_active = true";
        return jdbcTemplate.update(sql, toTimestamp(lastUsed), connectionHash);
    }

    /**
     * Soft delete (deactivate) a credential
     *
     * @return number of rows updated
     */
    public int softDelete(long id, Instant updatedAt) {
        String sql = "UPDATE vault_credentials SET is_active = false, updated_at = ? WHERE id = ?";
        return jdbcTemplate.update(sql, toTimestamp(updatedAt), id);
    }

    private static long generatedId(KeyHolder keyHolder) {
        // PostgreSQL hands back every column of the new row, H2 only the identity
        Map<String, Object> keys = keyHolder.getKeys();
        if (keys != null) {
            for (Map.Entry<String, Object> key : keys.entrySet()) {
                if ("id".equalsIgnoreCase(key.getKey()) && key.getValue() instanceof Number number) {
                    return number.longValue();
                }
            }
        }
        throw new DataRetrievalFailureException("Insert did not return a generated credential id");
    }

    private static EngineType engineType(String wireName) {
        try {
            return EngineType.fromWireName(wireName);
        } catch (IllegalArgumentException e) {
            throw new DataRetrievalFailureException("Unreadable engine type in stored credential: " + wireName, e);
        }
    }

    private static Optional<Credential> first(List<Credential> results) {
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }
}
