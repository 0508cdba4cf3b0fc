package com.baskettecase.credvault.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Map;

/**
 * Append-only persistence for audit entries: no update, no delete.
 */
@Slf4j
@Repository
public class AuditLogRepository {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<AuditEntry> rowMapper;

    public AuditLogRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> {
            AuditEntry entry = new AuditEntry();
            entry.setId(rs.getLong("id"));
            long credentialId = rs.getLong("credential_id");
            entry.setCredentialId(rs.wasNull() ? null : credentialId);
            entry.setConnectionHash(rs.getString("connection_hash"));
            entry.setOperation(operation(rs.getString("operation")));
            entry.setSuccess(rs.getBoolean("success"));
            entry.setErrorMessage(rs.getString("error_message"));
            entry.setOwnerSession(rs.getString("owner_session"));
            entry.setIpAddress(rs.getString("ip_address"));
            entry.setUserAgent(rs.getString("user_agent"));

            Timestamp occurredAt = rs.getTimestamp("occurred_at");
            if (occurredAt != null) {
                entry.setTimestamp(occurredAt.toInstant());
            }

            entry.setMetadata(readMetadata(rs.getString("metadata_json")));
            return entry;
        };
    }

    /**
     * Append an entry
     */
    public void insert(AuditEntry entry) {
        String sql = """
            INSERT INTO vault_audit_log (
                credential_id, connection_hash, operation, success, error_message,
                owner_session, ip_address, user_agent, occurred_at, metadata_json
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
            entry.getCredentialId(),
            entry.getConnectionHash(),
            entry.getOperation().getWireName(),
            entry.isSuccess(),
            entry.getErrorMessage(),
            entry.getOwnerSession(),
            entry.getIpAddress(),
            entry.getUserAgent(),
            Timestamp.from(entry.getTimestamp()),
            writeMetadata(entry.getMetadata())
        );
    }

    /**
     * Most recent entries first, optionally only those of one credential
     */
    public List<AuditEntry> findRecent(Long credentialId, int limit) {
        if (credentialId == null) {
            String sql = "SELECT * FROM vault_audit_log ORDER BY occurred_at DESC, id DESC LIMIT ?";
            return jdbcTemplate.query(sql, rowMapper, limit);
        }

        String sql = """
            SELECT * FROM vault_audit_log
            WHERE credential_id = ?
            ORDER BY occurred_at DESC, id DESC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, credentialId, limit);
    }

    private static AuditOperation operation(String wireName) {
        try {
            return AuditOperation.fromWireName(wireName);
        } catch (IllegalArgumentException e) {
            throw new DataRetrievalFailureException("Unreadable audit operation: " + wireName, e);
        }
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Audit metadata is not serializable: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable audit metadata, returning none: {}", e.getMessage());
            return null;
        }
    }
}
