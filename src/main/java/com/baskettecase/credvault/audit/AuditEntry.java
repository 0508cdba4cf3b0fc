package com.baskettecase.credvault.audit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One row of the append-only audit log.
 *
 * credentialId is null when the operation failed before a credential existed, and
 * connectionHash is null when it failed before the connection could be fingerprinted.
 * ipAddress and userAgent are null when the caller reported no request origin.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntry {

    private Long id;
    private Long credentialId;
    private String connectionHash;
    private AuditOperation operation;
    private boolean success;
    private String errorMessage;
    private String ownerSession;
    private String ipAddress;
    private String userAgent;
    private Instant timestamp;

    // Free-form context, stored as JSON
    private Map<String, Object> metadata;
}
