package com.baskettecase.credvault.credential;

import com.baskettecase.credvault.identity.EngineType;

import java.time.Instant;

/**
 * Credential as returned to callers (without sensitive data)
 */
public record CredentialDetails(
    long id,
    String connectionHash,
    String name,
    String host,
    int port,
    String database,
    String username,
    EngineType engineType,
    Instant createdAt,
    Instant updatedAt,
    Instant lastUsed,
    String ownerSession,
    boolean active,
    boolean hasSecret
) {}
