package com.baskettecase.credvault.credential;

import com.baskettecase.credvault.identity.EngineType;
import lombok.Data;
import lombok.ToString;

import java.time.Instant;

/**
 * Stored connection credential.
 *
 * The identity fields (host, port, database, username, engineType) never change once the
 * row exists: they are what connectionHash is computed from. A soft-deleted row keeps its
 * hash and is reused when the same connection is saved again.
 */
@Data
public class Credential {

    private Long id;
    private String connectionHash;
    private String name;

    private String host;
    private int port;
    private String database;
    private String username;
    private EngineType engineType;

    // Never leaves the vault
    @ToString.Exclude
    private String encryptedSecret;
    @ToString.Exclude
    private String encryptionSalt;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastUsed;

    // null = visible to every session
    private String ownerSession;
    private boolean active;

    /**
     * Whether a caller bound to the given session may see this credential.
     * A null session is an internal caller and sees everything.
     */
    public boolean isVisibleTo(String session) {
        return session == null || ownerSession == null || ownerSession.equals(session);
    }

    /**
     * Caller-facing view without the ciphertext or salt
     */
    public CredentialDetails toDetails() {
        return new CredentialDetails(
            id,
            connectionHash,
            name,
            host,
            port,
            database,
            username,
            engineType,
            createdAt,
            updatedAt,
            lastUsed,
            ownerSession,
            active,
            encryptedSecret != null && !encryptedSecret.isEmpty()
        );
    }
}
