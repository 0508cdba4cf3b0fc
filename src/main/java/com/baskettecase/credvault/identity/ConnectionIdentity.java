package com.baskettecase.credvault.identity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic fingerprint of the fields that identify a database connection.
 *
 * Two credentials with the same host, port, database, username and engine are the
 * same connection, whatever their display name or secret. No normalization is applied:
 * {@code "DB"} and {@code "db"} are different identities.
 */
public final class ConnectionIdentity {

    /** Length of a fingerprint in hex characters (SHA-256). */
    public static final int FINGERPRINT_LENGTH = 64;

    private ConnectionIdentity() {
    }

    /**
     * Fingerprint a connection as lowercase hex SHA-256 of
     * {@code "{host}:{port}/{database}@{username}:{engine}"}.
     */
    public static String fingerprint(String host, int port, String database, String username, EngineType engineType) {
        if (engineType == null) {
            throw new IllegalArgumentException("Engine type is required");
        }
        String canonical = host + ":" + port + "/" + database + "@" + username + ":" + engineType.getWireName();
        return sha256Hex(canonical);
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
