package com.baskettecase.credvault.identity;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConnectionIdentity
 */
class ConnectionIdentityTest {

    private static final String BASE =
        ConnectionIdentity.fingerprint("db.example.com", 5432, "app", "u1", EngineType.POSTGRESQL);

    @Test
    void testFingerprintIsDeterministic() {
        String again = ConnectionIdentity.fingerprint("db.example.com", 5432, "app", "u1", EngineType.POSTGRESQL);

        assertEquals(BASE, again);
    }

    @Test
    void testFingerprintIsLowercaseSha256Hex() {
        assertEquals(ConnectionIdentity.FINGERPRINT_LENGTH, BASE.length());
        assertTrue(BASE.matches("[0-9a-f]{64}"));
    }

    @Test
    void testFingerprintMatchesCanonicalString() {
        String expected = HexFormat.of().formatHex(sha256("localhost:5432/app@u1:postgresql"));

        assertEquals(expected, ConnectionIdentity.fingerprint("localhost", 5432, "app", "u1", EngineType.POSTGRESQL));
    }

    @Test
    void testEachFieldChangesFingerprint() {
        assertNotEquals(BASE, ConnectionIdentity.fingerprint("db2.example.com", 5432, "app", "u1", EngineType.POSTGRESQL));
        assertNotEquals(BASE, ConnectionIdentity.fingerprint("db.example.com", 5433, "app", "u1", EngineType.POSTGRESQL));
        assertNotEquals(BASE, ConnectionIdentity.fingerprint("db.example.com", 5432, "app2", "u1", EngineType.POSTGRESQL));
        assertNotEquals(BASE, ConnectionIdentity.fingerprint("db.example.com", 5432, "app", "u2", EngineType.POSTGRESQL));
        assertNotEquals(BASE, ConnectionIdentity.fingerprint("db.example.com", 5432, "app", "u1", EngineType.MYSQL));
    }

    @Test
    void testFingerprintIsCaseSensitive() {
        assertNotEquals(BASE, ConnectionIdentity.fingerprint("DB.example.com", 5432, "app", "u1", EngineType.POSTGRESQL));
        assertNotEquals(BASE, ConnectionIdentity.fingerprint("db.example.com", 5432, "APP", "u1", EngineType.POSTGRESQL));
    }

    @Test
    void testMissingEngineRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> ConnectionIdentity.fingerprint("db.example.com", 5432, "app", "u1", null));
    }

    @Test
    void testEngineTypeFromWireName() {
        assertEquals(EngineType.POSTGRESQL, EngineType.fromWireName("postgresql"));
        assertEquals(EngineType.MONGODB, EngineType.fromWireName(" MongoDB "));

        IllegalArgumentException error =
            assertThrows(IllegalArgumentException.class, () -> EngineType.fromWireName("oracle"));
        assertTrue(error.getMessage().startsWith("Database type must be one of"));
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256")
                .digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
