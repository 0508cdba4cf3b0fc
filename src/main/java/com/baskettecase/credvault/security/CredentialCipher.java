package com.baskettecase.credvault.security;

import com.baskettecase.credvault.config.VaultProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Encrypts and decrypts connection secrets using AES-256-GCM.
 *
 * Every secret gets its own 128-bit salt. The AES key for that secret is derived from the
 * process-wide master key and the salt with PBKDF2-HMAC-SHA256, so a stored record only
 * decrypts under the master key that was configured when it was written.
 *
 * Master key must be provided via CREDVAULT_MASTER_KEY (credvault.security.master-key).
 */
@Slf4j
@Service
public class CredentialCipher {

    public static final int MIN_KDF_ITERATIONS = 100_000;

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final int SALT_LENGTH = 16; // 128 bits
    private static final int KEY_LENGTH = 256; // bits
    private static final int GCM_IV_LENGTH = 12; // 96 bits
    private static final int GCM_TAG_LENGTH = 128; // bits

    private final char[] masterKey;
    private final int iterations;
    private final SecureRandom secureRandom;
    private final Timer encryptTimer;
    private final Timer decryptTimer;

    public CredentialCipher(VaultProperties properties, MeterRegistry meterRegistry) {
        String configuredKey = properties.getSecurity().getMasterKey();
        if (configuredKey == null || configuredKey.trim().isEmpty()) {
            throw new IllegalStateException(
                "Master key not configured. Set CREDVAULT_MASTER_KEY environment variable " +
                "(credvault.security.master-key). Generate one with: openssl rand -base64 32"
            );
        }

        int configuredIterations = properties.getSecurity().getKdfIterations();
        if (configuredIterations < MIN_KDF_ITERATIONS) {
            throw new IllegalStateException(
                "KDF iterations must be at least " + MIN_KDF_ITERATIONS + ". Configured: " + configuredIterations
            );
        }

        this.masterKey = configuredKey.toCharArray();
        this.iterations = configuredIterations;
        this.secureRandom = new SecureRandom();
        this.encryptTimer = Timer.builder("credvault.cipher.duration")
            .description("Time taken to derive a key and encrypt or decrypt a secret")
            .tag("op", "encrypt")
            .register(meterRegistry);
        this.decryptTimer = Timer.builder("credvault.cipher.duration")
            .description("Time taken to derive a key and encrypt or decrypt a secret")
            .tag("op", "decrypt")
            .register(meterRegistry);

        log.info("Credential cipher initialized with AES-256-GCM, PBKDF2-HMAC-SHA256 ({} iterations)", iterations);
    }

    /**
     * Encrypts a secret under a key derived from a fresh salt.
     *
     * @param secret the plaintext secret (never null, may be empty)
     * @return base64 ciphertext with embedded IV, and the hex salt
     */
    public EncryptedSecret encrypt(String secret) {
        if (secret == null) {
            throw new IllegalArgumentException("Cannot encrypt null value");
        }

        return encryptTimer.record(() -> {
            byte[] salt = new byte[SALT_LENGTH];
            secureRandom.nextBytes(salt);
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            try {
                Cipher cipher = Cipher.getInstance(ALGORITHM);
                cipher.init(Cipher.ENCRYPT_MODE, deriveKey(salt), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
                byte[] ciphertext = cipher.doFinal(secret.getBytes(StandardCharsets.UTF_8));

                ByteBuffer byteBuffer = ByteBuffer.allocate(iv.length + ciphertext.length);
                byteBuffer.put(iv);
                byteBuffer.put(ciphertext);

                return new EncryptedSecret(
                    Base64.getEncoder().encodeToString(byteBuffer.array()),
                    HexFormat.of().formatHex(salt)
                );
            } catch (GeneralSecurityException e) {
                log.error("Encryption failed", e);
                throw new IllegalStateException("Failed to encrypt credential", e);
            }
        });
    }

    /**
     * Decrypts a ciphertext produced by {@link #encrypt(String)}.
     *
     * @throws DecryptionException if the input is malformed, was written under another
     *                             master key, or fails authentication
     */
    public String decrypt(String ciphertext, String salt) {
        if (ciphertext == null || ciphertext.trim().isEmpty()) {
            throw new DecryptionException("Cannot decrypt null or empty value");
        }
        if (salt == null || salt.trim().isEmpty()) {
            throw new DecryptionException("Missing encryption salt");
        }

        return decryptTimer.record(() -> {
            byte[] combined;
            byte[] saltBytes;
            try {
                combined = Base64.getDecoder().decode(ciphertext.trim());
                saltBytes = HexFormat.of().parseHex(salt.trim());
            } catch (IllegalArgumentException e) {
                throw new DecryptionException("Malformed ciphertext or salt", e);
            }

            // IV plus at least a full tag
            if (combined.length < GCM_IV_LENGTH + GCM_TAG_LENGTH / 8) {
                throw new DecryptionException("Ciphertext too short");
            }

            ByteBuffer byteBuffer = ByteBuffer.wrap(combined);
            byte[] iv = new byte[GCM_IV_LENGTH];
            byteBuffer.get(iv);
            byte[] ciphertextBytes = new byte[byteBuffer.remaining()];
            byteBuffer.get(ciphertextBytes);

            try {
                Cipher cipher = Cipher.getInstance(ALGORITHM);
                cipher.init(Cipher.DECRYPT_MODE, deriveKey(saltBytes), new GCMParameterSpec(GCM_TAG_LENGTH, iv));
                byte[] plaintextBytes = cipher.doFinal(ciphertextBytes);
                return new String(plaintextBytes, StandardCharsets.UTF_8);
            } catch (AEADBadTagException e) {
                throw new DecryptionException("Authentication failed: wrong master key or tampered ciphertext", e);
            } catch (GeneralSecurityException e) {
                throw new DecryptionException("Failed to decrypt credential", e);
            }
        });
    }

    /**
     * Checks that a stored ciphertext decrypts to the expected secret. Never throws.
     */
    public boolean verifyIntegrity(String ciphertext, String salt, String expected) {
        try {
            return decrypt(ciphertext, salt).equals(expected);
        } catch (DecryptionException e) {
            log.debug("Integrity check failed: {}", e.getMessage());
            return false;
        }
    }

    private SecretKey deriveKey(byte[] salt) throws GeneralSecurityException {
        PBEKeySpec spec = new PBEKeySpec(masterKey, salt, iterations, KEY_LENGTH);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance(KDF_ALGORITHM);
            byte[] keyBytes = factory.generateSecret(spec).getEncoded();
            return new SecretKeySpec(keyBytes, "AES");
        } finally {
            spec.clearPassword();
        }
    }
}
