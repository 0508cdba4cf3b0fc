package com.baskettecase.credvault.security;

/**
 * A stored secret could not be decrypted: malformed ciphertext or salt, a different
 * master key, or a failed GCM authentication check.
 */
public class DecryptionException extends RuntimeException {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
