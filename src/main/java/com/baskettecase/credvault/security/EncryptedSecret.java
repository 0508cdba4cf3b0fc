package com.baskettecase.credvault.security;

/**
 * Ciphertext of a secret together with the salt its key was derived from.
 *
 * @param ciphertext base64 of IV || AES-GCM ciphertext || tag
 * @param salt       hex-encoded 128-bit KDF salt
 */
public record EncryptedSecret(String ciphertext, String salt) {

    @Override
    public String toString() {
        return "EncryptedSecret[salt=" + salt + "]";
    }
}
