package com.baskettecase.credvault.credential;

/**
 * Result of {@link CredentialStore#getSecret(long, String)}.
 *
 * @param credential the credential the secret belongs to; null when it was not found
 * @param secret     the decrypted secret; only set when status is OK
 */
public record SecretResult(
    SecretStatus status,
    CredentialDetails credential,
    String secret,
    String message
) {

    static SecretResult ok(CredentialDetails credential, String secret) {
        return new SecretResult(SecretStatus.OK, credential, secret, null);
    }

    static SecretResult notFound() {
        return new SecretResult(SecretStatus.NOT_FOUND, null, null, "Credential not found");
    }

    static SecretResult decryptionError(CredentialDetails credential, String message) {
        return new SecretResult(SecretStatus.DECRYPTION_ERROR, credential, null, message);
    }

    static SecretResult error(String message) {
        return new SecretResult(SecretStatus.ERROR, null, null, message);
    }

    public boolean isOk() {
        return status == SecretStatus.OK;
    }

    @Override
    public String toString() {
        return "SecretResult[status=" + status + ", credential=" + (credential != null ? credential.id() : null) +
            ", secret=" + (secret != null ? "***" : null) + ", message=" + message + "]";
    }
}
