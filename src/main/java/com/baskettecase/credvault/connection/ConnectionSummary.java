package com.baskettecase.credvault.connection;

import com.baskettecase.credvault.credential.CredentialDetails;

/**
 * A saved connection as shown to clients: never carries the secret
 */
public record ConnectionSummary(
    CredentialDetails credential,
    ConnectionStatus status
) {

    public boolean isConnected() {
        return status == ConnectionStatus.CONNECTED;
    }
}
