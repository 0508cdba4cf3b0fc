package com.baskettecase.credvault.connection;

import com.baskettecase.credvault.identity.EngineType;

/**
 * Everything needed to open a connection, secret included.
 * Never log or persist this object - the secret is in plaintext!
 */
public record ResolvedConnection(
    long credentialId,
    String name,
    String host,
    int port,
    String database,
    String username,
    String secret,
    EngineType engineType
) {

    @Override
    public String toString() {
        return "ResolvedConnection[credentialId=" + credentialId + ", name=" + name + ", host=" + host +
            ", port=" + port + ", database=" + database + ", username=" + username +
            ", secret=***, engineType=" + engineType + "]";
    }
}
