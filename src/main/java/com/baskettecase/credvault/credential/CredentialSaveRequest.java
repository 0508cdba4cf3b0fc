package com.baskettecase.credvault.credential;

import com.baskettecase.credvault.identity.EngineType;

/**
 * Input of {@link CredentialStore#save(CredentialSaveRequest, String)}.
 *
 * @param name display label; blank means "synthesize one from the connection fields"
 */
public record CredentialSaveRequest(
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
        return "CredentialSaveRequest[name=" + name + ", host=" + host + ", port=" + port +
            ", database=" + database + ", username=" + username + ", secret=***, engineType=" + engineType + "]";
    }
}
