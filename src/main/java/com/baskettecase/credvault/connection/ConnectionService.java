package com.baskettecase.credvault.connection;

import com.baskettecase.credvault.credential.CredentialDetails;
import com.baskettecase.credvault.credential.CredentialStore;
import com.baskettecase.credvault.credential.SecretResult;
import com.baskettecase.credvault.identity.EngineType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Connection lifecycle
 *
 * Called by whatever opens and closes the actual database connections. Keeps the
 * connected flags in step with those events and refreshes the matching credential's
 * last-used time. Only one connection is considered active at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConnectionService {

    private final CredentialStore credentialStore;
    private final ConnectionStateTracker stateTracker;

    /**
     * A connection was established. Marks the matching saved credential (if any) as the
     * connected one, replacing whatever was connected before.
     *
     * @return the saved credential for this connection, if there is one
     */
    public Optional<CredentialDetails> onConnected(
            String host, int port, String database, String username, EngineType engineType) {

        Optional<CredentialDetails> credential =
            credentialStore.checkDuplicate(host, port, database, username, engineType);

        if (credential.isEmpty()) {
            stateTracker.clearAll();
            log.debug("Connected to {}@{}:{}/{} without saved credentials", username, host, port, database);
            return credential;
        }

        CredentialDetails saved = credential.get();
        stateTracker.replaceWith(saved.connectionHash());
        credentialStore.touch(saved.connectionHash());
        log.info("🔗 Connected: {} (credential {})", saved.name(), saved.id());
        return credential;
    }

    /**
     * The active connection was closed
     */
    public void onDisconnected() {
        stateTracker.clearAll();
        log.info("🔌 Disconnected");
    }

    /**
     * Saved connections visible to a session, each flagged connected or disconnected
     */
    public List<ConnectionSummary> listConnections(String ownerSession) {
        return credentialStore.list(ownerSession).stream()
            .map(credential -> new ConnectionSummary(
                credential,
                stateTracker.isConnected(credential.connectionHash())
                    ? ConnectionStatus.CONNECTED
                    : ConnectionStatus.DISCONNECTED))
            .toList();
    }

    /**
     * Connection settings with the decrypted secret, ready to connect with
     *
     * @return empty when the credential is missing, not visible, or cannot be decrypted
     */
    public Optional<ResolvedConnection> resolveConnection(long credentialId, String ownerSession) {
        SecretResult result = credentialStore.getSecret(credentialId, ownerSession);
        if (!result.isOk()) {
            log.warn("⚠️ Cannot resolve connection {}: {}", credentialId, result.message());
            return Optional.empty();
        }

        CredentialDetails credential = result.credential();
        return Optional.of(new ResolvedConnection(
            credential.id(),
            credential.name(),
            credential.host(),
            credential.port(),
            credential.database(),
            credential.username(),
            result.secret(),
            credential.engineType()
        ));
    }
}
