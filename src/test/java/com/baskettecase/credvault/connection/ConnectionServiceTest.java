package com.baskettecase.credvault.connection;

import com.baskettecase.credvault.credential.CredentialDetails;
import com.baskettecase.credvault.credential.CredentialStore;
import com.baskettecase.credvault.credential.SecretResult;
import com.baskettecase.credvault.credential.SecretStatus;
import com.baskettecase.credvault.identity.EngineType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConnectionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    @Mock
    private CredentialStore credentialStore;

    private ConnectionStateTracker tracker;
    private ConnectionService service;

    @BeforeEach
    void setUp() {
        tracker = new ConnectionStateTracker();
        service = new ConnectionService(credentialStore, tracker);
    }

    @Test
    void testOnConnectedMarksSavedCredential() {
        CredentialDetails saved = details(1L, "hash-a");
        when(credentialStore.checkDuplicate("localhost", 5432, "app", "u1", EngineType.POSTGRESQL))
            .thenReturn(Optional.of(saved));

        Optional<CredentialDetails> result =
            service.onConnected("localhost", 5432, "app", "u1", EngineType.POSTGRESQL);

        assertEquals(Optional.of(saved), result);
        assertTrue(tracker.isConnected("hash-a"));
        verify(credentialStore).touch("hash-a");
    }

    @Test
    void testOnConnectedReplacesPreviousConnection() {
        tracker.markConnected("hash-old");
        when(credentialStore.checkDuplicate("localhost", 5432, "app", "u1", EngineType.POSTGRESQL))
            .thenReturn(Optional.of(details(1L, "hash-a")));

        service.onConnected("localhost", 5432, "app", "u1", EngineType.POSTGRESQL);

        assertFalse(tracker.isConnected("hash-old"));
        assertTrue(tracker.isConnected("hash-a"));
    }

    @Test
    void testConcurrentConnectsLeaveOneConnection() throws Exception {
        when(credentialStore.checkDuplicate("host-a", 5432, "app", "u1", EngineType.POSTGRESQL))
            .thenReturn(Optional.of(details(1L, "hash-a")));
        when(credentialStore.checkDuplicate("host-b", 5432, "app", "u1", EngineType.POSTGRESQL))
            .thenReturn(Optional.of(details(2L, "hash-b")));

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 500; round++) {
                CyclicBarrier barrier = new CyclicBarrier(2);
                Future<?> a = executor.submit(() -> connectAfter(barrier, "host-a"));
                Future<?> b = executor.submit(() -> connectAfter(barrier, "host-b"));
                a.get(10, TimeUnit.SECONDS);
                b.get(10, TimeUnit.SECONDS);

                Set<String> connected = tracker.connectedHashes();
                assertEquals(1, connected.size(), "round " + round + " left " + connected);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testOnConnectedWithoutSavedCredential() {
        tracker.markConnected("hash-old");
        when(credentialStore.checkDuplicate("db.internal", 3306, "shop", "root", EngineType.MYSQL))
            .thenReturn(Optional.empty());

        Optional<CredentialDetails> result =
            service.onConnected("db.internal", 3306, "shop", "root", EngineType.MYSQL);

        assertTrue(result.isEmpty());
        assertTrue(tracker.connectedHashes().isEmpty());
        verify(credentialStore, never()).touch(anyString());
    }

    @Test
    void testOnDisconnectedClearsAll() {
        tracker.markConnected("hash-a");
        tracker.markConnected("hash-b");

        service.onDisconnected();

        assertTrue(tracker.connectedHashes().isEmpty());
    }

    @Test
    void testListConnectionsReportsStatus() {
        when(credentialStore.list("s1")).thenReturn(List.of(details(1L, "hash-a"), details(2L, "hash-b")));
        tracker.markConnected("hash-b");

        List<ConnectionSummary> connections = service.listConnections("s1");

        assertEquals(2, connections.size());
        assertEquals(ConnectionStatus.DISCONNECTED, connections.get(0).status());
        assertTrue(connections.get(1).isConnected());
        assertEquals(2L, connections.get(1).credential().id());
    }

    @Test
    void testResolveConnection() {
        when(credentialStore.getSecret(1L, "s1"))
            .thenReturn(new SecretResult(SecretStatus.OK, details(1L, "hash-a"), "p@ss", null));

        ResolvedConnection resolved = service.resolveConnection(1L, "s1").orElseThrow();

        assertEquals("localhost", resolved.host());
        assertEquals(5432, resolved.port());
        assertEquals("p@ss", resolved.secret());
        assertEquals(EngineType.POSTGRESQL, resolved.engineType());
        assertFalse(resolved.toString().contains("p@ss"));
    }

    @Test
    void testResolveConnectionFailsWhenSecretUnavailable() {
        when(credentialStore.getSecret(7L, "s1"))
            .thenReturn(new SecretResult(SecretStatus.NOT_FOUND, null, null, "Credential not found"));

        assertTrue(service.resolveConnection(7L, "s1").isEmpty());
    }

    private Void connectAfter(CyclicBarrier barrier, String host) throws Exception {
        barrier.await(10, TimeUnit.SECONDS);
        service.onConnected(host, 5432, "app", "u1", EngineType.POSTGRESQL);
        return null;
    }

    private static CredentialDetails details(long id, String hash) {
        return new CredentialDetails(id, hash, "conn-" + id, "localhost", 5432, "app", "u1",
            EngineType.POSTGRESQL, NOW, NOW, NOW, "s1", true, true);
    }
}
