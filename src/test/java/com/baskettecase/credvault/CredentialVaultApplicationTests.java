package com.baskettecase.credvault;

import com.baskettecase.credvault.connection.ConnectionService;
import com.baskettecase.credvault.connection.ConnectionSummary;
import com.baskettecase.credvault.credential.CredentialSaveRequest;
import com.baskettecase.credvault.credential.CredentialStore;
import com.baskettecase.credvault.credential.SaveResult;
import com.baskettecase.credvault.credential.SaveStatus;
import com.baskettecase.credvault.identity.EngineType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
    "credvault.security.master-key=context-test-master-key-0123456789",
    "credvault.datasource.url=jdbc:h2:mem:vault-context;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1",
    "credvault.datasource.username=sa",
    "credvault.datasource.password="
})
class CredentialVaultApplicationTests {

    @Autowired
    private CredentialStore credentialStore;

    @Autowired
    private ConnectionService connectionService;

    @Test
    void testSaveAndConnectThroughContext() {
        SaveResult saved = credentialStore.save(
            new CredentialSaveRequest("orders", "db.internal", 5432, "orders", "svc", "s3cret", EngineType.POSTGRESQL),
            null);
        assertEquals(SaveStatus.CREATED, saved.status());

        connectionService.onConnected("db.internal", 5432, "orders", "svc", EngineType.POSTGRESQL);

        List<ConnectionSummary> connections = connectionService.listConnections(null);
        assertEquals(1, connections.size());
        assertTrue(connections.get(0).isConnected());
        assertEquals("s3cret", connectionService.resolveConnection(saved.credential().id(), null)
            .orElseThrow()
            .secret());
    }
}
