package com.baskettecase.credvault.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Vault configuration bound from {@code credvault.*}.
 *
 * The master key is normally supplied through the CREDVAULT_MASTER_KEY environment variable.
 */
@Data
@ConfigurationProperties(prefix = "credvault")
public class VaultProperties {

    private Security security = new Security();
    private Audit audit = new Audit();
    private Save save = new Save();
    private Datasource datasource = new Datasource();
    private DeletePolicy deletePolicy = DeletePolicy.ANY;

    @Data
    public static class Security {
        private String masterKey;
        private int kdfIterations = 100_000;

        @Override
        public String toString() {
            return "Security(masterKey=***, kdfIterations=" + kdfIterations + ")";
        }
    }

    @Data
    public static class Audit {
        private int defaultListLimit = 100;
        private int maxListLimit = 1000;
    }

    @Data
    public static class Save {
        // Re-runs of a save that lost a race against another writer for the same hash
        private int maxAttempts = 3;
    }

    @Data
    public static class Datasource {
        private String url = "jdbc:postgresql://localhost:5432/credential_vault";
        private String username = "postgres";
        private String password;
        private int maximumPoolSize = 5;
        private long connectionTimeoutMs = 10000;

        @Override
        public String toString() {
            return "Datasource(url=" + url + ", username=" + username + ", maximumPoolSize=" + maximumPoolSize + ")";
        }
    }
}
