package com.baskettecase.credvault;

import com.baskettecase.credvault.config.VaultProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.event.EventListener;

/**
 * Credential Vault Application
 *
 * Stores database connection credentials encrypted, deduplicated by connection identity,
 * and audited on every access.
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(VaultProperties.class)
public class CredentialVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(CredentialVaultApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("🚀 Credential Vault is ready!");
        log.info("🔐 Secrets encrypted with AES-256-GCM under a PBKDF2-derived key");
        log.info("📊 Metrics published under credvault.*");
    }
}
