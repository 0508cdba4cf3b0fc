package com.baskettecase.credvault.audit;

import com.baskettecase.credvault.config.VaultProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Audit log for vault operations.
 *
 * Writes never reach the caller of the audited operation: a failed append is logged and
 * counted, and the operation's outcome stays as it was. Each append commits in its own
 * transaction so it can neither join nor roll back the audited write.
 */
@Slf4j
@Service
public class AuditLog {

    private final AuditLogRepository repository;
    private final AuditContext auditContext;
    private final TransactionTemplate auditTransaction;
    private final Clock clock;
    private final VaultProperties.Audit settings;
    private final Counter writeFailures;

    public AuditLog(
            AuditLogRepository repository,
            AuditContext auditContext,
            PlatformTransactionManager transactionManager,
            Clock clock,
            VaultProperties properties,
            MeterRegistry meterRegistry) {
        this.repository = repository;
        this.auditContext = auditContext;
        this.auditTransaction = new TransactionTemplate(transactionManager);
        this.auditTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
        this.settings = properties.getAudit();
        this.writeFailures = Counter.builder("credvault.audit.write.failures")
            .description("Audit entries that could not be written")
            .register(meterRegistry);
    }

    /**
     * Append one entry. Stamps the timestamp when the entry carries none, and the request
     * origin bound to the current thread when the entry carries no origin of its own.
     */
    public void record(AuditEntry entry) {
        try {
            if (entry.getTimestamp() == null) {
                entry.setTimestamp(clock.instant());
            }
            if (entry.getIpAddress() == null && entry.getUserAgent() == null) {
                RequestOrigin origin = auditContext.current();
                entry.setIpAddress(origin.ipAddress());
                entry.setUserAgent(origin.userAgent());
            }
            auditTransaction.executeWithoutResult(status -> repository.insert(entry));
            log.debug("Audit: {} success={} credential={}",
                entry.getOperation().getWireName(), entry.isSuccess(), entry.getCredentialId());
        } catch (RuntimeException e) {
            writeFailures.increment();
            log.warn("⚠️ Failed to write audit entry ({} on credential {}): {}",
                entry.getOperation() != null ? entry.getOperation().getWireName() : "unknown",
                entry.getCredentialId(), e.getMessage());
        }
    }

    /**
     * Newest entries first.
     *
     * @param credentialId only entries of this credential, or all when null
     * @param limit        maximum number of entries; null selects the configured default
     */
    public List<AuditEntry> list(Long credentialId, Integer limit) {
        int effectiveLimit = limit == null ? settings.getDefaultListLimit() : limit;
        effectiveLimit = Math.max(1, Math.min(effectiveLimit, settings.getMaxListLimit()));

        try {
            return List.copyOf(repository.findRecent(credentialId, effectiveLimit));
        } catch (DataAccessException e) {
            log.error("❌ Failed to read audit log: {}", e.getMessage());
            return List.of();
        }
    }
}
