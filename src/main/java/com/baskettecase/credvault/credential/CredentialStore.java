package com.baskettecase.credvault.credential;

import com.baskettecase.credvault.audit.AuditEntry;
import com.baskettecase.credvault.audit.AuditLog;
import com.baskettecase.credvault.audit.AuditOperation;
import com.baskettecase.credvault.config.DeletePolicy;
import com.baskettecase.credvault.config.VaultProperties;
import com.baskettecase.credvault.identity.ConnectionIdentity;
import com.baskettecase.credvault.identity.EngineType;
import com.baskettecase.credvault.security.CredentialCipher;
import com.baskettecase.credvault.security.DecryptionException;
import com.baskettecase.credvault.security.EncryptedSecret;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Credential Store
 *
 * Saves, deduplicates, reads, decrypts and soft-deletes connection credentials.
 * Every save, get, getSecret and delete call writes exactly one audit entry, whatever
 * its outcome; listing and duplicate checks write none.
 */
@Slf4j
@Service
public class CredentialStore {

    private static final int LOCK_STRIPES = 64;

    private final CredentialRepository repository;
    private final CredentialCipher cipher;
    private final AuditLog auditLog;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final DeletePolicy deletePolicy;
    private final int maxSaveAttempts;

    // Serializes saves of the same connection hash within this process
    private final ReentrantLock[] saveLocks = new ReentrantLock[LOCK_STRIPES];

    private final Map<SaveStatus, Counter> saveCounters = new EnumMap<>(SaveStatus.class);
    private final Counter deleteCounter;
    private final Counter decryptSuccessCounter;
    private final Counter decryptFailureCounter;

    public CredentialStore(
            CredentialRepository repository,
            CredentialCipher cipher,
            AuditLog auditLog,
            TransactionTemplate transactionTemplate,
            Clock clock,
            VaultProperties properties,
            MeterRegistry meterRegistry) {
        this.repository = repository;
        this.cipher = cipher;
        this.auditLog = auditLog;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.deletePolicy = properties.getDeletePolicy();
        this.maxSaveAttempts = Math.max(1, properties.getSave().getMaxAttempts());

        for (int i = 0; i < LOCK_STRIPES; i++) {
            saveLocks[i] = new ReentrantLock();
        }
        for (SaveStatus status : SaveStatus.values()) {
            saveCounters.put(status, Counter.builder("credvault.credentials.saves")
                .description("Credential save outcomes")
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry));
        }
        this.deleteCounter = Counter.builder("credvault.credentials.deletes")
            .description("Credentials soft-deleted")
            .register(meterRegistry);
        this.decryptSuccessCounter = Counter.builder("credvault.secrets.decryptions")
            .description("Secret retrievals")
            .tag("outcome", "success")
            .register(meterRegistry);
        this.decryptFailureCounter = Counter.builder("credvault.secrets.decryptions")
            .description("Secret retrievals")
            .tag("outcome", "failure")
            .register(meterRegistry);
    }

    /**
     * Save a credential, reusing what is already stored for the same connection.
     *
     * An active credential with the same fingerprint wins: its last-used time is refreshed and
     * the supplied secret is discarded. A soft-deleted one is reactivated in place with the new
     * name, secret and owner. Otherwise a new record is inserted.
     *
     * @param request      connection fields, display name and plaintext secret
     * @param ownerSession session tag to store; null makes the credential global
     * @return status with the stored credential; never throws
     */
    public SaveResult save(CredentialSaveRequest request, String ownerSession) {
        SaveAttempt attempt = new SaveAttempt();
        try {
            validate(request);
            attempt.connectionHash = ConnectionIdentity.fingerprint(
                request.host(), request.port(), request.database(), request.username(), request.engineType());

            SaveResult result;
            ReentrantLock lock = lockFor(attempt.connectionHash);
            lock.lock();
            try {
                result = saveWithRetry(request, ownerSession, attempt);
            } finally {
                lock.unlock();
            }

            auditSave(result, attempt, request, ownerSession);
            saveCounters.get(result.status()).increment();
            return result;

        } catch (RuntimeException e) {
            // Everything written inside the transaction has been rolled back by now
            log.error("❌ Failed to save credential {}: {}", request != null ? request.name() : null, e.getMessage());

            auditLog.record(AuditEntry.builder()
                .credentialId(attempt.credentialId)
                .connectionHash(attempt.connectionHash)
                .operation(attempt.operation)
                .success(false)
                .errorMessage(e.getMessage())
                .ownerSession(ownerSession)
                .build());

            saveCounters.get(SaveStatus.ERROR).increment();
            return SaveResult.error(failureReason(e));
        }
    }

    /**
     * Get a credential by id. Refreshes its last-used time.
     *
     * @return the credential when it is active and visible to the session
     */
    public Optional<CredentialDetails> get(long id, String ownerSession) {
        try {
            Optional<Credential> found = findVisible(id, ownerSession);
            if (found.isEmpty()) {
                auditFailure(AuditOperation.ACCESS, id, null, "Credential not found", ownerSession);
                return Optional.empty();
            }

            Credential credential = found.get();
            markUsed(credential);

            auditLog.record(AuditEntry.builder()
                .credentialId(credential.getId())
                .connectionHash(credential.getConnectionHash())
                .operation(AuditOperation.ACCESS)
                .success(true)
                .ownerSession(ownerSession)
                .build());

            log.debug("Credential {} accessed", id);
            return Optional.of(credential.toDetails());

        } catch (DataAccessException e) {
            log.error("❌ Failed to get credential {}: {}", id, e.getMessage());
            auditFailure(AuditOperation.ACCESS, id, null, e.getMessage(), ownerSession);
            return Optional.empty();
        }
    }

    /**
     * Get the decrypted secret of a credential. Refreshes its last-used time on success.
     * Audited as a single decrypt entry, successful or not.
     */
    public SecretResult getSecret(long id, String ownerSession) {
        Credential credential = null;
        try {
            Optional<Credential> found = findVisible(id, ownerSession);
            if (found.isEmpty()) {
                decryptFailureCounter.increment();
                auditFailure(AuditOperation.DECRYPT, id, null, "Credential not found", ownerSession);
                return SecretResult.notFound();
            }
            credential = found.get();

            String secret = cipher.decrypt(credential.getEncryptedSecret(), credential.getEncryptionSalt());
            markUsed(credential);

            auditLog.record(AuditEntry.builder()
                .credentialId(credential.getId())
                .connectionHash(credential.getConnectionHash())
                .operation(AuditOperation.DECRYPT)
                .success(true)
                .ownerSession(ownerSession)
                .build());

            decryptSuccessCounter.increment();
            log.info("🔓 Secret retrieved for credential {}", id);
            return SecretResult.ok(credential.toDetails(), secret);

        } catch (DecryptionException e) {
            decryptFailureCounter.increment();
            log.error("❌ Failed to decrypt secret for credential {}: {}", id, e.getMessage());
            auditFailure(AuditOperation.DECRYPT, id, credential.getConnectionHash(), e.getMessage(), ownerSession);
            return SecretResult.decryptionError(credential.toDetails(), "Failed to decrypt secret: " + e.getMessage());

        } catch (DataAccessException e) {
            decryptFailureCounter.increment();
            log.error("❌ Failed to read secret for credential {}: {}", id, e.getMessage());
            auditFailure(AuditOperation.DECRYPT, id,
                credential != null ? credential.getConnectionHash() : null, e.getMessage(), ownerSession);
            return SecretResult.error("Failed to read secret: " + failureReason(e));
        }
    }

    /**
     * List active credentials visible to a session, most recently used first.
     * Not audited. A null session lists every active credential.
     */
    public List<CredentialDetails> list(String ownerSession) {
        try {
            return repository.findActiveVisibleTo(ownerSession).stream()
                .map(Credential::toDetails)
                .toList();
        } catch (DataAccessException e) {
            log.error("❌ Failed to list credentials: {}", e.getMessage());
            return List.of();
        }
    }

    /**
     * Soft delete a credential. The row stays for the audit trail and can be reactivated by
     * saving the same connection again.
     *
     * @return false if no matching credential exists (or, under the OWNER policy, is not
     *         visible to the session) or the update failed
     */
    public boolean delete(long id, String ownerSession) {
        try {
            Optional<Credential> found = repository.findById(id);
            if (deletePolicy == DeletePolicy.OWNER) {
                found = found.filter(credential -> credential.isVisibleTo(ownerSession));
            }
            if (found.isEmpty()) {
                auditFailure(AuditOperation.DELETE, id, null, "Credential not found", ownerSession);
                return false;
            }

            Credential credential = found.get();
            Instant now = clock.instant();
            transactionTemplate.executeWithoutResult(status -> repository.softDelete(id, now));

            auditLog.record(AuditEntry.builder()
                .credentialId(credential.getId())
                .connectionHash(credential.getConnectionHash())
                .operation(AuditOperation.DELETE)
                .success(true)
                .ownerSession(ownerSession)
                .build());

            deleteCounter.increment();
            log.info("🗑️ Credential deleted: {}", credential.getName());
            return true;

        } catch (DataAccessException e) {
            log.error("❌ Failed to delete credential {}: {}", id, e.getMessage());
            auditFailure(AuditOperation.DELETE, id, null, e.getMessage(), ownerSession);
            return false;
        }
    }

    /**
     * Find the active credential for a connection, if any. Pure read: no audit, no mutation.
     */
    public Optional<CredentialDetails> checkDuplicate(
            String host, int port, String database, String username, EngineType engineType) {
        String connectionHash = ConnectionIdentity.fingerprint(host, port, database, username, engineType);
        return repository.findActiveByHash(connectionHash).map(Credential::toDetails);
    }

    /**
     * Refresh the last-used time of the active credential with this hash. Not audited.
     *
     * @return true if an active credential was touched
     */
    public boolean touch(String connectionHash) {
        try {
            return repository.touchByHash(connectionHash, clock.instant()) > 0;
        } catch (DataAccessException e) {
            log.warn("⚠️ Could not refresh last used time for {}: {}", connectionHash, e.getMessage());
            return false;
        }
    }

    /**
     * Audit entries, newest first.
     *
     * @param credentialId only this credential's entries, or all when null
     * @param limit        maximum entries; null for the configured default
     */
    public List<AuditEntry> auditTrail(Long credentialId, Integer limit) {
        return auditLog.list(credentialId, limit);
    }

    private SaveResult saveWithRetry(CredentialSaveRequest request, String ownerSession, SaveAttempt attempt) {
        for (int run = 1; ; run++) {
            try {
                SaveResult result = transactionTemplate.execute(status -> saveOnce(request, ownerSession, attempt));
                if (result == null) {
                    throw new IllegalStateException("Save transaction returned no result");
                }
                return result;
            } catch (DuplicateKeyException | ConcurrencyFailureException e) {
                // Another writer got to this hash first; the next run sees its row
                if (run >= maxSaveAttempts) {
                    throw e;
                }
                log.warn("⚠️ Concurrent save for {} detected, retrying ({}/{})",
                    attempt.connectionHash, run, maxSaveAttempts);
            }
        }
    }

    private SaveResult saveOnce(CredentialSaveRequest request, String ownerSession, SaveAttempt attempt) {
        attempt.operation = AuditOperation.CREATE;
        attempt.credentialId = null;

        Optional<Credential> existing = repository.findByHash(attempt.connectionHash);
        Instant now = clock.instant();

        if (existing.isPresent() && existing.get().isActive()) {
            Credential credential = existing.get();
            attempt.operation = AuditOperation.DUPLICATE_CHECK;
            attempt.credentialId = credential.getId();

            repository.updateLastUsed(credential.getId(), now);
            credential.setLastUsed(now);

            log.info("Credentials already exist for {} (credential {})", credential.getName(), credential.getId());
            return SaveResult.exists(credential.toDetails());
        }

        EncryptedSecret encrypted = cipher.encrypt(request.secret());
        String name = displayName(request);

        if (existing.isPresent()) {
            Credential credential = existing.get();
            attempt.operation = AuditOperation.UPDATE;
            attempt.credentialId = credential.getId();

            credential.setName(name);
            credential.setEncryptedSecret(encrypted.ciphertext());
            credential.setEncryptionSalt(encrypted.salt());
            credential.setUpdatedAt(now);
            credential.setLastUsed(now);
            credential.setOwnerSession(ownerSession);
            credential.setActive(true);

            if (repository.reactivate(credential) == 0) {
                throw new SaveConflictException("Credential " + credential.getId() + " was reactivated concurrently");
            }

            log.info("✅ Credential reactivated: {} ({})", name, request.engineType().getWireName());
            return SaveResult.reactivated(credential.toDetails());
        }

        Credential credential = new Credential();
        credential.setConnectionHash(attempt.connectionHash);
        credential.setName(name);
        credential.setHost(request.host());
        credential.setPort(request.port());
        credential.setDatabase(request.database());
        credential.setUsername(request.username());
        credential.setEngineType(request.engineType());
        credential.setEncryptedSecret(encrypted.ciphertext());
        credential.setEncryptionSalt(encrypted.salt());
        credential.setCreatedAt(now);
        credential.setUpdatedAt(now);
        credential.setLastUsed(now);
        credential.setOwnerSession(ownerSession);
        credential.setActive(true);

        repository.insert(credential);
        attempt.credentialId = credential.getId();

        log.info("✅ Credential saved: {} ({})", name, request.engineType().getWireName());
        return SaveResult.created(credential.toDetails());
    }

    private void auditSave(SaveResult result, SaveAttempt attempt, CredentialSaveRequest request, String ownerSession) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (result.status() == SaveStatus.EXISTS) {
            metadata.put("action", "found_existing");
        } else {
            metadata.put("name", result.credential().name());
            metadata.put("engine_type", request.engineType().getWireName());
        }

        auditLog.record(AuditEntry.builder()
            .credentialId(attempt.credentialId)
            .connectionHash(attempt.connectionHash)
            .operation(attempt.operation)
            .success(true)
            .ownerSession(ownerSession)
            .metadata(metadata)
            .build());
    }

    private void auditFailure(AuditOperation operation, Long credentialId, String connectionHash,
                              String errorMessage, String ownerSession) {
        auditLog.record(AuditEntry.builder()
            .credentialId(credentialId)
            .connectionHash(connectionHash)
            .operation(operation)
            .success(false)
            .errorMessage(errorMessage)
            .ownerSession(ownerSession)
            .build());
    }

    private Optional<Credential> findVisible(long id, String ownerSession) {
        return repository.findActiveById(id).filter(credential -> credential.isVisibleTo(ownerSession));
    }

    private void markUsed(Credential credential) {
        Instant now = clock.instant();
        repository.updateLastUsed(credential.getId(), now);
        credential.setLastUsed(now);
    }

    private ReentrantLock lockFor(String connectionHash) {
        return saveLocks[Math.floorMod(connectionHash.hashCode(), LOCK_STRIPES)];
    }

    private static void validate(CredentialSaveRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Save request is required");
        }
        if (isBlank(request.host())) {
            throw new IllegalArgumentException("Host is required");
        }
        if (request.port() < 1 || request.port() > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535");
        }
        if (isBlank(request.database())) {
            throw new IllegalArgumentException("Database is required");
        }
        if (isBlank(request.username())) {
            throw new IllegalArgumentException("Username is required");
        }
        if (request.engineType() == null) {
            throw new IllegalArgumentException("Database type is required");
        }
        if (request.secret() == null) {
            throw new IllegalArgumentException("Secret is required");
        }
    }

    /**
     * Caller-supplied name, or "{database}@{host}:{port}" when blank
     */
    static String displayName(CredentialSaveRequest request) {
        if (!isBlank(request.name())) {
            return request.name().trim();
        }
        return request.database() + "@" + request.host() + ":" + request.port();
    }

    /**
     * Caller-facing reason for a failure. Rejected input is reported as is; the details of
     * storage and internal failures stay in the log and the audit entry.
     */
    static String failureReason(RuntimeException e) {
        if (e instanceof IllegalArgumentException) {
            return e.getMessage();
        }
        if (e instanceof DataAccessException) {
            return "storage error";
        }
        return "internal error";
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    /**
     * What the current save call is about to do, for the audit entry written when it fails
     */
    private static final class SaveAttempt {
        private String connectionHash;
        private Long credentialId;
        private AuditOperation operation = AuditOperation.CREATE;
    }

    /**
     * A conditional write matched no row because another writer changed it first
     */
    private static final class SaveConflictException extends ConcurrencyFailureException {
        SaveConflictException(String message) {
            super(message);
        }
    }
}
