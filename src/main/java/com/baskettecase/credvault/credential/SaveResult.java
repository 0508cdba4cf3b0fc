package com.baskettecase.credvault.credential;

/**
 * Result of {@link CredentialStore#save(CredentialSaveRequest, String)}.
 *
 * @param credential the stored (or already existing) credential; null on error
 * @param duplicate  true when an active credential for the same connection already existed
 */
public record SaveResult(
    SaveStatus status,
    CredentialDetails credential,
    boolean duplicate,
    String message
) {

    static SaveResult created(CredentialDetails credential) {
        return new SaveResult(SaveStatus.CREATED, credential, false, "Credentials saved successfully");
    }

    static SaveResult reactivated(CredentialDetails credential) {
        return new SaveResult(SaveStatus.REACTIVATED, credential, false, "Credentials saved successfully");
    }

    static SaveResult exists(CredentialDetails credential) {
        return new SaveResult(SaveStatus.EXISTS, credential, true, "Credentials already exist for this connection");
    }

    static SaveResult error(String reason) {
        return new SaveResult(SaveStatus.ERROR, null, false, "Failed to save credentials: " + reason);
    }

    public boolean isSaved() {
        return status == SaveStatus.CREATED || status == SaveStatus.REACTIVATED;
    }
}
