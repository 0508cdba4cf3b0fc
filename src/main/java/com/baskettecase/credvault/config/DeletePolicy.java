package com.baskettecase.credvault.config;

/**
 * Who may soft-delete a credential.
 */
public enum DeletePolicy {

    /** Any caller may delete any credential id, whatever its owner session. */
    ANY,

    /** Only a session that can see the credential (its owner, or anyone for a global one) may delete it. */
    OWNER
}
