package com.baskettecase.credvault.credential;

/**
 * Outcome of a save.
 */
public enum SaveStatus {
    /** A new record was inserted. */
    CREATED,
    /** A soft-deleted record for the same connection was reactivated with the new secret. */
    REACTIVATED,
    /** An active record already exists; the supplied secret was discarded. */
    EXISTS,
    /** Nothing was written; see the message. */
    ERROR
}
