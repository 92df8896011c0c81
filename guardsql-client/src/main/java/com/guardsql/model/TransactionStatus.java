package com.guardsql.model;

/**
 * Transaction status of the session connection, as observed by the monitor connection.
 */
public enum TransactionStatus {
    /** No transaction open. */
    NONE,
    /** Transaction open, nothing written yet. */
    IDLE,
    /** Transaction open with writes. */
    ACTIVE,
    /** Transaction aborted by an error; only COMMIT or ROLLBACK leave it. */
    ERROR
}
