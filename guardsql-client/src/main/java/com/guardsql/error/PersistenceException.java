package com.guardsql.error;

/**
 * Thrown when local storage (audit store, snippets, exports) fails.
 */
public class PersistenceException extends GuardsqlException {
    public PersistenceException(String message, Throwable cause) {
        super(ErrorKind.PERSISTENCE, message, cause);
    }

    public PersistenceException(String message) {
        super(ErrorKind.PERSISTENCE, message);
    }
}
