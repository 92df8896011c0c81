package com.guardsql.error;

/**
 * Failure categories reported to the operator.
 *
 * <p>Each kind maps to the error code printed by {@link com.guardsql.repl.ErrorReporter}.
 */
public enum ErrorKind {
    /** Malformed input, unbound variable, bad metacommand argument. Nothing was sent. */
    INPUT("INPUT_ERROR"),
    /** Connection acquisition timed out or the network failed. */
    POOL("CONNECTION_ERROR"),
    /** The server rejected the statement. */
    STATEMENT("DATABASE_ERROR"),
    /** Audit, history or snippet storage failed. */
    PERSISTENCE("STORAGE_ERROR"),
    INTERNAL("INTERNAL_ERROR");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
