package com.guardsql.error;

/**
 * Base class of all failures raised by the client core.
 */
public class GuardsqlException extends RuntimeException {
    private final ErrorKind kind;

    public GuardsqlException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GuardsqlException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
