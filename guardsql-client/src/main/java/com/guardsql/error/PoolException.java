package com.guardsql.error;

/**
 * Thrown when no connection could be obtained in time, or the connection broke mid-flight.
 */
public class PoolException extends GuardsqlException {
    public PoolException(String message, Throwable cause) {
        super(ErrorKind.POOL, message, cause);
    }
}
