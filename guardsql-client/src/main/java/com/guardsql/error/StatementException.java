package com.guardsql.error;

import lombok.Getter;

import java.sql.SQLException;

/**
 * Server-reported statement failure, carrying the backend's own diagnostics.
 */
@Getter
public class StatementException extends GuardsqlException {
    private final String sqlState;
    private final int vendorCode;
    private final String detail;
    private final String hint;
    private final Integer position;

    public StatementException(String message, String sqlState, int vendorCode, String detail, String hint,
                              Integer position, Throwable cause) {
        super(ErrorKind.STATEMENT, message, cause);
        this.sqlState = sqlState;
        this.vendorCode = vendorCode;
        this.detail = detail;
        this.hint = hint;
        this.position = position;
    }

    /**
     * Wrap a JDBC exception without server diagnostics beyond SQLState and message.
     *
     * @param e JDBC exception
     * @return statement exception
     */
    public static StatementException of(SQLException e) {
        return new StatementException(e.getMessage(), e.getSQLState(), e.getErrorCode(), null, null, null, e);
    }
}
