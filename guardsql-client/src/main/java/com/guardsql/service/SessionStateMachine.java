package com.guardsql.service;

import com.guardsql.dialect.Dialect;
import com.guardsql.error.GuardsqlException;
import com.guardsql.error.InputException;
import com.guardsql.model.SessionContext;
import com.guardsql.model.TransactionStatus;
import com.guardsql.model.WriteState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supervises write access on the session connection.
 *
 * <p>Read-only mode is enforced by the engine itself. The write states are derived from the
 * transaction status observed on the monitor connection, overlaid with the client's own record
 * of statement errors since the last commit or rollback.
 */
@Slf4j
@Service
public class SessionStateMachine {

    public static final String WRITE_BANNER = "AUTOCOMMIT IS OFF -- REMEMBER TO COMMIT; YOUR WRITES";
    public static final String READ_ONLY_BANNER = "SESSION IS NOW READ ONLY";
    public static final String LEAVE_REFUSED =
            "Cannot disable write mode while in a transaction. COMMIT or ROLLBACK first.";
    public static final String QUIT_REFUSED =
            "Cannot exit while in an active transaction. COMMIT or ROLLBACK first.";
    public static final String JUSTIFICATION_REQUIRED =
            "A justification is required for write mode. Session stays read only.";

    private final ConnectionManager connections;
    private final SessionContext context;

    private long backendId;
    /** Statements ran in write mode since the last boundary; used when the monitor is unavailable. */
    private boolean statementsSinceBoundary;
    private WriteState lastState = WriteState.READ_ONLY;

    public SessionStateMachine(ConnectionManager connections, SessionContext context) {
        this.connections = connections;
        this.context = context;
    }

    /**
     * Return the session connection, applying the current mode if it was freshly leased.
     *
     * @return session connection
     */
    public Connection sessionConnection() {
        ConnectionManager.SessionLease lease = connections.sessionConnection();
        Connection conn = lease.getConnection();
        if (lease.isFresh()) {
            Dialect dialect = connections.getDialect();
            try {
                if (context.isWriteMode()) {
                    if (statementsSinceBoundary || context.isFailedSinceBoundary()) {
                        log.warn("Session connection replaced; uncommitted work was lost");
                    }
                    dialect.enterReadWrite(conn);
                } else {
                    dialect.enterReadOnly(conn);
                }
                backendId = dialect.backendId(conn);
            } catch (SQLException e) {
                throw dialect.toStatementException(e);
            }
            clearBoundary();
            log.info("Session connection leased: backend_id={}, write_mode={}", backendId, context.isWriteMode());
        }
        return conn;
    }

    /**
     * Switch to write mode with the given justification.
     *
     * @param justification reason for write access; blank is rejected
     * @return banner to print
     */
    public String enterWrite(String justification) {
        if (justification == null || justification.isBlank()) {
            throw new InputException(JUSTIFICATION_REQUIRED);
        }
        String value = justification.trim();
        if (context.isWriteMode()) {
            context.setJustification(value);
            context.getJustificationHistory().remember(value);
            return WRITE_BANNER;
        }
        Connection conn = sessionConnection();
        Dialect dialect = connections.getDialect();
        try {
            dialect.enterReadWrite(conn);
        } catch (SQLException e) {
            throw dialect.toStatementException(e);
        }
        context.setWriteMode(true);
        context.setJustification(value);
        context.getJustificationHistory().remember(value);
        clearBoundary();
        lastState = WriteState.WRITE_IDLE;
        log.info("Write mode enabled: justification={}", value);
        return WRITE_BANNER;
    }

    /**
     * Return to read-only mode. Refused while a transaction holds uncommitted or failed work.
     *
     * @return banner to print
     */
    public String leaveWrite() {
        if (!context.isWriteMode()) {
            return READ_ONLY_BANNER;
        }
        WriteState state = refresh();
        if (state != WriteState.WRITE_IDLE) {
            throw new InputException(LEAVE_REFUSED);
        }
        Connection conn = sessionConnection();
        Dialect dialect = connections.getDialect();
        try {
            dialect.enterReadOnly(conn);
        } catch (SQLException e) {
            throw dialect.toStatementException(e);
        }
        context.setWriteMode(false);
        context.setJustification(null);
        context.setObservedStatus(TransactionStatus.NONE);
        clearBoundary();
        lastState = WriteState.READ_ONLY;
        log.info("Write mode disabled");
        return READ_ONLY_BANNER;
    }

    /**
     * Observe the transaction status and derive the current state.
     *
     * @return current state
     */
    public WriteState refresh() {
        if (!context.isWriteMode()) {
            lastState = WriteState.READ_ONLY;
            return lastState;
        }
        TransactionStatus status;
        try (Connection monitor = connections.monitorConnection()) {
            status = connections.getDialect().transactionStatus(monitor, backendId);
        } catch (SQLException | GuardsqlException e) {
            log.warn("Transaction monitor unavailable, using client bookkeeping: error={}", e.getMessage());
            status = statementsSinceBoundary ? TransactionStatus.ACTIVE : TransactionStatus.IDLE;
        }
        context.setObservedStatus(status);
        lastState = derive(status, context.isFailedSinceBoundary());
        return lastState;
    }

    /**
     * Map an observed transaction status plus the client error flag to a write state.
     *
     * @param status observed status
     * @param failedSinceBoundary a statement failed since the last commit or rollback
     * @return write state
     */
    static WriteState derive(TransactionStatus status, boolean failedSinceBoundary) {
        if (failedSinceBoundary || status == TransactionStatus.ERROR) {
            return WriteState.WRITE_FAILED;
        }
        if (status == TransactionStatus.ACTIVE) {
            return WriteState.WRITE_ACTIVE;
        }
        return WriteState.WRITE_IDLE;
    }

    /**
     * Refuse to quit while uncommitted or failed work exists.
     */
    public void checkQuit() {
        if (refresh().blocksQuit()) {
            throw new InputException(QUIT_REFUSED);
        }
    }

    public boolean canQuit() {
        return !refresh().blocksQuit();
    }

    public void onStatementSuccess() {
        if (context.isWriteMode()) {
            statementsSinceBoundary = true;
        }
    }

    public void onStatementError() {
        if (context.isWriteMode()) {
            statementsSinceBoundary = true;
            if (lastState != WriteState.WRITE_FAILED) {
                log.info("Transaction failed; COMMIT or ROLLBACK required");
            }
            context.setFailedSinceBoundary(true);
            lastState = WriteState.WRITE_FAILED;
        }
    }

    /**
     * Commit through JDBC. A failed transaction is rolled back instead.
     *
     * @return command tag to print
     * @throws SQLException on JDBC errors
     */
    public String commit() throws SQLException {
        Connection conn = sessionConnection();
        String tag = "COMMIT";
        try {
            if (context.isFailedSinceBoundary()) {
                conn.rollback();
                tag = "ROLLBACK";
            } else {
                conn.commit();
            }
        } finally {
            clearBoundary();
        }
        refresh();
        return tag;
    }

    /**
     * Roll back through JDBC.
     *
     * @return command tag to print
     * @throws SQLException on JDBC errors
     */
    public String rollback() throws SQLException {
        Connection conn = sessionConnection();
        try {
            conn.rollback();
        } finally {
            clearBoundary();
        }
        refresh();
        return "ROLLBACK";
    }

    private void clearBoundary() {
        statementsSinceBoundary = false;
        context.setFailedSinceBoundary(false);
    }

    /**
     * Prompt prefix for the state observed through the monitor connection.
     *
     * @return short state label
     */
    public String promptLabel() {
        switch (refresh()) {
            case WRITE_IDLE:
                return "write";
            case WRITE_ACTIVE:
                return "write*";
            case WRITE_FAILED:
                return "write!";
            default:
                return "ro";
        }
    }
}
