package com.guardsql.dialect;

import com.guardsql.error.StatementException;
import com.guardsql.model.TransactionStatus;
import com.guardsql.parser.Metacommand;
import com.guardsql.util.JdbcConnectionInfo;
import com.zaxxer.hikari.HikariConfig;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

/**
 * Backend-specific behaviour: session mode switching, transaction observation and catalog SQL.
 */
public interface Dialect {

    String name();

    String driverClassName();

    /** Schema that the {@code public} default list pattern stands for. */
    default String defaultSchema() {
        return "public";
    }

    /**
     * Add backend-specific pool and driver settings.
     *
     * @param config pool config
     * @param info connection info
     */
    void configure(HikariConfig config, JdbcConnectionInfo info);

    /**
     * Make the connection reject writes at the engine level and turn autocommit on.
     * Any open transaction is rolled back.
     *
     * @param session session connection
     * @throws SQLException on JDBC errors
     */
    void enterReadOnly(Connection session) throws SQLException;

    /**
     * Allow writes and turn autocommit off.
     *
     * @param session session connection
     * @throws SQLException on JDBC errors
     */
    void enterReadWrite(Connection session) throws SQLException;

    /**
     * Identify the session's backend so the monitor can observe it.
     *
     * @param session session connection
     * @return backend id
     * @throws SQLException on JDBC errors
     */
    long backendId(Connection session) throws SQLException;

    /**
     * Observe the session's transaction status from the monitor connection.
     *
     * @param monitor monitor connection
     * @param backendId session backend id
     * @return observed status
     * @throws SQLException on JDBC errors
     */
    TransactionStatus transactionStatus(Connection monitor, long backendId) throws SQLException;

    CatalogQuery listQuery(Metacommand.ListKind kind, String schemaLike, String nameLike, boolean detail);

    CatalogQuery describeQuery(String schema, String table, boolean detail);

    CatalogQuery schemasQuery();

    /** Columns: schema, name, kind. */
    CatalogQuery relationsQuery();

    /** Columns: schema, table, column. */
    CatalogQuery columnsQuery();

    /** Columns: schema, name. */
    CatalogQuery functionsQuery();

    boolean isCancellation(SQLException e);

    default boolean isConnectionFailure(SQLException e) {
        String state = e.getSQLState();
        return e instanceof SQLTransientConnectionException || (state != null && state.startsWith("08"));
    }

    default StatementException toStatementException(SQLException e) {
        return StatementException.of(e);
    }
}
