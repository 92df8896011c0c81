package com.guardsql.dialect;

import com.guardsql.error.InputException;
import com.guardsql.model.TransactionStatus;
import com.guardsql.parser.Metacommand;
import com.guardsql.util.JdbcConnectionInfo;
import com.zaxxer.hikari.HikariConfig;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;

/**
 * SQLite files. Read-only mode uses {@code PRAGMA query_only}; the monitor observes an open write
 * transaction by probing the database write lock.
 */
public class SqliteDialect implements Dialect {

    /** SQLITE_BUSY */
    static final int BUSY = 5;
    /** SQLITE_INTERRUPT */
    static final int INTERRUPT = 9;

    @Override
    public String name() {
        return "sqlite";
    }

    @Override
    public String driverClassName() {
        return "org.sqlite.JDBC";
    }

    @Override
    public String defaultSchema() {
        return "main";
    }

    @Override
    public void configure(HikariConfig config, JdbcConnectionInfo info) {
        config.addDataSourceProperty("busy_timeout", "3000");
    }

    @Override
    public void enterReadOnly(Connection session) throws SQLException {
        if (!session.getAutoCommit()) {
            session.rollback();
        }
        session.setAutoCommit(true);
        try (Statement st = session.createStatement()) {
            st.execute("PRAGMA query_only = ON");
        }
    }

    @Override
    public void enterReadWrite(Connection session) throws SQLException {
        session.setAutoCommit(true);
        try (Statement st = session.createStatement()) {
            st.execute("PRAGMA query_only = OFF");
        }
        session.setAutoCommit(false);
    }

    @Override
    public long backendId(Connection session) {
        return 0;
    }

    @Override
    public TransactionStatus transactionStatus(Connection monitor, long backendId) throws SQLException {
        try (Statement st = monitor.createStatement()) {
            st.execute("PRAGMA busy_timeout = 0");
            try {
                st.execute("BEGIN IMMEDIATE");
            } catch (SQLException e) {
                if (e.getErrorCode() == BUSY || (e.getMessage() != null && e.getMessage().contains("SQLITE_BUSY"))) {
                    return TransactionStatus.ACTIVE;
                }
                throw e;
            }
            st.execute("ROLLBACK");
            return TransactionStatus.IDLE;
        }
    }

    @Override
    public CatalogQuery listQuery(Metacommand.ListKind kind, String schemaLike, String nameLike, boolean detail) {
        switch (kind) {
            case SCHEMA:
                return CatalogQuery.of("SELECT name, file FROM pragma_database_list WHERE lower(name) LIKE ? ESCAPE '\\' "
                        + "ORDER BY seq", schemaLike);
            case TABLE:
            case VIEW:
            case INDEX:
                String type = kind.name().toLowerCase();
                return CatalogQuery.of("SELECT 'main' AS schema, name, tbl_name AS \"table\""
                        + (detail ? ", sql AS definition " : " ")
                        + "FROM sqlite_master WHERE type = ? AND name NOT LIKE 'sqlite\\_%' ESCAPE '\\' "
                        + "AND 'main' LIKE ? ESCAPE '\\' AND lower(name) LIKE ? ESCAPE '\\' ORDER BY name",
                        type, schemaLike, nameLike);
            default:
                throw new InputException("Listing " + kind.name().toLowerCase() + "s is not supported for SQLite");
        }
    }

    @Override
    public CatalogQuery describeQuery(String schema, String table, boolean detail) {
        String sql = "SELECT name, type, CASE WHEN \"notnull\" = 1 THEN 'NO' ELSE 'YES' END AS nullable, "
                + "dflt_value AS data_default"
                + (detail ? ", pk AS primary_key " : " ")
                + "FROM pragma_table_info(?, ?) ORDER BY cid";
        return new CatalogQuery(sql, Arrays.asList(table, schema != null ? schema : "main"));
    }

    @Override
    public CatalogQuery schemasQuery() {
        return CatalogQuery.of("SELECT name FROM pragma_database_list ORDER BY seq");
    }

    @Override
    public CatalogQuery relationsQuery() {
        return CatalogQuery.of("SELECT 'main', name, type FROM sqlite_master WHERE type IN ('table', 'view') "
                + "AND name NOT LIKE 'sqlite\\_%' ESCAPE '\\' ORDER BY name");
    }

    @Override
    public CatalogQuery columnsQuery() {
        return CatalogQuery.of("SELECT 'main', m.name, p.name FROM sqlite_master m "
                + "JOIN pragma_table_info(m.name) p WHERE m.type IN ('table', 'view') ORDER BY m.name, p.cid");
    }

    @Override
    public CatalogQuery functionsQuery() {
        return CatalogQuery.of("SELECT 'main', NULL WHERE 0");
    }

    @Override
    public boolean isCancellation(SQLException e) {
        return e.getErrorCode() == INTERRUPT || (e.getMessage() != null && e.getMessage().contains("SQLITE_INTERRUPT"));
    }
}
