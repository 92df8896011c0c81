package com.guardsql.dialect;

import com.guardsql.error.StatementException;
import com.guardsql.model.TransactionStatus;
import com.guardsql.parser.Metacommand;
import com.guardsql.util.JdbcConnectionInfo;
import com.zaxxer.hikari.HikariConfig;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.Map;

public class PostgresDialect implements Dialect {

    static final String QUERY_CANCELED = "57014";

    private static final String STATUS_SQL =
            "SELECT state, backend_xid::text FROM pg_catalog.pg_stat_activity WHERE pid = ?";

    private static final String SYSTEM_SCHEMA_FILTER =
            "n.nspname NOT IN ('pg_catalog', 'information_schema') AND n.nspname NOT LIKE 'pg\\_toast%' ";

    @Override
    public String name() {
        return "postgres";
    }

    @Override
    public String driverClassName() {
        return "org.postgresql.Driver";
    }

    @Override
    public void configure(HikariConfig config, JdbcConnectionInfo info) {
        // Shows up as pg_stat_activity.application_name.
        config.addDataSourceProperty("ApplicationName", "guardsql");
        if (info.getProperties() != null) {
            for (Map.Entry<String, String> e : info.getProperties().entrySet()) {
                config.addDataSourceProperty(e.getKey(), e.getValue());
            }
        }
    }

    @Override
    public void enterReadOnly(Connection session) throws SQLException {
        if (!session.getAutoCommit()) {
            session.rollback();
        }
        session.setAutoCommit(true);
        try (Statement st = session.createStatement()) {
            st.execute("SET SESSION CHARACTERISTICS AS TRANSACTION READ ONLY");
        }
    }

    @Override
    public void enterReadWrite(Connection session) throws SQLException {
        session.setAutoCommit(true);
        try (Statement st = session.createStatement()) {
            st.execute("SET SESSION CHARACTERISTICS AS TRANSACTION READ WRITE");
        }
        session.setAutoCommit(false);
    }

    @Override
    public long backendId(Connection session) throws SQLException {
        try (Statement st = session.createStatement();
             ResultSet rs = st.executeQuery("SELECT pg_backend_pid()")) {
            rs.next();
            return rs.getLong(1);
        }
    }

    @Override
    public TransactionStatus transactionStatus(Connection monitor, long backendId) throws SQLException {
        try (PreparedStatement ps = monitor.prepareStatement(STATUS_SQL)) {
            ps.setInt(1, (int) backendId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return TransactionStatus.NONE;
                }
                return fromActivity(rs.getString(1), rs.getString(2));
            }
        }
    }

    static TransactionStatus fromActivity(String state, String xid) {
        if ("idle in transaction (aborted)".equals(state)) {
            return TransactionStatus.ERROR;
        }
        if ("idle in transaction".equals(state)) {
            return xid != null ? TransactionStatus.ACTIVE : TransactionStatus.IDLE;
        }
        return TransactionStatus.NONE;
    }

    @Override
    public CatalogQuery listQuery(Metacommand.ListKind kind, String schemaLike, String nameLike, boolean detail) {
        String filter = "lower(n.nspname) LIKE ? ESCAPE '\\' AND lower(%s) LIKE ? ESCAPE '\\' ";
        switch (kind) {
            case SCHEMA:
                return CatalogQuery.of("SELECT n.nspname AS name, pg_catalog.pg_get_userbyid(n.nspowner) AS owner"
                        + (detail ? ", pg_catalog.obj_description(n.oid, 'pg_namespace') AS description " : " ")
                        + "FROM pg_catalog.pg_namespace n WHERE lower(n.nspname) LIKE ? ESCAPE '\\' "
                        + "AND n.nspname NOT LIKE 'pg\\_toast%' AND n.nspname NOT LIKE 'pg\\_temp%' ORDER BY 1",
                        schemaLike);
            case FUNCTION:
                return CatalogQuery.of("SELECT n.nspname AS schema, p.proname AS name, "
                        + "pg_catalog.pg_get_function_result(p.oid) AS result, "
                        + "pg_catalog.pg_get_function_arguments(p.oid) AS arguments"
                        + (detail ? ", l.lanname AS language, pg_catalog.obj_description(p.oid, 'pg_proc') AS description " : " ")
                        + "FROM pg_catalog.pg_proc p "
                        + "JOIN pg_catalog.pg_namespace n ON n.oid = p.pronamespace "
                        + "JOIN pg_catalog.pg_language l ON l.oid = p.prolang "
                        + "WHERE " + String.format(filter, "p.proname") + "ORDER BY 1, 2",
                        schemaLike, nameLike);
            case INDEX:
                return CatalogQuery.of("SELECT n.nspname AS schema, c.relname AS name, t.relname AS table"
                        + (detail ? ", pg_catalog.pg_get_indexdef(c.oid) AS definition, "
                        + "pg_catalog.pg_size_pretty(pg_catalog.pg_relation_size(c.oid)) AS size " : " ")
                        + "FROM pg_catalog.pg_class c "
                        + "JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace "
                        + "JOIN pg_catalog.pg_index i ON i.indexrelid = c.oid "
                        + "JOIN pg_catalog.pg_class t ON t.oid = i.indrelid "
                        + "WHERE c.relkind IN ('i', 'I') AND " + String.format(filter, "c.relname") + "ORDER BY 1, 2",
                        schemaLike, nameLike);
            default:
                String relkinds = kind == Metacommand.ListKind.TABLE ? "'r', 'p'"
                        : kind == Metacommand.ListKind.VIEW ? "'v', 'm'" : "'S'";
                return CatalogQuery.of("SELECT n.nspname AS schema, c.relname AS name, "
                        + "pg_catalog.pg_get_userbyid(c.relowner) AS owner"
                        + (detail ? ", pg_catalog.pg_size_pretty(pg_catalog.pg_total_relation_size(c.oid)) AS size, "
                        + "pg_catalog.obj_description(c.oid, 'pg_class') AS description " : " ")
                        + "FROM pg_catalog.pg_class c "
                        + "JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace "
                        + "WHERE c.relkind IN (" + relkinds + ") AND " + String.format(filter, "c.relname")
                        + "ORDER BY 1, 2",
                        schemaLike, nameLike);
        }
    }

    @Override
    public CatalogQuery describeQuery(String schema, String table, boolean detail) {
        String sql;
        if (detail) {
            sql = "SELECT c.column_name AS name, c.data_type AS type, c.is_nullable AS nullable, c.column_default AS data_default, "
                    + "pgd.description AS comment, "
                    + "(SELECT string_agg(tc.constraint_type || ':' || tc.constraint_name, ', ' ORDER BY tc.constraint_type, tc.constraint_name) "
                    + "   FROM information_schema.key_column_usage kcu "
                    + "   JOIN information_schema.table_constraints tc "
                    + "     ON tc.constraint_name = kcu.constraint_name AND tc.table_schema = kcu.table_schema AND tc.table_name = kcu.table_name "
                    + "  WHERE kcu.table_schema = c.table_schema AND kcu.table_name = c.table_name AND kcu.column_name = c.column_name "
                    + ") AS constraints "
                    + "FROM information_schema.columns c "
                    + "LEFT JOIN pg_catalog.pg_namespace pgn ON pgn.nspname = c.table_schema "
                    + "LEFT JOIN pg_catalog.pg_class pgc ON pgc.relname = c.table_name AND pgc.relnamespace = pgn.oid "
                    + "LEFT JOIN pg_catalog.pg_attribute pga ON pga.attrelid = pgc.oid AND pga.attname = c.column_name "
                    + "LEFT JOIN pg_catalog.pg_description pgd ON pgd.objoid = pgc.oid AND pgd.objsubid = pga.attnum "
                    + "WHERE c.table_schema = COALESCE(?, current_schema()) AND c.table_name = ? "
                    + "ORDER BY c.ordinal_position";
        } else {
            sql = "SELECT column_name AS name, data_type AS type, is_nullable AS nullable, column_default AS data_default "
                    + "FROM information_schema.columns "
                    + "WHERE table_schema = COALESCE(?, current_schema()) AND table_name = ? "
                    + "ORDER BY ordinal_position";
        }
        return new CatalogQuery(sql, Arrays.asList(schema, table));
    }

    @Override
    public CatalogQuery schemasQuery() {
        return CatalogQuery.of("SELECT n.nspname FROM pg_catalog.pg_namespace n WHERE " + SYSTEM_SCHEMA_FILTER
                + "ORDER BY 1");
    }

    @Override
    public CatalogQuery relationsQuery() {
        return CatalogQuery.of("SELECT n.nspname, c.relname, CASE WHEN c.relkind IN ('v', 'm') THEN 'view' ELSE 'table' END "
                + "FROM pg_catalog.pg_class c JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace "
                + "WHERE c.relkind IN ('r', 'p', 'v', 'm', 'f') AND " + SYSTEM_SCHEMA_FILTER + "ORDER BY 1, 2");
    }

    @Override
    public CatalogQuery columnsQuery() {
        return CatalogQuery.of("SELECT table_schema, table_name, column_name FROM information_schema.columns "
                + "WHERE table_schema NOT IN ('pg_catalog', 'information_schema') "
                + "ORDER BY table_schema, table_name, ordinal_position");
    }

    @Override
    public CatalogQuery functionsQuery() {
        return CatalogQuery.of("SELECT DISTINCT n.nspname, p.proname FROM pg_catalog.pg_proc p "
                + "JOIN pg_catalog.pg_namespace n ON n.oid = p.pronamespace WHERE " + SYSTEM_SCHEMA_FILTER
                + "ORDER BY 1, 2");
    }

    @Override
    public boolean isCancellation(SQLException e) {
        return QUERY_CANCELED.equals(e.getSQLState());
    }

    @Override
    public StatementException toStatementException(SQLException e) {
        if (e instanceof PSQLException psql && psql.getServerErrorMessage() != null) {
            ServerErrorMessage server = psql.getServerErrorMessage();
            Integer position = server.getPosition() > 0 ? server.getPosition() : null;
            return new StatementException(server.getMessage() != null ? server.getMessage() : e.getMessage(),
                    e.getSQLState(), e.getErrorCode(), server.getDetail(), server.getHint(), position, e);
        }
        return StatementException.of(e);
    }

    /**
     * Whether a connection failure was caused by TLS negotiation.
     *
     * @param e connection failure
     * @return true for TLS failures
     */
    public boolean isTlsFailure(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message != null && (message.contains("SSL") || message.contains("TLS"))) {
                return true;
            }
            if (t instanceof javax.net.ssl.SSLException) {
                return true;
            }
        }
        return false;
    }
}
