package com.guardsql.service;

import com.guardsql.api.ExecuteResponse;
import com.guardsql.dialect.CatalogQuery;
import com.guardsql.dialect.Dialect;
import com.guardsql.error.InputException;
import com.guardsql.error.PoolException;
import com.guardsql.parser.Metacommand;
import com.guardsql.util.GlobPattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;

/**
 * Catalog browsing for {@code \d} and {@code \list}, plus raw catalog reads for the schema cache.
 *
 * <p>Runs on a pooled browsing connection unless the command asked for the session connection.
 */
@Slf4j
@Service
public class CatalogService {

    private final ConnectionManager connections;
    private final SessionStateMachine stateMachine;

    public CatalogService(ConnectionManager connections, SessionStateMachine stateMachine) {
        this.connections = connections;
        this.stateMachine = stateMachine;
    }

    /**
     * List catalog objects of one kind matching a {@code schema.name} glob.
     *
     * @param command LIST metacommand
     * @return tabular response
     * @throws SQLException on JDBC errors
     */
    public ExecuteResponse list(Metacommand command) throws SQLException {
        Dialect dialect = connections.getDialect();
        String pattern = command.getPattern() != null ? command.getPattern() : "public.*";
        String schemaGlob;
        String nameGlob;
        if (command.getListKind() == Metacommand.ListKind.SCHEMA) {
            schemaGlob = pattern;
            nameGlob = "*";
        } else {
            int dot = pattern.indexOf('.');
            schemaGlob = dot >= 0 ? pattern.substring(0, dot) : "*";
            nameGlob = dot >= 0 ? pattern.substring(dot + 1) : pattern;
        }
        if ("public".equalsIgnoreCase(schemaGlob)) {
            schemaGlob = dialect.defaultSchema();
        }
        CatalogQuery query = dialect.listQuery(command.getListKind(),
                GlobPattern.compile(schemaGlob).toSqlLike(),
                GlobPattern.compile(nameGlob.isEmpty() ? "*" : nameGlob).toSqlLike(),
                command.isDetail());
        log.debug("Catalog list: kind={}, pattern={}", command.getListKind(), pattern);
        return query(query, command.isSameConnection());
    }

    /**
     * Describe the columns of a table or view.
     *
     * @param command DESCRIBE metacommand
     * @return tabular response
     * @throws SQLException on JDBC errors
     */
    public ExecuteResponse describe(Metacommand command) throws SQLException {
        Dialect dialect = connections.getDialect();
        String name = command.getName();
        String schema = null;
        String table = name;
        int dot = name.indexOf('.');
        if (dot > 0) {
            schema = name.substring(0, dot);
            table = name.substring(dot + 1);
            if ("public".equalsIgnoreCase(schema)) {
                schema = dialect.defaultSchema();
            }
        }
        ExecuteResponse response = query(dialect.describeQuery(schema, table, command.isDetail()),
                command.isSameConnection());
        if (response.rowCount() == 0) {
            throw new InputException("Did not find any relation named \"" + name + "\".");
        }
        return response;
    }

    private ExecuteResponse query(CatalogQuery query, boolean sameConnection) throws SQLException {
        long startTime = System.nanoTime();
        ExecuteResponse response = new ExecuteResponse();
        ExecuteResponse.Metadata metadata = new ExecuteResponse.Metadata();
        response.setMetadata(metadata);
        response.setType("tabular");
        if (sameConnection) {
            Connection conn = stateMachine.sessionConnection();
            try (PreparedStatement stmt = prepare(conn, query); ResultSet rs = stmt.executeQuery()) {
                QueryExecutor.processResultSet(rs, response, 0);
            }
        } else {
            try (Connection conn = connections.browseConnection();
                 PreparedStatement stmt = prepare(conn, query);
                 ResultSet rs = stmt.executeQuery()) {
                QueryExecutor.processResultSet(rs, response, 0);
            }
        }
        metadata.setDurationMicros((System.nanoTime() - startTime) / 1000);
        return response;
    }

    /**
     * Read a catalog query as rows of strings on a browsing connection.
     *
     * @param query catalog query
     * @param timeoutMs statement timeout, 0 for none
     * @return rows
     * @throws SQLException on JDBC errors
     * @throws PoolException if no browsing connection is available
     */
    public List<List<String>> readRows(CatalogQuery query, int timeoutMs) throws SQLException {
        List<List<String>> rows = new ArrayList<>();
        try (Connection conn = connections.browseConnection(); PreparedStatement stmt = prepare(conn, query)) {
            if (timeoutMs > 0) {
                stmt.setQueryTimeout(Math.max(1, timeoutMs / 1000));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                int columnCount = rs.getMetaData().getColumnCount();
                while (rs.next()) {
                    List<String> row = new ArrayList<>(columnCount);
                    for (int i = 1; i <= columnCount; i++) {
                        row.add(rs.getString(i));
                    }
                    rows.add(row);
                }
            }
        }
        return rows;
    }

    private PreparedStatement prepare(Connection conn, CatalogQuery query) throws SQLException {
        PreparedStatement stmt = conn.prepareStatement(query.getSql());
        try {
            List<Object> params = query.getParams();
            for (int i = 0; i < params.size(); i++) {
                if (params.get(i) == null) {
                    stmt.setNull(i + 1, Types.VARCHAR);
                } else {
                    stmt.setObject(i + 1, params.get(i));
                }
            }
        } catch (SQLException e) {
            closeQuietly(stmt);
            throw e;
        }
        return stmt;
    }

    private void closeQuietly(Statement stmt) {
        try {
            stmt.close();
        } catch (SQLException e) {
            log.debug("Closing catalog statement failed: error={}", e.getMessage());
        }
    }
}
