package com.guardsql.service;

import com.guardsql.api.ExecuteRequest;
import com.guardsql.api.ExecuteResponse;
import com.guardsql.config.GuardsqlProperties;
import com.guardsql.dialect.Dialect;
import com.guardsql.error.ErrorKind;
import com.guardsql.error.GuardsqlException;
import com.guardsql.error.PoolException;
import com.guardsql.error.QueryCancelledException;
import com.guardsql.model.SessionContext;
import com.guardsql.util.JdbcValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongConsumer;

/**
 * Runs one statement at a time on the session connection.
 *
 * <p>The statement runs on a worker thread while the calling thread polls the
 * {@link CancellationToken}. A pending cancel is turned into a server-side
 * {@link Statement#cancel()} for the statement of the same generation only.
 */
@Slf4j
@Service
public class QueryExecutor implements AutoCloseable {

    static final long POLL_INTERVAL_MS = 100;
    static final long CANCEL_GRACE_MS = 5000;

    private final ConnectionManager connections;
    private final SessionStateMachine stateMachine;
    private final SessionContext context;
    private final GuardsqlProperties properties;
    private final CancellationToken cancellationToken = new CancellationToken();
    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "guardsql-worker");
        t.setDaemon(true);
        return t;
    });

    public QueryExecutor(ConnectionManager connections, SessionStateMachine stateMachine, SessionContext context,
                         GuardsqlProperties properties) {
        this.connections = connections;
        this.stateMachine = stateMachine;
        this.context = context;
        this.properties = properties;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    /**
     * Execute a statement on the session connection.
     *
     * @param request statement and options
     * @param progress called with the elapsed milliseconds while a slow statement runs
     * @return response
     * @throws QueryCancelledException if the user cancelled the statement
     */
    public ExecuteResponse execute(ExecuteRequest request, LongConsumer progress) {
        if (context.isWriteMode()) {
            StatementClassifier.Kind kind = StatementClassifier.classify(request.getSql());
            if (kind != StatementClassifier.Kind.OTHER) {
                return boundary(kind);
            }
        }

        Connection conn = stateMachine.sessionConnection();
        Dialect dialect = connections.getDialect();
        long gen = cancellationToken.begin();
        AtomicReference<Statement> inFlight = new AtomicReference<>();
        Future<ExecuteResponse> future = worker.submit(() -> run(conn, request, inFlight));

        long started = System.nanoTime();
        long progressAfterMs = properties.getExecute().getProgressAfterMs();
        long nextProgressMs = progressAfterMs;
        long cancelIssuedAt = -1;
        while (true) {
            try {
                ExecuteResponse response = future.get(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (cancelIssuedAt >= 0 || !cancellationToken.isCurrent(gen)) {
                    // Finished before the cancel reached the server; the result is discarded.
                    stateMachine.onStatementError();
                    throw new QueryCancelledException();
                }
                stateMachine.onStatementSuccess();
                return response;
            } catch (TimeoutException e) {
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
                if (cancelIssuedAt < 0 && cancellationToken.consume(gen)) {
                    cancel(inFlight.get(), gen);
                    cancelIssuedAt = elapsedMs;
                } else if (cancelIssuedAt >= 0 && elapsedMs - cancelIssuedAt > CANCEL_GRACE_MS) {
                    log.warn("Statement did not stop after cancel; abandoning it: generation={}", gen);
                    stateMachine.onStatementError();
                    throw new QueryCancelledException();
                }
                if (progressAfterMs > 0 && elapsedMs >= nextProgressMs && cancelIssuedAt < 0) {
                    progress.accept(elapsedMs);
                    nextProgressMs = elapsedMs + 1000;
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                stateMachine.onStatementError();
                if (cause instanceof SQLException) {
                    SQLException sqlException = (SQLException) cause;
                    if (cancelIssuedAt >= 0 && dialect.isCancellation(sqlException)) {
                        throw new QueryCancelledException();
                    }
                    throw translate(dialect, sqlException);
                }
                if (cause instanceof GuardsqlException) {
                    throw (GuardsqlException) cause;
                }
                throw new GuardsqlException(ErrorKind.INTERNAL, "Execution failed: " + cause, cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancel(inFlight.get(), gen);
                throw new QueryCancelledException();
            }
        }
    }

    private ExecuteResponse boundary(StatementClassifier.Kind kind) {
        try {
            String tag = kind == StatementClassifier.Kind.COMMIT ? stateMachine.commit() : stateMachine.rollback();
            return textResponse(tag, 0, 0);
        } catch (SQLException e) {
            throw translate(connections.getDialect(), e);
        }
    }

    private void cancel(Statement statement, long gen) {
        if (statement == null) {
            return;
        }
        try {
            statement.cancel();
            log.info("Cancel sent: generation={}", gen);
        } catch (SQLException e) {
            log.warn("Cancel failed: generation={}, error={}", gen, e.getMessage());
        }
    }

    private GuardsqlException translate(Dialect dialect, SQLException e) {
        if (dialect.isConnectionFailure(e)) {
            return new PoolException("Connection failure: " + e.getMessage(), e);
        }
        return dialect.toStatementException(e);
    }

    private ExecuteResponse run(Connection conn, ExecuteRequest request, AtomicReference<Statement> inFlight)
            throws SQLException {
        long startTime = System.nanoTime();
        try (Statement stmt = conn.createStatement()) {
            inFlight.set(stmt);
            int queryTimeoutMs = request.getOptions().getQueryTimeoutMs();
            if (queryTimeoutMs > 0) {
                stmt.setQueryTimeout(Math.max(1, queryTimeoutMs / 1000));
            }
            stmt.setFetchSize(request.getOptions().getFetchSize());

            boolean isResultSet = stmt.execute(request.getSql());

            ExecuteResponse response;
            if (isResultSet) {
                response = new ExecuteResponse();
                response.setMetadata(new ExecuteResponse.Metadata());
                response.setType("tabular");
                try (ResultSet rs = stmt.getResultSet()) {
                    processResultSet(rs, response, request.getOptions().getLimit());
                }
            } else {
                int updateCount = stmt.getUpdateCount();
                response = textResponse(commandTag(request.getSql(), updateCount), updateCount, 0);
            }
            response.getMetadata().setDurationMicros(TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - startTime));
            return response;
        } finally {
            inFlight.set(null);
        }
    }

    /**
     * Read a result set into ordered rows keyed by unique column label.
     *
     * @param rs result set
     * @param response response to fill
     * @param limit maximum rows kept, 0 for all
     * @throws SQLException on JDBC errors
     */
    static void processResultSet(ResultSet rs, ExecuteResponse response, int limit) throws SQLException {
        ResultSetMetaData rsmd = rs.getMetaData();
        int columnCount = rsmd.getColumnCount();

        List<ExecuteResponse.ColumnDefinition> columns = new ArrayList<>();
        List<String> keys = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 1; i <= columnCount; i++) {
            String label = rsmd.getColumnLabel(i);
            String key = label;
            int n = 2;
            while (!seen.add(key)) {
                key = label + "_" + n++;
            }
            keys.add(key);
            ExecuteResponse.ColumnDefinition col = new ExecuteResponse.ColumnDefinition();
            col.setName(key);
            col.setType(rsmd.getColumnTypeName(i));
            int idx = i;
            col.setSchemaName(blankToNull(safeMeta(() -> rsmd.getSchemaName(idx))));
            col.setTableName(blankToNull(safeMeta(() -> rsmd.getTableName(idx))));
            columns.add(col);
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        int count = 0;
        boolean truncated = false;
        while (rs.next()) {
            if (limit > 0 && count >= limit) {
                truncated = true;
                break;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(keys.get(i - 1), JdbcValues.read(rs, i));
            }
            rows.add(row);
            count++;
        }

        ExecuteResponse.DataContent data = new ExecuteResponse.DataContent();
        data.setColumns(columns);
        data.setRows(rows);
        response.setData(data);

        if (response.getMetadata() == null) {
            response.setMetadata(new ExecuteResponse.Metadata());
        }
        response.getMetadata().setRowsAffected(count);
        response.getMetadata().setTruncated(truncated);
    }

    static ExecuteResponse textResponse(String text, long rowsAffected, long durationMicros) {
        ExecuteResponse response = new ExecuteResponse();
        response.setType("text");
        ExecuteResponse.DataContent data = new ExecuteResponse.DataContent();
        data.setTextContent(text);
        response.setData(data);
        ExecuteResponse.Metadata metadata = new ExecuteResponse.Metadata();
        metadata.setRowsAffected(rowsAffected);
        metadata.setDurationMicros(durationMicros);
        response.setMetadata(metadata);
        return response;
    }

    /**
     * Build a psql-like command tag such as {@code UPDATE 3} or {@code CREATE TABLE}.
     *
     * @param sql statement
     * @param updateCount JDBC update count
     * @return command tag
     */
    static String commandTag(String sql, int updateCount) {
        String[] words = StatementClassifier.stripLeadingComments(sql).trim()
                .toUpperCase(Locale.ROOT).split("\\s+");
        String verb = words.length > 0 ? words[0].replaceAll("[^A-Z]", "") : "";
        switch (verb) {
            case "INSERT":
            case "UPDATE":
            case "DELETE":
            case "MERGE":
            case "COPY":
            case "SELECT":
                return verb + " " + Math.max(updateCount, 0);
            case "CREATE":
            case "DROP":
            case "ALTER":
            case "TRUNCATE":
                if (words.length > 1 && "TRUNCATE".equals(verb)) {
                    return verb + " TABLE";
                }
                return words.length > 1 ? verb + " " + words[1].replaceAll("[^A-Z]", "") : verb;
            case "":
                return "OK";
            default:
                return verb;
        }
    }

    private interface MetaSupplier {
        String get() throws SQLException;
    }

    private static String safeMeta(MetaSupplier supplier) {
        try {
            return supplier.get();
        } catch (SQLException | RuntimeException e) {
            return null;
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    @Override
    public void close() {
        worker.shutdownNow();
    }
}
