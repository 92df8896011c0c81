package com.guardsql.service;

import com.guardsql.api.ConnectRequest;
import com.guardsql.dialect.Dialect;
import com.guardsql.dialect.Dialects;
import com.guardsql.dialect.PostgresDialect;
import com.guardsql.error.PoolException;
import com.guardsql.util.ConnectionTargetParser;
import com.guardsql.util.JdbcConnectionInfo;
import com.guardsql.util.JdbcConnectionInfoResolver;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;

/**
 * Owns the connection pools of the session.
 *
 * <p>The main pool serves the long-lived session connection plus short-lived browsing
 * connections. A separate single-connection pool serves out-of-band transaction status checks,
 * so the monitor never competes with the session for a connection.
 */
@Slf4j
@Service
public class ConnectionManager implements AutoCloseable {

    static final String POOL_NAME = "guardsql-pool";
    static final String MONITOR_POOL_NAME = "guardsql-monitor";

    private final JdbcConnectionInfoResolver jdbcConnectionInfoResolver;

    private HikariDataSource pool;
    private HikariDataSource monitorPool;
    private JdbcConnectionInfo info;
    private Dialect dialect;
    private int connectionTimeoutMs;

    private Connection sessionConnection;

    public ConnectionManager(JdbcConnectionInfoResolver jdbcConnectionInfoResolver) {
        this.jdbcConnectionInfoResolver = jdbcConnectionInfoResolver;
    }

    /**
     * Resolve the target, open both pools and check them with {@code SELECT 1}.
     *
     * @param request connect request
     * @throws SQLException if the database cannot be reached
     */
    public synchronized void connect(ConnectRequest request) throws SQLException {
        if (pool != null) {
            throw new IllegalStateException("Already connected");
        }
        JdbcConnectionInfo resolved = jdbcConnectionInfoResolver.resolve(request.getTarget());
        Dialect resolvedDialect = Dialects.forType(resolved.getDbType());
        ConnectRequest.ConnectOptions options = request.getOptions();
        log.info("Connecting: target={}, dbType={}", resolved.getDisplayTarget(), resolved.getDbType());

        if ("prefer".equals(resolved.getSslMode()) && resolvedDialect instanceof PostgresDialect pg) {
            JdbcConnectionInfo tls = withSslMode(resolved, "require");
            try {
                openPools(tls, resolvedDialect, options);
                log.info("TLS negotiated: target={}", resolved.getDisplayTarget());
                return;
            } catch (SQLException e) {
                if (!pg.isTlsFailure(e)) {
                    throw e;
                }
                log.info("TLS unavailable, continuing without TLS: target={}, reason={}",
                        resolved.getDisplayTarget(), e.getMessage());
            }
            openPools(withSslMode(resolved, "disable"), resolvedDialect, options);
            return;
        }
        openPools(resolved, resolvedDialect, options);
    }

    private JdbcConnectionInfo withSslMode(JdbcConnectionInfo base, String sslMode) {
        String url = base.getUrl().replaceAll("sslmode=[^&]*", "sslmode=" + sslMode);
        return base.toBuilder().url(url).sslMode(sslMode).build();
    }

    private void openPools(JdbcConnectionInfo resolved, Dialect resolvedDialect, ConnectRequest.ConnectOptions options)
            throws SQLException {
        HikariDataSource main = new HikariDataSource(buildHikariConfig(resolved, resolvedDialect, POOL_NAME,
                options.getMaximumPoolSize(), options.getMinimumIdle(), options.getConnectionTimeoutMs()));
        HikariDataSource monitor = null;
        try {
            checkPool(main);
            monitor = new HikariDataSource(buildHikariConfig(resolved, resolvedDialect, MONITOR_POOL_NAME,
                    1, 0, options.getConnectionTimeoutMs()));
            checkPool(monitor);
        } catch (SQLException | RuntimeException e) {
            main.close();
            if (monitor != null) {
                monitor.close();
            }
            throw e;
        }
        this.pool = main;
        this.monitorPool = monitor;
        this.info = resolved;
        this.dialect = resolvedDialect;
        this.connectionTimeoutMs = options.getConnectionTimeoutMs();
    }

    private void checkPool(HikariDataSource ds) throws SQLException {
        try (Connection conn = ds.getConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT 1")) {
            if (!rs.next()) {
                throw new SQLException("Connection check returned no row");
            }
        }
    }

    private HikariConfig buildHikariConfig(JdbcConnectionInfo resolved, Dialect resolvedDialect, String poolName,
                                           int maximumPoolSize, int minimumIdle, int connectionTimeoutMs) {
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        config.setJdbcUrl(resolved.getUrl());
        config.setDriverClassName(resolvedDialect.driverClassName());
        if (resolved.getUsername() != null && !resolved.getUsername().isEmpty()) {
            config.setUsername(resolved.getUsername());
        }
        if (resolved.getPassword() != null && !resolved.getPassword().isEmpty()) {
            config.setPassword(resolved.getPassword());
        }
        resolvedDialect.configure(config, resolved);

        // Pool is checked explicitly after construction.
        config.setInitializationFailTimeout(-1);
        config.setConnectionTimeout(connectionTimeoutMs);
        config.setMaximumPoolSize(maximumPoolSize);
        config.setMinimumIdle(minimumIdle);
        config.setPoolName(poolName);
        return config;
    }

    public synchronized boolean isConnected() {
        return pool != null;
    }

    public synchronized Dialect getDialect() {
        requireConnected();
        return dialect;
    }

    public synchronized JdbcConnectionInfo getInfo() {
        requireConnected();
        return info;
    }

    /**
     * Return the long-lived session connection, leasing a new one if none is held or the held
     * one is no longer valid.
     *
     * @return session connection and whether it was freshly leased
     */
    public synchronized SessionLease sessionConnection() {
        requireConnected();
        try {
            if (sessionConnection != null && !sessionConnection.isClosed() && sessionConnection.isValid(2)) {
                return new SessionLease(sessionConnection, false);
            }
        } catch (SQLException e) {
            log.warn("Session connection check failed: error={}", e.getMessage());
        }
        releaseSessionQuietly();
        sessionConnection = acquire(pool, "session");
        return new SessionLease(sessionConnection, true);
    }

    /**
     * Borrow a browsing connection. The caller must close it.
     *
     * @return pooled connection
     */
    public Connection browseConnection() {
        HikariDataSource ds;
        synchronized (this) {
            requireConnected();
            ds = pool;
        }
        return acquire(ds, "browse");
    }

    /**
     * Borrow the monitor connection. The caller must close it.
     *
     * @return monitor connection
     */
    public Connection monitorConnection() {
        HikariDataSource ds;
        synchronized (this) {
            requireConnected();
            ds = monitorPool;
        }
        return acquire(ds, "monitor");
    }

    private Connection acquire(HikariDataSource ds, String purpose) {
        try {
            return ds.getConnection();
        } catch (SQLTransientConnectionException e) {
            throw new PoolException("Timed out after " + connectionTimeoutMs + " ms waiting for a "
                    + purpose + " connection", e);
        } catch (SQLException e) {
            throw new PoolException("Could not obtain a " + purpose + " connection: " + e.getMessage(), e);
        }
    }

    private void releaseSessionQuietly() {
        if (sessionConnection == null) {
            return;
        }
        try {
            sessionConnection.close();
        } catch (SQLException e) {
            log.warn("Releasing session connection failed: error={}", e.getMessage());
        }
        sessionConnection = null;
    }

    private void requireConnected() {
        if (pool == null) {
            throw new IllegalStateException("Not connected");
        }
    }

    @Override
    public synchronized void close() {
        releaseSessionQuietly();
        if (monitorPool != null) {
            monitorPool.close();
            monitorPool = null;
        }
        if (pool != null) {
            pool.close();
            pool = null;
            log.info("Disconnected: target={}", info != null ? info.getDisplayTarget() : "");
        }
    }

    /**
     * A session connection plus whether it was just leased and still needs its mode applied.
     */
    public static final class SessionLease {
        private final Connection connection;
        private final boolean fresh;

        SessionLease(Connection connection, boolean fresh) {
            this.connection = connection;
            this.fresh = fresh;
        }

        public Connection getConnection() {
            return connection;
        }

        public boolean isFresh() {
            return fresh;
        }
    }

    public static String mask(String target) {
        return ConnectionTargetParser.maskTarget(target);
    }
}
