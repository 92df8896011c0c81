package com.guardsql.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Resolves a connection target into JDBC connection configuration, filling gaps from the
 * libpq environment ({@code PGHOST}, {@code PGPORT}, {@code PGUSER}, {@code PGPASSWORD},
 * {@code PGSSLMODE}).
 */
@Slf4j
@Service
public class JdbcConnectionInfoResolver {

    private static final Set<String> CONSUMED_PARAMS = Set.of("host", "port", "user", "password", "dbname", "sslmode");

    private final Function<String, String> env;

    public JdbcConnectionInfoResolver() {
        this(System::getenv);
    }

    /**
     * Create a resolver reading defaults from the given environment.
     *
     * @param env environment lookup
     */
    public JdbcConnectionInfoResolver(Function<String, String> env) {
        this.env = env;
    }

    /**
     * Resolve a connection target into JDBC connection info.
     *
     * @param target bare database name, URL or SQLite file
     * @return jdbc connection info
     */
    public JdbcConnectionInfo resolve(String target) {
        ConnectionTargetParser.ParsedTarget parsed = ConnectionTargetParser.parseComponents(target);
        String dbType = parsed.getScheme() == null ? "postgres" : DbTypeNormalizer.normalize(parsed.getScheme());

        if ("sqlite".equals(dbType)) {
            Path file = Path.of(parsed.getPath()).toAbsolutePath().normalize();
            return JdbcConnectionInfo.builder()
                    .url(ConnectionTargetParser.buildSqliteJdbcUrl(file.toString()))
                    .username("")
                    .password("")
                    .dbType("sqlite")
                    .database(file.getFileName().toString())
                    .properties(Map.of())
                    .displayTarget(file.toString())
                    .build();
        }

        if (!"postgres".equals(dbType)) {
            throw new IllegalArgumentException("Unsupported database type: " + parsed.getScheme());
        }

        Map<String, String> params = ConnectionTargetParser.parseQuery(parsed.getRawQuery());
        String host = firstNonBlank(parsed.getHost(), params.get("host"), env.apply("PGHOST"), "localhost");
        int port = parsed.getPort() > 0 ? parsed.getPort()
                : parsePort(firstNonBlank(params.get("port"), env.apply("PGPORT"), null, null));
        String user = firstNonBlank(parsed.getUsername(), params.get("user"), env.apply("PGUSER"),
                System.getProperty("user.name", "postgres"));
        String password = firstNonBlank(parsed.getPassword(), params.get("password"), env.apply("PGPASSWORD"), "");
        String database = firstNonBlank(parsed.getPath(), params.get("dbname"), user, user);
        String sslMode = firstNonBlank(params.get("sslmode"), env.apply("PGSSLMODE"), "prefer", "prefer");

        if (ConnectionTargetParser.isUnixSocketHost(host)) {
            int socketPort = ConnectionTargetParser.portFromSocketPath(host);
            if (port == -1) {
                port = socketPort;
            }
            log.info("Unix socket host mapped to loopback TCP: socket={}, port={}", host,
                    port == -1 ? ConnectionTargetParser.DEFAULT_POSTGRES_PORT : port);
            host = "localhost";
        }

        Map<String, String> properties = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : params.entrySet()) {
            if (!CONSUMED_PARAMS.contains(e.getKey())) {
                properties.put(e.getKey(), e.getValue());
            }
        }

        int effectivePort = port == -1 ? ConnectionTargetParser.DEFAULT_POSTGRES_PORT : port;
        return JdbcConnectionInfo.builder()
                .url(ConnectionTargetParser.buildPostgresJdbcUrl(host, effectivePort, database, sslMode))
                .username(user)
                .password(password)
                .dbType("postgres")
                .database(database)
                .sslMode(sslMode)
                .properties(properties)
                .displayTarget(String.format("postgresql://%s@%s:%d/%s", user, host, effectivePort, database))
                .build();
    }

    private static int parsePort(String value) {
        if (value == null) {
            return -1;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + value);
        }
    }

    private static String firstNonBlank(String a, String b, String c, String fallback) {
        if (a != null && !a.isBlank()) {
            return a;
        }
        if (b != null && !b.isBlank()) {
            return b;
        }
        if (c != null && !c.isBlank()) {
            return c;
        }
        return fallback;
    }
}
