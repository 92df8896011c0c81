package com.guardsql.schema;

import com.guardsql.config.GuardsqlProperties;
import com.guardsql.dialect.CatalogQuery;
import com.guardsql.dialect.Dialect;
import com.guardsql.service.CatalogService;
import com.guardsql.service.ConnectionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Background cache of catalog names for completion.
 *
 * <p>Readers always get the current snapshot immediately. A refresh runs its catalog queries in
 * parallel on browsing connections and swaps the snapshot in one step; a query that fails keeps
 * the previous snapshot's part.
 */
@Slf4j
@Component
public class SchemaCache implements AutoCloseable {
    private final CatalogService catalogService;
    private final ConnectionManager connections;
    private final GuardsqlProperties.SchemaCache settings;
    private final AtomicReference<SchemaSnapshot> snapshot = new AtomicReference<>(SchemaSnapshot.empty());
    private final AtomicBoolean refreshing = new AtomicBoolean();
    private final ExecutorService executor = Executors.newFixedThreadPool(4, r -> {
        Thread t = new Thread(r, "guardsql-schema");
        t.setDaemon(true);
        return t;
    });

    public SchemaCache(CatalogService catalogService, ConnectionManager connections, GuardsqlProperties properties) {
        this.catalogService = catalogService;
        this.connections = connections;
        this.settings = properties.getSchemaCache();
    }

    public boolean isEnabled() {
        return settings.isEnabled();
    }

    /**
     * Current snapshot. Starts a background refresh when the cache is enabled and the snapshot is
     * missing or older than the TTL.
     *
     * @return current snapshot, possibly empty
     */
    public SchemaSnapshot current() {
        SchemaSnapshot current = snapshot.get();
        if (settings.isEnabled() && connections.isConnected() && isStale(current)) {
            refreshAsync();
        }
        return current;
    }

    boolean isStale(SchemaSnapshot current) {
        Duration age = Duration.between(current.getLoadedAt(), Instant.now());
        return current.isEmpty() || age.getSeconds() >= settings.getTtlSeconds();
    }

    /**
     * Start a refresh unless one is already running.
     *
     * @return future completing with the new snapshot, or the current one if a refresh was running
     */
    public CompletableFuture<SchemaSnapshot> refreshAsync() {
        if (!refreshing.compareAndSet(false, true)) {
            return CompletableFuture.completedFuture(snapshot.get());
        }
        Dialect dialect = connections.getDialect();
        SchemaSnapshot previous = snapshot.get();
        CompletableFuture<List<List<String>>> schemas = read("schemas", dialect.schemasQuery());
        CompletableFuture<List<List<String>>> relations = read("relations", dialect.relationsQuery());
        CompletableFuture<List<List<String>>> columns = read("columns", dialect.columnsQuery());
        CompletableFuture<List<List<String>>> functions = read("functions", dialect.functionsQuery());

        return CompletableFuture.allOf(schemas, relations, columns, functions)
                .thenApply(ignored -> {
                    SchemaSnapshot next = merge(previous, schemas.join(), relations.join(), columns.join(),
                            functions.join());
                    snapshot.set(next);
                    log.info("Schema cache refreshed: schemas={}, columns={}", next.getSchemas().size(),
                            next.getColumns().size());
                    return next;
                })
                .whenComplete((result, error) -> refreshing.set(false));
    }

    private CompletableFuture<List<List<String>>> read(String part, CatalogQuery query) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return catalogService.readRows(query, settings.getQueryTimeoutMs());
            } catch (Exception e) {
                log.warn("Schema cache query failed, keeping previous {}: error={}", part, e.getMessage());
                return null;
            }
        }, executor);
    }

    /**
     * Build a snapshot from query rows. A null part keeps the previous snapshot's value.
     */
    static SchemaSnapshot merge(SchemaSnapshot previous, List<List<String>> schemaRows,
                                List<List<String>> relationRows, List<List<String>> columnRows,
                                List<List<String>> functionRows) {
        SchemaSnapshot.SchemaSnapshotBuilder builder = SchemaSnapshot.builder().loadedAt(Instant.now());

        if (schemaRows != null) {
            for (List<String> row : schemaRows) {
                builder.schema(row.get(0));
            }
        } else {
            builder.schemas(previous.getSchemas());
        }

        if (relationRows != null) {
            Map<String, List<String>> tables = new LinkedHashMap<>();
            Map<String, List<String>> views = new LinkedHashMap<>();
            for (List<String> row : relationRows) {
                Map<String, List<String>> target = "view".equalsIgnoreCase(row.get(2)) ? views : tables;
                target.computeIfAbsent(row.get(0), k -> new ArrayList<>()).add(row.get(1));
            }
            builder.tables(tables).views(views);
        } else {
            builder.tables(previous.getTables()).views(previous.getViews());
        }

        if (columnRows != null) {
            Map<String, List<String>> columns = new LinkedHashMap<>();
            for (List<String> row : columnRows) {
                columns.computeIfAbsent(row.get(0) + "." + row.get(1), k -> new ArrayList<>()).add(row.get(2));
            }
            builder.columns(columns);
        } else {
            builder.columns(previous.getColumns());
        }

        if (functionRows != null) {
            for (List<String> row : functionRows) {
                if (row.size() > 1 && row.get(1) != null) {
                    builder.function(row.get(1));
                }
            }
        } else {
            builder.functions(previous.getFunctions());
        }
        return builder.build();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
