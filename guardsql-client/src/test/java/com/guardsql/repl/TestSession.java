package com.guardsql.repl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guardsql.api.ConnectRequest;
import com.guardsql.audit.AuditEntry;
import com.guardsql.audit.AuditLog;
import com.guardsql.audit.AuditQuery;
import com.guardsql.audit.AuditRecorder;
import com.guardsql.config.GuardsqlProperties;
import com.guardsql.history.ResultHistory;
import com.guardsql.model.SessionContext;
import com.guardsql.redaction.RedactionEngine;
import com.guardsql.redaction.RedactionRule;
import com.guardsql.render.ResultRenderer;
import com.guardsql.schema.SchemaCache;
import com.guardsql.service.CatalogService;
import com.guardsql.service.ConnectionManager;
import com.guardsql.service.QueryExecutor;
import com.guardsql.service.SessionStateMachine;
import com.guardsql.snippet.SnippetStore;
import com.guardsql.util.JdbcConnectionInfoResolver;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A session wired by hand against a SQLite file, the way the application context wires it.
 */
class TestSession implements AutoCloseable {
    final GuardsqlProperties properties = new GuardsqlProperties();
    final SessionContext context = new SessionContext();
    final ConnectionManager connections = new ConnectionManager(new JdbcConnectionInfoResolver(name -> null));
    final SessionStateMachine stateMachine = new SessionStateMachine(connections, context);
    final QueryExecutor executor;
    final ResultHistory history;
    final OutputRedirect redirect = new OutputRedirect();
    final AuditRecorder audit;
    final SchemaCache schemaCache;
    final InputProcessor processor;
    final StreamConsole console = new StreamConsole();
    private final Path auditDir;

    TestSession(Path dir, String... redactions) throws SQLException {
        properties.setDataDir(dir.toString());
        ConnectRequest request = new ConnectRequest();
        request.setTarget(dir.resolve("session.db").toString());
        connections.connect(request);

        executor = new QueryExecutor(connections, stateMachine, context, properties);
        history = new ResultHistory(properties);
        ResultRenderer renderer = new ResultRenderer(new ObjectMapper());
        ResultDisplay display = new ResultDisplay(renderer, redirect, properties);
        RedactionEngine redaction = new RedactionEngine(
                Arrays.stream(redactions).map(RedactionRule::parse).collect(Collectors.toList()));
        CatalogService catalog = new CatalogService(connections, stateMachine);
        schemaCache = new SchemaCache(catalog, connections, properties);
        MetacommandDispatcher dispatcher = new MetacommandDispatcher(context, stateMachine, connections, catalog,
                history, renderer, display, redaction, new SnippetStore(properties), redirect, new ExternalEditor(),
                schemaCache);

        auditDir = dir.resolve("audit");
        audit = new AuditRecorder(context, properties);
        audit.open(auditDir);
        processor = new InputProcessor(context, executor, dispatcher, display, renderer, history, redaction, audit,
                new ErrorReporter(), properties);
    }

    Submission submit(String text) {
        return processor.submit(text, console);
    }

    List<AuditEntry> auditEntries() {
        try (AuditLog log = AuditLog.openReadOnly(auditDir.resolve(AuditLog.MAIN_DB))) {
            return log.query(AuditQuery.builder().limit(0).build());
        }
    }

    AuditEntry lastAudit() {
        List<AuditEntry> entries = auditEntries();
        return entries.get(entries.size() - 1);
    }

    @Override
    public void close() {
        redirect.close();
        executor.close();
        schemaCache.close();
        audit.close();
        connections.close();
    }
}
