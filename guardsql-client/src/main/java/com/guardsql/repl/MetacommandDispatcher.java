package com.guardsql.repl;

import com.guardsql.api.ExecuteResponse;
import com.guardsql.dialect.Dialect;
import com.guardsql.error.InputException;
import com.guardsql.error.PoolException;
import com.guardsql.history.ResultHistory;
import com.guardsql.history.StoredResult;
import com.guardsql.model.SessionContext;
import com.guardsql.model.VariableStore;
import com.guardsql.parser.Metacommand;
import com.guardsql.redaction.RedactionEngine;
import com.guardsql.render.OutputFormat;
import com.guardsql.render.ResultRenderer;
import com.guardsql.render.ResultTable;
import com.guardsql.schema.SchemaCache;
import com.guardsql.service.CatalogService;
import com.guardsql.service.ConnectionManager;
import com.guardsql.service.SessionStateMachine;
import com.guardsql.snippet.SnippetStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Executes parsed metacommands against the session.
 */
@Slf4j
@Component
public class MetacommandDispatcher {
    static final String COPY_UNSUPPORTED =
            "\\copy is not supported. Run the query, then use \\re show format=csv to=PATH";

    private final SessionContext context;
    private final SessionStateMachine stateMachine;
    private final ConnectionManager connections;
    private final CatalogService catalogService;
    private final ResultHistory history;
    private final ResultRenderer renderer;
    private final ResultDisplay display;
    private final RedactionEngine redaction;
    private final SnippetStore snippets;
    private final OutputRedirect redirect;
    private final ExternalEditor editor;
    private final SchemaCache schemaCache;

    public MetacommandDispatcher(SessionContext context, SessionStateMachine stateMachine,
                                 ConnectionManager connections, CatalogService catalogService,
                                 ResultHistory history, ResultRenderer renderer, ResultDisplay display,
                                 RedactionEngine redaction, SnippetStore snippets, OutputRedirect redirect,
                                 ExternalEditor editor, SchemaCache schemaCache) {
        this.context = context;
        this.stateMachine = stateMachine;
        this.connections = connections;
        this.catalogService = catalogService;
        this.history = history;
        this.renderer = renderer;
        this.display = display;
        this.redaction = redaction;
        this.snippets = snippets;
        this.redirect = redirect;
        this.editor = editor;
        this.schemaCache = schemaCache;
    }

    /**
     * Run one metacommand.
     *
     * @param command parsed command
     * @param buffer unterminated query text currently buffered
     * @param console operator console
     * @param scripts runs {@code \i} files and snippets
     * @return how the read loop continues
     */
    public DispatchResult dispatch(Metacommand command, String buffer, SessionConsole console,
                                   ScriptRunner scripts) {
        PrintStream out = console.out();
        switch (command.getKind()) {
            case QUIT:
                stateMachine.checkQuit();
                return DispatchResult.QUIT;
            case HELP:
                out.print(HelpText.TEXT);
                break;
            case EXPANDED_TOGGLE:
                context.setExpanded(!context.isExpanded());
                out.println("Expanded display is " + onOff(context.isExpanded()) + ".");
                break;
            case WRITE_TOGGLE:
                toggleWrite(console);
                break;
            case REDACT_TOGGLE:
                if (!redaction.isAvailable()) {
                    out.println(RedactionEngine.UNAVAILABLE);
                    break;
                }
                context.setRedact(!context.isRedact());
                out.println("Redaction mode is " + onOff(context.isRedact()) + ".");
                break;
            case EDIT:
                if (command.getPath() != null) {
                    return DispatchResult.replaceBuffer(editor.editFile(Path.of(command.getPath())));
                }
                return DispatchResult.replaceBuffer(editor.editText(buffer));
            case INCLUDE:
                return include(command, console, scripts);
            case OUTPUT:
                if (command.getPath() == null) {
                    redirect.reset();
                    context.setOutputPath(null);
                } else {
                    Path target = Path.of(command.getPath());
                    redirect.redirectTo(target);
                    context.setOutputPath(target);
                }
                break;
            case DEBUG:
                out.print(debug("state".equals(command.getDebugWhat())));
                break;
            case SET:
                context.getVariables().set(command.getName(), command.getValue());
                break;
            case DEFAULT:
                context.getVariables().setDefault(command.getName(), command.getValue());
                break;
            case UNSET:
                if (!context.getVariables().unset(command.getName())) {
                    throw notSet(command.getName());
                }
                break;
            case GET:
                out.println(context.getVariables().get(command.getName())
                        .orElseThrow(() -> notSet(command.getName())));
                break;
            case VARS:
                listVariables(command.getPattern(), out);
                break;
            case SNIPPET_SAVE:
                saveSnippet(command.getName(), out);
                break;
            case SNIPPET_RUN:
                String snippet = snippets.load(command.getName());
                return withBindings(command.getBindings(),
                        () -> scripts.run(snippet, "snippet " + command.getName(), console));
            case DESCRIBE:
                showCatalog(() -> catalogService.describe(command), console);
                break;
            case LIST:
                showCatalog(() -> catalogService.list(command), console);
                break;
            case RESULT_LIST:
                redirect.resolve(out).print(history.list(command.getLimit(), command.isDetail()));
                break;
            case RESULT_SHOW:
                showResult(command.getShow(), console);
                break;
            case COPY:
                throw new InputException(COPY_UNSUPPORTED);
            default:
                throw new InputException("Unsupported metacommand: " + command.getText());
        }
        return DispatchResult.CONTINUE;
    }

    private void toggleWrite(SessionConsole console) {
        if (context.isWriteMode()) {
            console.out().println(stateMachine.leaveWrite());
            return;
        }
        enterWrite(console);
    }

    /**
     * Ask for a justification and switch the session to write mode.
     *
     * @param console console
     */
    void enterWrite(SessionConsole console) {
        console.out().println(stateMachine.enterWrite(askJustification(console)));
    }

    /**
     * Prompt for a write justification with recall of earlier answers.
     *
     * @param console console
     * @return answer, possibly blank
     */
    private String askJustification(SessionConsole console) {
        String answer = console.readLine("Justification? ", context.getJustificationHistory().recent());
        return answer == null ? "" : answer;
    }

    private DispatchResult include(Metacommand command, SessionConsole console, ScriptRunner scripts) {
        Path file = Path.of(command.getPath());
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InputException("Cannot read file '" + file + "': " + e.getMessage());
        }
        log.info("Running file: path={}, bindings={}", file, command.getBindings().keySet());
        return withBindings(command.getBindings(), () -> scripts.run(text, file.toString(), console));
    }

    /**
     * Bind variables for the duration of a script, then restore their previous values.
     */
    private DispatchResult withBindings(Map<String, String> bindings, Supplier<Boolean> body) {
        VariableStore vars = context.getVariables();
        Map<String, Optional<String>> saved = new LinkedHashMap<>();
        for (Map.Entry<String, String> binding : bindings.entrySet()) {
            saved.put(binding.getKey(), vars.get(binding.getKey()));
            vars.set(binding.getKey(), binding.getValue());
        }
        try {
            return body.get() ? DispatchResult.QUIT : DispatchResult.CONTINUE;
        } finally {
            for (Map.Entry<String, Optional<String>> previous : saved.entrySet()) {
                if (previous.getValue().isPresent()) {
                    vars.set(previous.getKey(), previous.getValue().get());
                } else {
                    vars.unset(previous.getKey());
                }
            }
        }
    }

    private void listVariables(String pattern, PrintStream out) {
        Map<String, String> vars = context.getVariables().list(pattern);
        if (vars.isEmpty()) {
            out.println(pattern == null ? "No variables set." : "No variables match '" + pattern + "'.");
            return;
        }
        for (Map.Entry<String, String> entry : vars.entrySet()) {
            out.println(entry.getKey() + " = " + entry.getValue());
        }
    }

    private void saveSnippet(String name, PrintStream out) {
        String text = context.getLastQueryText();
        if (text == null) {
            throw new InputException("No query has been executed yet");
        }
        Path saved = snippets.save(name, text);
        out.println("Snippet '" + name + "' saved to " + saved);
    }

    private void showCatalog(CatalogCall call, SessionConsole console) {
        ExecuteResponse response;
        try {
            response = call.run();
        } catch (SQLException e) {
            Dialect dialect = connections.getDialect();
            if (dialect.isConnectionFailure(e)) {
                throw new PoolException("Connection failure: " + e.getMessage(), e);
            }
            throw dialect.toStatementException(e);
        }
        ResultTable table = ResultTable.of(response);
        if (context.isRedact()) {
            table = redaction.apply(table);
        }
        display.show(table, context.isExpanded() ? OutputFormat.EXPANDED : OutputFormat.TABLE, console, true, null);
    }

    private void showResult(Metacommand.ResultShowOptions show, SessionConsole console) {
        StoredResult stored = history.resolve(show.getIndex());
        ResultTable table = stored.toTable().project(show.getColumns());
        boolean paged = show.getLimit() != null || show.getOffset() != null;
        if (paged) {
            table = table.slice(show.getOffset() != null ? show.getOffset() : 0,
                    show.getLimit() != null ? show.getLimit() : 0);
        }
        if (context.isRedact()) {
            table = redaction.apply(table);
        }
        OutputFormat format = show.getFormat() != null
                ? OutputFormat.fromName(show.getFormat())
                : context.isExpanded() ? OutputFormat.EXPANDED : OutputFormat.TABLE;
        if (show.getTo() != null) {
            Path target = Path.of(show.getTo());
            renderer.renderToFile(table, format, target);
            console.out().println("Wrote " + table.getRows().size() + " rows to " + target);
            return;
        }
        display.show(table, format, console, !paged, null);
    }

    private String debug(boolean stateOnly) {
        StringBuilder sb = new StringBuilder();
        sb.append("state: ").append(stateMachine.refresh()).append('\n');
        sb.append("observed_status: ").append(context.getObservedStatus()).append('\n');
        sb.append("failed_since_boundary: ").append(context.isFailedSinceBoundary()).append('\n');
        sb.append("justification: ").append(context.isWriteMode() ? context.getJustification() : "-").append('\n');
        if (stateOnly) {
            return sb.toString();
        }
        sb.append("instance_id: ").append(context.getInstanceId()).append('\n');
        if (connections.isConnected()) {
            sb.append("dialect: ").append(connections.getDialect().name()).append('\n');
            sb.append("target: ").append(connections.getInfo().getDisplayTarget()).append('\n');
        }
        sb.append("db_user: ").append(context.getDbUser()).append('\n');
        sb.append("expanded: ").append(context.isExpanded()).append('\n');
        sb.append("redact: ").append(context.isRedact()).append('\n');
        sb.append("theme: ").append(context.getTheme().name().toLowerCase(Locale.ROOT)).append('\n');
        sb.append("output: ").append(context.getOutputPath() == null ? "terminal" : context.getOutputPath())
                .append('\n');
        sb.append("history: ").append(history.size()).append(" results, ").append(history.totalSize())
                .append(" bytes\n");
        sb.append("schema_cache: ").append(schemaCache.isEnabled()
                ? schemaCache.current().words().size() + " words" : "disabled").append('\n');
        return sb.toString();
    }

    private static InputException notSet(String name) {
        return new InputException("Variable '" + name + "' is not set");
    }

    private static String onOff(boolean on) {
        return on ? "on" : "off";
    }

    @FunctionalInterface
    private interface CatalogCall {
        ExecuteResponse run() throws SQLException;
    }
}
