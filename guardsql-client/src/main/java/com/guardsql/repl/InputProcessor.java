package com.guardsql.repl;

import com.guardsql.api.ExecuteRequest;
import com.guardsql.api.ExecuteResponse;
import com.guardsql.audit.AuditEntry;
import com.guardsql.audit.AuditRecorder;
import com.guardsql.config.GuardsqlProperties;
import com.guardsql.error.InputException;
import com.guardsql.history.ResultHistory;
import com.guardsql.history.StoredResult;
import com.guardsql.model.SessionContext;
import com.guardsql.parser.InputItem;
import com.guardsql.parser.InputParser;
import com.guardsql.parser.ParsedInput;
import com.guardsql.parser.QueryModifiers;
import com.guardsql.redaction.RedactionEngine;
import com.guardsql.render.ResultRenderer;
import com.guardsql.render.ResultTable;
import com.guardsql.service.QueryExecutor;
import com.guardsql.util.JdbcValues;
import com.guardsql.util.VariableInterpolator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Runs one submission: parses it, then executes each metacommand and query in order, printing
 * results and failures and auditing every item. Nothing thrown by an item escapes.
 */
@Slf4j
@Component
public class InputProcessor {
    static final String GSET_ONE_ROW = "\\gset requires exactly one row";
    /** Audit text for write mode requested on the command line. */
    static final String STARTUP_WRITE = "--write";

    private final SessionContext context;
    private final QueryExecutor executor;
    private final MetacommandDispatcher dispatcher;
    private final ResultDisplay display;
    private final ResultRenderer renderer;
    private final ResultHistory history;
    private final RedactionEngine redaction;
    private final AuditRecorder audit;
    private final ErrorReporter errors;
    private final GuardsqlProperties properties;

    public InputProcessor(SessionContext context, QueryExecutor executor, MetacommandDispatcher dispatcher,
                          ResultDisplay display, ResultRenderer renderer, ResultHistory history,
                          RedactionEngine redaction, AuditRecorder audit, ErrorReporter errors,
                          GuardsqlProperties properties) {
        this.context = context;
        this.executor = executor;
        this.dispatcher = dispatcher;
        this.display = display;
        this.renderer = renderer;
        this.history = history;
        this.redaction = redaction;
        this.audit = audit;
        this.errors = errors;
        this.properties = properties;
    }

    /**
     * Process the accumulated input buffer.
     *
     * @param buffer input typed so far
     * @param console operator console
     * @return text to keep buffering and whether the session should end
     */
    public Submission submit(String buffer, SessionConsole console) {
        TraceIds.begin();
        try {
            return process(buffer, console);
        } finally {
            TraceIds.end();
        }
    }

    /**
     * Enter write mode as requested by {@code --write}, auditing the attempt as {@code \W} is.
     *
     * @param console operator console
     */
    public void startInWriteMode(SessionConsole console) {
        TraceIds.begin();
        try {
            dispatcher.enterWrite(console);
            audit.record(STARTUP_WRITE, AuditEntry.OK);
        } catch (RuntimeException e) {
            fail(STARTUP_WRITE, e, console);
        } finally {
            TraceIds.end();
        }
    }

    private Submission process(String buffer, SessionConsole console) {
        ParsedInput parsed = InputParser.parse(buffer, context.isExpanded());
        String remainder = parsed.getRemainder();
        for (InputItem item : parsed.getItems()) {
            switch (item.getType()) {
                case INVALID:
                    fail(item.getText(), item.getError(), console);
                    break;
                case METACOMMAND:
                    DispatchResult result = runMetacommand(item, remainder, console);
                    if (result.isQuit()) {
                        return Submission.quit();
                    }
                    if (result.getBuffer() != null) {
                        // Edited text runs like typed input; its unterminated part stays buffered.
                        Submission edited = process(result.getBuffer(), console);
                        if (edited.isQuit()) {
                            return edited;
                        }
                        remainder = edited.getRemainder();
                    }
                    break;
                default:
                    runQuery(item, console);
                    break;
            }
        }
        return new Submission(remainder, false);
    }

    /**
     * Run a file or snippet as typed input. A trailing statement without terminator is reported
     * and not executed.
     *
     * @return true if the script asked to quit
     */
    boolean runScript(String text, String source, SessionConsole console) {
        Submission submission = process(text, console);
        if (!submission.isQuit() && !submission.getRemainder().isEmpty()) {
            errors.report(new InputException("Unterminated statement at end of " + source + " was not run"),
                    console.err());
        }
        return submission.isQuit();
    }

    private DispatchResult runMetacommand(InputItem item, String buffer, SessionConsole console) {
        try {
            DispatchResult result = dispatcher.dispatch(item.getMetacommand(), buffer, console, this::runScript);
            audit.record(item.getText(), AuditEntry.OK);
            return result;
        } catch (RuntimeException e) {
            fail(item.getText(), e, console);
            return DispatchResult.CONTINUE;
        }
    }

    private void runQuery(InputItem item, SessionConsole console) {
        QueryModifiers modifiers = item.getModifiers();
        try {
            String sql = modifiers.isVerbatim()
                    ? item.getSql()
                    : VariableInterpolator.interpolate(item.getSql(), context.getVariables());
            Path target = null;
            if (modifiers.hasOutputFile()) {
                target = Path.of(modifiers.getOutputFile());
                ResultRenderer.checkTarget(target);
            }

            ExecuteRequest request = new ExecuteRequest();
            request.setSql(sql);
            request.setSourceText(item.getText());
            request.setModifiers(modifiers);
            request.getOptions().setFetchSize(properties.getExecute().getFetchSize());
            request.getOptions().setQueryTimeoutMs(properties.getExecute().getQueryTimeoutMs());

            ExecuteResponse response;
            try (SessionConsole.InterruptScope ignored =
                         console.trapInterrupt(() -> executor.getCancellationToken().request())) {
                response = executor.execute(request, elapsedMs -> console.err()
                        .printf("Still running (%d s), press Ctrl-C to cancel%n", elapsedMs / 1000));
            }
            context.setLastQueryText(item.getText());
            show(item.getText(), modifiers, target, response, console);
            audit.record(item.getText(), AuditEntry.OK);
        } catch (RuntimeException e) {
            fail(item.getText(), e, console);
        }
    }

    private void show(String text, QueryModifiers modifiers, Path target, ExecuteResponse response,
                      SessionConsole console) {
        if (!response.isTabular()) {
            if (!modifiers.isZero()) {
                display.text(response.getData().getTextContent(), console);
            }
            return;
        }
        Duration took = Duration.ofNanos(response.getMetadata().getDurationMicros() * 1000);
        ResultTable table = ResultTable.of(response);
        history.push(StoredResult.of(text, table, took));

        ResultTable shown = context.isRedact() ? redaction.apply(table) : table;
        if (modifiers.isVarSet()) {
            capture(shown, modifiers.getVarPrefix());
        }
        if (target != null) {
            renderer.renderToFile(shown, modifiers.format(), target);
            if (!modifiers.isZero()) {
                console.out().println("Wrote " + shown.getRows().size() + " rows to " + target);
            }
            return;
        }
        if (!modifiers.isZero()) {
            display.show(shown, modifiers.format(), console, true,
                    ResultDisplay.status(shown.getRows().size(), took));
        }
    }

    private void capture(ResultTable table, String prefix) {
        if (table.getRows().size() != 1) {
            throw new InputException(GSET_ONE_ROW);
        }
        String p = prefix == null ? "" : prefix;
        for (Map.Entry<String, Object> cell : table.getRows().get(0).entrySet()) {
            Object value = cell.getValue();
            context.getVariables().set(p + cell.getKey(), value == null ? "" : JdbcValues.toText(value));
        }
    }

    private void fail(String text, RuntimeException e, SessionConsole console) {
        audit.record(text, ErrorReporter.outcome(e));
        errors.report(e, console.err());
    }
}
