package com.guardsql.repl;

import com.guardsql.api.ConnectRequest;
import com.guardsql.audit.AuditExporter;
import com.guardsql.audit.AuditRecorder;
import com.guardsql.config.CliOptions;
import com.guardsql.config.GuardsqlProperties;
import com.guardsql.error.GuardsqlException;
import com.guardsql.error.InputException;
import com.guardsql.error.PersistenceException;
import com.guardsql.error.PoolException;
import com.guardsql.model.SessionContext;
import com.guardsql.model.Theme;
import com.guardsql.schema.SchemaCache;
import com.guardsql.service.ConnectionManager;
import com.guardsql.service.SessionStateMachine;
import lombok.extern.slf4j.Slf4j;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;

/**
 * Interactive read loop: connects, opens the audit store, then reads and processes input until
 * the operator quits.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "guardsql.repl", name = "enabled", havingValue = "true", matchIfMissing = true)
public class Repl implements ApplicationRunner, ExitCodeGenerator {
    static final int EXIT_OK = 0;
    static final int EXIT_STARTUP = 1;
    static final int EXIT_AUDIT = 2;

    private final GuardsqlProperties properties;
    private final SessionContext context;
    private final ConnectionManager connections;
    private final SessionStateMachine stateMachine;
    private final InputProcessor processor;
    private final AuditRecorder audit;
    private final AuditExporter exporter;
    private final ErrorReporter errors;
    private final SchemaCache schemaCache;
    private int exitCode = EXIT_OK;
    private PromptStyle promptStyle = new PromptStyle(Theme.DARK);

    public Repl(GuardsqlProperties properties, SessionContext context, ConnectionManager connections,
                SessionStateMachine stateMachine, InputProcessor processor,
                AuditRecorder audit, AuditExporter exporter, ErrorReporter errors, SchemaCache schemaCache) {
        this.properties = properties;
        this.context = context;
        this.connections = connections;
        this.stateMachine = stateMachine;
        this.processor = processor;
        this.audit = audit;
        this.exporter = exporter;
        this.errors = errors;
        this.schemaCache = schemaCache;
    }

    @Override
    public void run(ApplicationArguments args) {
        CliOptions options;
        try {
            options = CliOptions.from(args, properties);
        } catch (GuardsqlException e) {
            errors.report(e, System.err);
            exitCode = EXIT_STARTUP;
            return;
        }
        Path auditDir = options.getAuditPath() != null && !options.getAuditPath().isBlank()
                ? Path.of(options.getAuditPath())
                : AuditRecorder.auditDir(properties);

        if (options.isAuditExport()) {
            exitCode = exportAudit(auditDir, options);
            return;
        }

        try {
            audit.open(auditDir);
        } catch (PersistenceException e) {
            errors.report(e, System.err);
            exitCode = EXIT_AUDIT;
            return;
        }

        try {
            connect(options.getTarget());
        } catch (SQLException e) {
            startupFailed(options, new PoolException("Cannot connect: " + e.getMessage(), e));
            return;
        } catch (IllegalArgumentException e) {
            startupFailed(options, new InputException(e.getMessage()));
            return;
        } catch (GuardsqlException e) {
            startupFailed(options, e);
            return;
        }
        context.setTheme(options.getTheme());
        promptStyle = new PromptStyle(options.getTheme().resolve(System::getenv));

        try (Terminal terminal = TerminalBuilder.builder().name("guardsql").system(true).build()) {
            loop(terminal, options);
        } catch (IOException e) {
            log.error("Terminal failure", e);
            exitCode = EXIT_STARTUP;
        }
    }

    private void startupFailed(CliOptions options, GuardsqlException e) {
        log.error("Startup failed: target={}, error={}", ConnectionManager.mask(options.getTarget()), e.getMessage());
        errors.report(e, System.err);
        exitCode = EXIT_STARTUP;
    }

    private void connect(String target) throws SQLException {
        ConnectRequest request = new ConnectRequest();
        request.setTarget(target);
        GuardsqlProperties.Pool pool = properties.getPool();
        request.getOptions().setMaximumPoolSize(pool.getMaximumSize());
        request.getOptions().setMinimumIdle(pool.getMinimumIdle());
        request.getOptions().setConnectionTimeoutMs(pool.getConnectionTimeoutMs());
        connections.connect(request);
        String user = connections.getInfo().getUsername();
        context.setDbUser(user != null ? user : "");
        if (schemaCache.isEnabled()) {
            schemaCache.refreshAsync();
        }
    }

    private void loop(Terminal terminal, CliOptions options) throws IOException {
        JLineConsole console = new JLineConsole(terminal);
        PrintStream out = console.out();
        out.println("guardsql connected to " + connections.getInfo().getDisplayTarget()
                + ". Type \\? for help.");

        if (options.isWrite()) {
            processor.startInWriteMode(console);
        }

        Path dataDir = properties.dataPath();
        Files.createDirectories(dataDir);
        DefaultParser parser = new DefaultParser();
        parser.setEscapeChars(new char[0]);
        LineReader reader = LineReaderBuilder.builder()
                .terminal(terminal)
                .appName("guardsql")
                .history(new DefaultHistory())
                .variable(LineReader.HISTORY_FILE, dataDir.resolve("history"))
                .parser(parser)
                .completer(new SchemaCompleter(schemaCache))
                .option(LineReader.Option.DISABLE_EVENT_EXPANSION, true)
                .option(LineReader.Option.CASE_INSENSITIVE, true)
                .build();

        String buffer = "";
        while (true) {
            String line;
            try {
                line = reader.readLine(promptStyle.prompt(stateMachine.promptLabel(), buffer.isEmpty())
                        .toAnsi(terminal));
            } catch (UserInterruptException e) {
                buffer = "";
                continue;
            } catch (EndOfFileException e) {
                if (stateMachine.canQuit()) {
                    break;
                }
                console.err().println(SessionStateMachine.QUIT_REFUSED);
                continue;
            }
            buffer = buffer.isEmpty() ? line : buffer + "\n" + line;
            Submission submission = processor.submit(buffer, console);
            if (submission.isQuit()) {
                break;
            }
            buffer = submission.getRemainder();
        }

        try {
            reader.getHistory().save();
        } catch (IOException e) {
            log.warn("Failed to save line history: error={}", e.getMessage());
        }
        log.info("Session ended: instance_id={}", context.getInstanceId());
    }

    private int exportAudit(Path auditDir, CliOptions options) {
        try {
            int count = exporter.export(auditDir, options.getExportQuery(), options.isPlain(), System.out);
            log.info("Audit exported: dir={}, entries={}", auditDir, count);
            return EXIT_OK;
        } catch (IOException e) {
            errors.report(new PersistenceException("Audit export failed: " + e.getMessage(), e), System.err);
            return EXIT_STARTUP;
        } catch (GuardsqlException e) {
            errors.report(e, System.err);
            return EXIT_STARTUP;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
