package com.guardsql.repl;

import com.guardsql.api.ErrorResponse;
import com.guardsql.audit.AuditEntry;
import com.guardsql.error.InputException;
import com.guardsql.error.QueryCancelledException;
import com.guardsql.error.StatementException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ErrorReporterTest {
    private final ErrorReporter reporter = new ErrorReporter();
    private final ByteArrayOutputStream buf = new ByteArrayOutputStream();
    private final PrintStream err = new PrintStream(buf, true, StandardCharsets.UTF_8);

    @AfterEach
    void clearTrace() {
        TraceIds.end();
    }

    private String printed() {
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void statementErrorCarriesServerDiagnostics() {
        StatementException e = new StatementException("relation \"nope\" does not exist", "42P01", 0,
                null, "Check the name", 15, null);

        reporter.report(e, err);

        String nl = System.lineSeparator();
        assertEquals("DATABASE_ERROR: relation \"nope\" does not exist" + nl
                + "SQLSTATE 42P01\nHINT: Check the name\nPOSITION: 15" + nl, printed());
    }

    @Test
    void inputErrorIsOneLine() {
        reporter.report(new InputException("Variable 'x' is not set"), err);

        assertEquals("INPUT_ERROR: Variable 'x' is not set" + System.lineSeparator(), printed());
    }

    @Test
    void cancellationPrintsOnlyItsMessage() {
        reporter.report(new QueryCancelledException(), err);

        assertEquals("Query cancelled." + System.lineSeparator(), printed());
    }

    @Test
    void unexpectedFailureShowsTraceId() {
        String traceId = TraceIds.begin();

        ErrorResponse response = reporter.report(new IllegalStateException("boom"), err);

        assertEquals("INTERNAL_ERROR", response.getCode());
        assertEquals(traceId, response.getTraceId());
        assertTrue(printed().contains("An unexpected error occurred"));
        assertTrue(printed().contains("trace_id: " + traceId));
    }

    @Test
    void auditOutcomes() {
        assertEquals(AuditEntry.CANCELLED, ErrorReporter.outcome(new QueryCancelledException()));
        assertEquals("ERROR: INPUT_ERROR: bad", ErrorReporter.outcome(new InputException("bad")));
        assertEquals("ERROR: INTERNAL_ERROR: boom", ErrorReporter.outcome(new IllegalStateException("boom")));
    }
}
