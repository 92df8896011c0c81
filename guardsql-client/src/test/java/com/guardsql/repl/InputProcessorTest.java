package com.guardsql.repl;

import com.guardsql.audit.AuditEntry;
import com.guardsql.history.StoredResult;
import com.guardsql.model.Theme;
import com.guardsql.service.SessionStateMachine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InputProcessorTest {
    @TempDir
    Path dir;

    private TestSession session;

    @BeforeEach
    void open() throws Exception {
        session = new TestSession(dir);
    }

    @AfterEach
    void close() {
        session.close();
    }

    private static int firstValue(StoredResult result, String column) {
        return ((Number) result.getRows().get(0).get(column)).intValue();
    }

    @Test
    void variablesAreInterpolatedAndRawTextIsAudited() {
        Submission submission = session.submit("\\set x 5\nSELECT ${x} AS v;");

        assertFalse(submission.isQuit());
        assertEquals("", submission.getRemainder());
        assertEquals(5, firstValue(session.history.resolve(null), "v"));
        assertTrue(session.console.outText().contains("(1 row, took "));

        List<AuditEntry> entries = session.auditEntries();
        assertEquals(2, entries.size());
        assertTrue(entries.get(0).getQuery().startsWith("\\set x 5"));
        assertEquals("SELECT ${x} AS v;", entries.get(1).getQuery());
        assertEquals(AuditEntry.OK, entries.get(1).getOutcome());
        assertEquals(session.context.getInstanceId(), entries.get(1).getInstanceId());
    }

    @Test
    void unboundVariableIsNotSent() {
        session.submit("SELECT ${nope};");

        assertTrue(session.console.errText().contains("INPUT_ERROR: Variable 'nope' is not set"));
        assertEquals(0, session.history.size());
        assertEquals("ERROR: INPUT_ERROR: Variable 'nope' is not set", session.lastAudit().getOutcome());
    }

    @Test
    void verbatimSkipsInterpolation() {
        session.submit("SELECT '${x}' AS v \\gv");

        assertEquals("${x}", session.history.resolve(null).getRows().get(0).get("v"));
    }

    @Test
    void unterminatedInputStaysBuffered() {
        Submission submission = session.submit("SELECT 1\nFROM");

        assertEquals("SELECT 1\nFROM", submission.getRemainder());
        assertTrue(session.auditEntries().isEmpty());
    }

    @Test
    void writeModeGuardsQuit() {
        session.console.answer("ticket 1");
        session.submit("\\W");
        assertTrue(session.console.outText().contains(SessionStateMachine.WRITE_BANNER));
        assertEquals("Justification? ", session.console.prompts.get(0));

        session.submit("CREATE TABLE t (id INTEGER);");
        assertTrue(session.console.outText().contains("CREATE TABLE"));
        AuditEntry create = session.lastAudit();
        assertTrue(create.isWritemode());
        assertEquals("ticket 1", create.getJustification());

        Submission refused = session.submit("\\q");
        assertFalse(refused.isQuit());
        assertTrue(session.console.errText().contains(SessionStateMachine.QUIT_REFUSED));
        assertEquals("ERROR: INPUT_ERROR: " + SessionStateMachine.QUIT_REFUSED, session.lastAudit().getOutcome());

        session.submit("COMMIT;");
        assertTrue(session.submit("\\q").isQuit());
    }

    @Test
    void blankJustificationKeepsReadOnly() {
        session.console.answer("   ");
        session.submit("\\W");

        assertFalse(session.context.isWriteMode());
        assertTrue(session.console.errText().contains(SessionStateMachine.JUSTIFICATION_REQUIRED));
    }

    @Test
    void startupWriteModeIsAuditedWithJustification() {
        session.console.answer("ticket 88");
        session.processor.startInWriteMode(session.console);

        assertTrue(session.context.isWriteMode());
        assertTrue(session.console.outText().contains(SessionStateMachine.WRITE_BANNER));
        AuditEntry entry = session.lastAudit();
        assertEquals(InputProcessor.STARTUP_WRITE, entry.getQuery());
        assertEquals(AuditEntry.OK, entry.getOutcome());
        assertTrue(entry.isWritemode());
        assertEquals("ticket 88", entry.getJustification());
    }

    @Test
    void rejectedStartupJustificationIsAudited() {
        session.console.answer("");
        session.processor.startInWriteMode(session.console);

        assertFalse(session.context.isWriteMode());
        AuditEntry entry = session.lastAudit();
        assertEquals(InputProcessor.STARTUP_WRITE, entry.getQuery());
        assertEquals("ERROR: INPUT_ERROR: " + SessionStateMachine.JUSTIFICATION_REQUIRED, entry.getOutcome());
        assertFalse(entry.isWritemode());
    }

    @Test
    void debugReportsSessionSettings() {
        session.context.setTheme(Theme.LIGHT);
        session.submit("\\debug");

        assertTrue(session.console.outText().contains("state: READ_ONLY"));
        assertTrue(session.console.outText().contains("theme: light"));
    }

    @Test
    void gsetCapturesSingleRow() {
        session.submit("SELECT 7 AS a, 'x' AS b \\gset p_");

        assertEquals(Optional.of("7"), session.context.getVariables().get("p_a"));
        assertEquals(Optional.of("x"), session.context.getVariables().get("p_b"));

        session.submit("SELECT 1 AS a UNION ALL SELECT 2 \\gset");
        assertTrue(session.console.errText().contains(InputProcessor.GSET_ONE_ROW));
        assertFalse(session.context.getVariables().get("a").isPresent());
    }

    @Test
    void suppressedOutputStillRecordsHistory() {
        session.submit("SELECT 1 AS a \\gz");

        assertEquals("", session.console.outText());
        assertEquals(1, session.history.size());
    }

    @Test
    void queryToFileRefusesExistingTarget() throws Exception {
        Path out = dir.resolve("out.txt");
        session.submit("SELECT 42 AS answer \\go " + out);

        assertTrue(Files.readString(out).contains("answer"));
        assertTrue(session.console.outText().contains("Wrote 1 rows to " + out));

        session.submit("SELECT 43 AS answer \\go " + out);
        assertTrue(session.console.errText().contains("Output file '" + out + "' already exists"));
        assertEquals(1, session.history.size());
    }

    @Test
    void outputRedirectCapturesResults() throws Exception {
        Path out = dir.resolve("redirect.txt");
        session.submit("\\o " + out);
        session.submit("SELECT 42 AS answer;");
        session.submit("\\o");

        assertFalse(session.console.outText().contains("answer"));
        assertTrue(Files.readString(out).contains("answer"));
        assertEquals(null, session.context.getOutputPath());
    }

    @Test
    void snippetRunBindsTemporarily() {
        session.submit("\\set n 1\nSELECT ${n} AS n;");
        session.submit("\\snip save q");
        assertTrue(session.console.outText().contains("Snippet 'q' saved to "));

        session.submit("\\snip run q n=3");

        assertEquals(3, firstValue(session.history.resolve(null), "n"));
        assertEquals(Optional.of("1"), session.context.getVariables().get("n"));
    }

    @Test
    void snippetSavedInOneSessionRunsIdenticallyInTheNext() throws Exception {
        String query = "SELECT ${n} AS n,\n       'a;b' AS s \\gx";
        session.submit("\\set n 1\n" + query);
        session.submit("\\snip save pair");
        String firstInstance = session.context.getInstanceId();
        session.close();

        session = new TestSession(dir);
        session.submit("\\snip run pair n=2");

        StoredResult result = session.history.resolve(null);
        assertEquals(2, firstValue(result, "n"));
        assertEquals("a;b", result.getRows().get(0).get("s"));
        List<AuditEntry> entries = session.auditEntries();
        String saved = entries.stream()
                .filter(e -> firstInstance.equals(e.getInstanceId()) && e.getQuery().startsWith("SELECT"))
                .findFirst().orElseThrow().getQuery();
        String replayed = entries.stream()
                .filter(e -> session.context.getInstanceId().equals(e.getInstanceId()) && e.getQuery().startsWith("SELECT"))
                .findFirst().orElseThrow().getQuery();
        assertEquals(query, saved);
        assertEquals(saved, replayed);
        assertFalse(session.context.getVariables().get("n").isPresent());
    }

    @Test
    void includeReportsTrailingStatement() throws Exception {
        Path script = Files.writeString(dir.resolve("script.sql"), "SELECT 2 AS two;\nSELECT 3");
        session.submit("\\i " + script);

        assertEquals(1, session.history.size());
        assertTrue(session.console.errText()
                .contains("Unterminated statement at end of " + script + " was not run"));
        List<AuditEntry> entries = session.auditEntries();
        assertEquals("SELECT 2 AS two;", entries.get(0).getQuery());
        assertTrue(entries.get(1).getQuery().startsWith("\\i "));
    }

    @Test
    void resultHistoryCommands() throws Exception {
        session.submit("SELECT 1 AS a, 2 AS b;");
        session.submit("SELECT 3 AS c;");
        session.console.clear();

        session.submit("\\re list");
        assertTrue(session.console.outText().startsWith("Past query results (2 of 2):"));

        Path csv = dir.resolve("first.csv");
        session.submit("\\re show n=0 only=b format=csv to=" + csv);
        assertEquals("b\n2\n", Files.readString(csv));
    }

    @Test
    void copyIsRejected() {
        session.submit("\\copy t to 'x.csv'");

        assertTrue(session.console.errText().contains(MetacommandDispatcher.COPY_UNSUPPORTED));
    }

    @Test
    void expandedToggle() {
        session.submit("\\x");

        assertTrue(session.context.isExpanded());
        assertTrue(session.console.outText().contains("Expanded display is on."));
    }

    @Test
    void redactionWithoutRules() {
        session.submit("\\R");

        assertFalse(session.context.isRedact());
        assertTrue(session.console.outText().contains("Redaction mode is not available"));
    }
}
