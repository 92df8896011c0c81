package com.guardsql.repl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RedactionSessionTest {
    @TempDir
    Path dir;

    @Test
    void redactsOnDisplayButKeepsHistoryIntact() throws Exception {
        try (TestSession session = new TestSession(dir, "main.users.email")) {
            session.console.answer("seed users");
            session.submit("\\W");
            session.submit("CREATE TABLE users (id INTEGER, email TEXT);");
            session.submit("INSERT INTO users VALUES (1, 'ann@example.com');");
            session.submit("COMMIT;");
            session.submit("\\W");
            assertFalse(session.context.isWriteMode());

            session.submit("\\R");
            assertTrue(session.context.isRedact());
            session.console.clear();

            session.submit("SELECT id, email FROM users;");

            String out = session.console.outText();
            assertTrue(out.contains("[redacted]"));
            assertFalse(out.contains("ann@example.com"));
            assertEquals("ann@example.com", session.history.resolve(null).getRows().get(0).get("email"));

            session.console.clear();
            session.submit("\\re show");
            assertFalse(session.console.outText().contains("ann@example.com"));
        }
    }
}
