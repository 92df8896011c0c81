package com.guardsql.repl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guardsql.config.GuardsqlProperties;
import com.guardsql.error.InputException;
import com.guardsql.render.OutputFormat;
import com.guardsql.render.ResultRenderer;
import com.guardsql.render.ResultTable;
import com.guardsql.render.Tables;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultDisplayTest {
    private final GuardsqlProperties properties = new GuardsqlProperties();
    private final OutputRedirect redirect = new OutputRedirect();
    private final ResultDisplay display =
            new ResultDisplay(new ResultRenderer(new ObjectMapper()), redirect, properties);
    private final StreamConsole console = new StreamConsole();

    @TempDir
    Path dir;

    @AfterEach
    void reset() {
        redirect.close();
    }

    private static ResultTable rows(int n) {
        List<Object[]> values = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            values.add(new Object[] {i});
        }
        return Tables.of(List.of("i"), values.toArray(new Object[0][]));
    }

    @Test
    void statusLine() {
        assertEquals("(1 row, took 2.00 ms)", ResultDisplay.status(1, Duration.ofMillis(2)));
        assertEquals("(3 rows, took 2.00 ms)", ResultDisplay.status(3, Duration.ofMillis(2)));
    }

    @Test
    void longResultsAreTruncatedOnTerminal() {
        properties.getExecute().setDisplayRowLimit(5);
        properties.getExecute().setDisplayTruncatedRows(2);

        display.show(rows(10), OutputFormat.TABLE, console, true, "(10 rows)");

        String out = console.outText();
        assertTrue(out.contains(ResultRenderer.TRUNCATION_NOTICE));
        assertTrue(out.contains("(10 rows)"));
    }

    @Test
    void redirectedResultsAreNeverTruncated() throws Exception {
        properties.getExecute().setDisplayRowLimit(5);
        Path target = dir.resolve("out.txt");
        redirect.redirectTo(target);

        display.show(rows(10), OutputFormat.TABLE, console, true, null);
        redirect.reset();

        assertEquals("", console.outText());
        String written = Files.readString(target);
        assertFalse(written.contains(ResultRenderer.TRUNCATION_NOTICE));
        assertEquals(12, written.split("\n").length);
    }

    @Test
    void statusOnlyForTextLayouts() {
        display.show(rows(1), OutputFormat.CSV, console, true, "(1 row)");

        assertFalse(console.outText().contains("(1 row)"));
    }

    @Test
    void binaryFormatNeedsPath() {
        InputException e = assertThrows(InputException.class,
                () -> display.show(rows(1), OutputFormat.SQLITE, console, true, null));

        assertEquals("format sqlite requires to=PATH", e.getMessage());
    }
}
