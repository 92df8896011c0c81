package com.guardsql.render;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guardsql.api.ExecuteResponse;
import com.guardsql.error.InputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultRendererTest {
    private final ResultRenderer renderer = new ResultRenderer(new ObjectMapper());
    private final ResultTable table = Tables.of(List.of("id", "name"),
            new Object[] {1, "ann"},
            new Object[] {22, null});

    @TempDir
    Path dir;

    private String render(ResultTable t, OutputFormat format) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        renderer.render(t, format, out);
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void alignedTable() throws IOException {
        String text = render(table, OutputFormat.TABLE);

        String nl = System.lineSeparator();
        assertEquals(" id | name" + nl + "----+------" + nl + "  1 | ann" + nl + " 22 | NULL" + nl, text);
    }

    @Test
    void expandedRecords() throws IOException {
        String text = render(table, OutputFormat.EXPANDED);

        assertTrue(text.contains("-[ RECORD 1 ]"));
        assertTrue(text.contains("name | ann"));
        assertTrue(text.contains("-[ RECORD 2 ]"));
    }

    @Test
    void csvQuotesAndEmptiesNulls() throws IOException {
        ResultTable t = Tables.of(List.of("id", "note"),
                new Object[] {1, "a,b"},
                new Object[] {2, null});

        String csv = render(t, OutputFormat.CSV);

        assertTrue(csv.startsWith("id,note\n1,\"a,b\"\n2,"));
        assertFalse(csv.contains("NULL"));
    }

    @Test
    void jsonLinesAndEmbeddedJsonColumns() throws IOException {
        ExecuteResponse.ColumnDefinition doc = Tables.column("doc", null, null);
        doc.setType("jsonb");
        ResultTable t = Tables.withColumns(List.of(Tables.column("id", null, null), doc),
                new Object[] {1, "{\"a\":[1,2]}"});

        assertEquals("{\"id\":1,\"doc\":{\"a\":[1,2]}}\n", render(t, OutputFormat.JSON_LINE));
        assertTrue(render(t, OutputFormat.JSON_ARRAY).trim().startsWith("["));
    }

    @Test
    void terminalTruncatesLongResults() throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8);

        assertTrue(renderer.renderToTerminal(table, OutputFormat.TABLE, out, 1, 1));
        String text = buf.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("ann"));
        assertFalse(text.contains("22"));
        assertTrue(text.contains(ResultRenderer.TRUNCATION_NOTICE));
    }

    @Test
    void fileOnlyFormatsNeedPath() {
        PrintStream out = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
        InputException e = assertThrows(InputException.class,
                () -> renderer.renderToTerminal(table, OutputFormat.EXCEL, out, 10, 10));

        assertEquals("format excel requires to=PATH", e.getMessage());
    }

    @Test
    void refusesToOverwrite() throws IOException {
        Path existing = Files.writeString(dir.resolve("out.csv"), "keep");

        InputException e = assertThrows(InputException.class,
                () -> renderer.renderToFile(table, OutputFormat.CSV, existing));
        assertEquals("Output file '" + existing + "' already exists", e.getMessage());
        assertEquals("keep", Files.readString(existing));
    }

    @Test
    void writesExcelFile() throws IOException {
        Path target = dir.resolve("out.xlsx");
        renderer.renderToFile(table, OutputFormat.EXCEL, target);

        assertTrue(Files.size(target) > 0);
    }

    @Test
    void writesSqliteFile() throws Exception {
        Path target = dir.resolve("out.db");
        renderer.renderToFile(table, OutputFormat.SQLITE, target);

        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + target);
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT id, name FROM results ORDER BY id")) {
            assertTrue(rs.next());
            assertEquals(1, rs.getInt(1));
            assertEquals("ann", rs.getString(2));
            assertTrue(rs.next());
            assertNull(rs.getString(2));
            assertFalse(rs.next());
        }
    }
}
