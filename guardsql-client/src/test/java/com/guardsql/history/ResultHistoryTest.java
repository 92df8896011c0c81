package com.guardsql.history;

import com.guardsql.error.InputException;
import com.guardsql.render.ResultTable;
import com.guardsql.render.Tables;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultHistoryTest {

    /** One column {@code v}, one row holding a string of the given length. */
    private static StoredResult result(String query, int chars) {
        ResultTable table = Tables.of(List.of("v"), new Object[] {"x".repeat(chars)});
        return StoredResult.of(query, table, Duration.ofMillis(5));
    }

    @Test
    void estimateCountsCharactersAndOverheads() {
        // 2 for the column name, 48 per row, 32 per cell, 2 per character.
        assertEquals(2 + 48 + 32 + 20, result("q", 10).getEstimatedSize());
    }

    @Test
    void evictsOldestUntilNewEntryFits() {
        long each = result("q", 100).getEstimatedSize();
        ResultHistory history = new ResultHistory(each * 2);
        history.push(result("first", 100));
        history.push(result("second", 100));
        history.push(result("third", 100));

        assertEquals(2, history.size());
        assertEquals("second", history.resolve(0).getQuery());
        assertEquals("third", history.resolve(null).getQuery());
        assertTrue(history.totalSize() <= history.maxSize());
    }

    @Test
    void oversizedEntryIsStillKept() {
        ResultHistory history = new ResultHistory(50);
        history.push(result("small", 0));
        history.push(result("huge", 1000));

        assertEquals(1, history.size());
        assertEquals("huge", history.resolve(null).getQuery());
        assertTrue(history.totalSize() > history.maxSize());
    }

    @Test
    void resolveReportsMissingEntries() {
        ResultHistory history = new ResultHistory(1024);
        assertThrows(InputException.class, () -> history.resolve(null));

        history.push(result("only", 1));
        InputException e = assertThrows(InputException.class, () -> history.resolve(3));
        assertEquals("No result with index 3 (history holds 1)", e.getMessage());
    }

    @Test
    void listing() {
        ResultHistory history = new ResultHistory(1024 * 1024);
        assertEquals("Nothing yet\n", history.list(null, false));

        history.push(result("SELECT   a\n FROM b", 3));
        history.push(result("SELECT 2", 3));
        String brief = history.list(1, false);
        assertTrue(brief.startsWith("Past query results (1 of 2):"));
        assertTrue(brief.contains("Memory limit: "));
        assertFalse(brief.contains("SELECT"));

        String detail = history.list(null, true);
        assertTrue(detail.contains("SELECT a FROM b"));
    }

    @Test
    void previewCollapsesAndTruncates() {
        assertEquals("a b", ResultHistory.preview(" a \n b "));
        assertEquals("y".repeat(50) + "...", ResultHistory.preview("y".repeat(60)));
    }
}
