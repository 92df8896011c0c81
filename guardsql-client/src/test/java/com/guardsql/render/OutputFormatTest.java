package com.guardsql.render;

import com.guardsql.error.InputException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutputFormatTest {

    @Test
    void namesAndAliases() {
        assertEquals(OutputFormat.JSON_ARRAY, OutputFormat.fromName("JSON"));
        assertEquals(OutputFormat.JSON_LINE, OutputFormat.fromName("jsonl"));
        assertEquals(OutputFormat.EXCEL, OutputFormat.fromName("xlsx"));
        assertEquals("json-line", OutputFormat.JSON_LINE.displayName());
    }

    @Test
    void binaryFormatsAreFileOnly() {
        assertTrue(OutputFormat.SQLITE.isFileOnly());
        assertTrue(OutputFormat.EXCEL.isFileOnly());
        assertFalse(OutputFormat.CSV.isFileOnly());
    }

    @Test
    void unknownName() {
        InputException e = assertThrows(InputException.class, () -> OutputFormat.fromName("yaml"));

        assertTrue(e.getMessage().startsWith("Invalid argument 'yaml'. Expected: table,"));
    }
}
