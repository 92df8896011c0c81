package com.guardsql.render;

import com.guardsql.error.InputException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultTableTest {
    private final ResultTable table = Tables.of(List.of("id", "name", "email"),
            new Object[] {1, "ann", "a@x"},
            new Object[] {2, "bob", "b@x"},
            new Object[] {3, "cy", null});

    @Test
    void projectKeepsRequestedOrder() {
        ResultTable projected = table.project(List.of("email", "id"));

        assertEquals(List.of("email", "id"), projected.columnNames());
        assertEquals(List.of("email", "id"), List.copyOf(projected.getRows().get(0).keySet()));
        assertEquals("a@x", projected.getRows().get(0).get("email"));
    }

    @Test
    void projectUnknownColumnFails() {
        InputException e = assertThrows(InputException.class, () -> table.project(List.of("phone")));

        assertTrue(e.getMessage().contains("'phone'"));
    }

    @Test
    void sliceWindows() {
        assertEquals(2, table.slice(1, 0).getRows().size());
        assertEquals("bob", table.slice(1, 1).getRows().get(0).get("name"));
        assertTrue(table.slice(10, 5).getRows().isEmpty());
        assertEquals(3, table.project(List.of()).getColumns().size());
    }
}
