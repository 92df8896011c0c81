package com.guardsql.redaction;

import com.guardsql.api.ExecuteResponse;
import com.guardsql.error.InputException;
import com.guardsql.render.ResultTable;
import com.guardsql.render.Tables;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RedactionEngineTest {
    private final RedactionEngine engine = new RedactionEngine(List.of(
            RedactionRule.parse("public.users.email"),
            RedactionRule.parse("hr.people.ssn")));

    @Test
    void redactsMatchingColumnsOnly() {
        ResultTable table = Tables.withColumns(List.of(
                        Tables.column("id", "public", "users"),
                        Tables.column("email", "public", "users")),
                new Object[] {1, "a@x"},
                new Object[] {2, null});

        ResultTable redacted = engine.apply(table);

        assertEquals(1, redacted.getRows().get(0).get("id"));
        assertEquals(RedactionEngine.REDACTED, redacted.getRows().get(0).get("email"));
        assertEquals(RedactionEngine.REDACTED, redacted.getRows().get(1).get("email"));
        assertEquals("a@x", table.getRows().get(0).get("email"));
    }

    @Test
    void matchesByNameWhenDriverOmitsTable() {
        ExecuteResponse.ColumnDefinition computed = Tables.column("EMAIL", null, null);

        assertTrue(RedactionRule.parse("public.users.email").matches(computed));
        assertFalse(RedactionRule.parse("public.users.email").matches(Tables.column("email", "public", "orders")));
        assertFalse(RedactionRule.parse("public.users.email").matches(Tables.column("email", "hr", "users")));
    }

    @Test
    void firstDeclaredRuleWins() {
        RedactionRule first = RedactionRule.parse("a.t.c");
        RedactionEngine twoRules = new RedactionEngine(List.of(first, RedactionRule.parse("b.t.c")));

        assertSame(first, twoRules.ruleFor(Tables.column("c", null, "t")));
    }

    @Test
    void untouchedTableIsReturnedAsIs() {
        ResultTable table = Tables.of(List.of("id"), new Object[] {1});

        assertSame(table, engine.apply(table));
    }

    @Test
    void availability() {
        assertTrue(engine.isAvailable());
        assertFalse(new RedactionEngine(List.<RedactionRule>of()).isAvailable());
    }

    @Test
    void ruleSyntax() {
        assertThrows(InputException.class, () -> RedactionRule.parse("users.email"));
        assertThrows(InputException.class, () -> RedactionRule.parse("a..c"));
        assertEquals("s.t.c", RedactionRule.parse(" s.t.c ").toString());
    }
}
