package com.guardsql.snippet;

import com.guardsql.error.InputException;
import com.guardsql.error.PersistenceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnippetStoreTest {
    @TempDir
    Path dir;

    @Test
    void savesExactText() throws Exception {
        SnippetStore store = new SnippetStore(dir.resolve("snippets"));
        String text = "-- top users\nSELECT *\n  FROM users\n WHERE id = ${id} \\gx";

        Path saved = store.save("top-users", text);

        assertEquals(dir.resolve("snippets").resolve("top-users.sql"), saved);
        assertEquals(text, Files.readString(saved));
        assertEquals(text, store.load("top-users"));
    }

    @Test
    void saveOverwrites() {
        SnippetStore store = new SnippetStore(dir);
        store.save("q", "SELECT 1;");
        store.save("q", "SELECT 2;");

        assertEquals("SELECT 2;", store.load("q"));
    }

    @Test
    void missingSnippet() {
        InputException e = assertThrows(InputException.class, () -> new SnippetStore(dir).load("nope"));

        assertEquals("Snippet 'nope' not found", e.getMessage());
    }

    @Test
    void rejectsPathLikeNames() {
        SnippetStore store = new SnippetStore(dir);

        assertThrows(InputException.class, () -> store.save("../escape", "SELECT 1;"));
        assertThrows(InputException.class, () -> store.save(".hidden", "SELECT 1;"));
        assertTrue(store.getDir().equals(dir));
    }

    @Test
    void noDirectory() {
        PersistenceException e = assertThrows(PersistenceException.class,
                () -> new SnippetStore((Path) null).load("q"));

        assertEquals(SnippetStore.NO_DIRECTORY, e.getMessage());
    }
}
