package com.guardsql.snippet;

import com.guardsql.config.GuardsqlProperties;
import com.guardsql.error.InputException;
import com.guardsql.error.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Named SQL snippets stored as {@code <dir>/<name>.sql}, holding the exact input text.
 */
@Slf4j
@Component
public class SnippetStore {
    static final String NO_DIRECTORY = "No snippets directory configured";
    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_.\\-]+");

    private final Path dir;

    @Autowired
    public SnippetStore(GuardsqlProperties properties) {
        this(properties.snippetsPath());
    }

    public SnippetStore(Path dir) {
        this.dir = dir;
    }

    /**
     * Save text under a name, overwriting any previous snippet.
     *
     * @param name snippet name
     * @param text exact input text
     * @return file written
     */
    public Path save(String name, String text) {
        Path path = path(name);
        try {
            Files.createDirectories(dir);
            Files.writeString(path, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PersistenceException("Cannot save snippet '" + name + "': " + e.getMessage(), e);
        }
        log.info("Snippet saved: name={}, path={}", name, path);
        return path;
    }

    /**
     * Load a snippet's exact text.
     *
     * @param name snippet name
     * @return saved text
     */
    public String load(String name) {
        Path path = path(name);
        if (!Files.isRegularFile(path)) {
            throw new InputException("Snippet '" + name + "' not found");
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PersistenceException("Cannot read snippet '" + name + "': " + e.getMessage(), e);
        }
    }

    private Path path(String name) {
        if (dir == null) {
            throw new PersistenceException(NO_DIRECTORY);
        }
        if (!NAME.matcher(name).matches() || name.startsWith(".")) {
            throw InputException.badArgument(name, "a snippet name of letters, digits, '_', '-' or '.'");
        }
        return dir.resolve(name + ".sql");
    }

    public Path getDir() {
        return dir;
    }
}
