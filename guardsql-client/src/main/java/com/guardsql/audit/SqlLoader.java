package com.guardsql.audit;

import com.guardsql.error.PersistenceException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads the audit store's SQL from {@code /audit/*.sql} on the classpath.
 */
final class SqlLoader {
    private static final Map<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::read);
    }

    /**
     * Load a script and split it into statements on {@code ;}.
     *
     * @param name script name without extension
     * @return statements
     */
    static List<String> statements(String name) {
        List<String> out = new ArrayList<>();
        for (String part : load(name).split(";")) {
            if (!part.isBlank()) {
                out.add(part.trim());
            }
        }
        return out;
    }

    private static String read(String name) {
        String resource = "/audit/" + name + ".sql";
        try (InputStream is = SqlLoader.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new PersistenceException(resource + " not found on classpath");
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + resource, e);
        }
    }
}
