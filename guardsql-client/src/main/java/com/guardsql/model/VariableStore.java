package com.guardsql.model;

import com.guardsql.util.GlobPattern;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Session-scoped variables used by {@code ${name}} interpolation. Never persisted.
 */
public class VariableStore {
    private final Map<String, String> values = new HashMap<>();

    public void set(String name, String value) {
        values.put(name, value);
    }

    /**
     * Set a variable only if it is not already bound.
     *
     * @param name variable name
     * @param value default value
     * @return true if the value was stored
     */
    public boolean setDefault(String name, String value) {
        return values.putIfAbsent(name, value) == null;
    }

    public boolean unset(String name) {
        return values.remove(name) != null;
    }

    public Optional<String> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * List variables sorted by name, optionally filtered by a glob pattern.
     *
     * @param pattern glob pattern or null for all
     * @return sorted view
     */
    public Map<String, String> list(String pattern) {
        Map<String, String> sorted = new TreeMap<>();
        GlobPattern glob = pattern == null || pattern.isBlank() ? null : GlobPattern.compile(pattern);
        for (Map.Entry<String, String> entry : values.entrySet()) {
            if (glob == null || glob.matches(entry.getKey())) {
                sorted.put(entry.getKey(), entry.getValue());
            }
        }
        return Collections.unmodifiableMap(sorted);
    }
}
