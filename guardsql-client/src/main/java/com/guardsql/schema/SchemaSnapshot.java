package com.guardsql.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Immutable catalog names used for completion.
 */
@Value
@Builder(toBuilder = true)
public class SchemaSnapshot {
    @Singular
    List<String> schemas;
    /** schema to table names */
    @Singular
    Map<String, List<String>> tables;
    /** schema to view names */
    @Singular
    Map<String, List<String>> views;
    /** {@code schema.table} to column names */
    @Singular
    Map<String, List<String>> columns;
    @Singular
    List<String> functions;
    Instant loadedAt;

    public static SchemaSnapshot empty() {
        return SchemaSnapshot.builder().loadedAt(Instant.EPOCH).build();
    }

    public boolean isEmpty() {
        return schemas.isEmpty() && tables.isEmpty() && views.isEmpty() && columns.isEmpty() && functions.isEmpty();
    }

    /**
     * Columns of a table, looked up as given, then in {@code public}, then in every schema.
     *
     * @param table table name, optionally schema-qualified
     * @return column names, empty if unknown
     */
    public List<String> columnsFor(String table) {
        List<String> direct = columns.get(table);
        if (direct != null) {
            return direct;
        }
        List<String> inPublic = columns.get("public." + table);
        if (inPublic != null) {
            return inPublic;
        }
        for (String schema : schemas) {
            List<String> found = columns.get(schema + "." + table);
            if (found != null) {
                return found;
            }
        }
        return List.of();
    }

    /**
     * Every distinct name a completion may offer: schemas, relations, columns and functions.
     *
     * @return sorted candidate words
     */
    public List<String> words() {
        TreeSet<String> words = new TreeSet<>(schemas);
        addAll(words, tables.values());
        addAll(words, views.values());
        addAll(words, columns.values());
        words.addAll(functions);
        return new ArrayList<>(words);
    }

    private static void addAll(TreeSet<String> words, Collection<List<String>> lists) {
        for (List<String> list : lists) {
            words.addAll(list);
        }
    }
}
