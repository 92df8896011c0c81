package com.guardsql.render;

import com.guardsql.error.InputException;

import java.util.Locale;

/**
 * Result output formats. Excel and SQLite produce binary files and need a destination path.
 */
public enum OutputFormat {
    TABLE(false),
    EXPANDED(false),
    JSON_LINE(false),
    JSON_ARRAY(false),
    CSV(false),
    EXCEL(true),
    SQLITE(true);

    static final String EXPECTED = "table, expanded, json, json-line, json-array, csv, excel, sqlite";

    private final boolean fileOnly;

    OutputFormat(boolean fileOnly) {
        this.fileOnly = fileOnly;
    }

    public boolean isFileOnly() {
        return fileOnly;
    }

    /**
     * Parse a format name as typed in {@code \re show format=...}.
     *
     * @param name format name
     * @return format
     */
    public static OutputFormat fromName(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "table":
                return TABLE;
            case "expanded":
                return EXPANDED;
            case "json-line":
            case "jsonl":
                return JSON_LINE;
            case "json":
            case "json-array":
                return JSON_ARRAY;
            case "csv":
                return CSV;
            case "excel":
            case "xlsx":
                return EXCEL;
            case "sqlite":
                return SQLITE;
            default:
                throw InputException.badArgument(name, EXPECTED);
        }
    }

    public String displayName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
