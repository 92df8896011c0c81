package com.guardsql.render;

import com.guardsql.util.JdbcValues;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes a result into a new SQLite database as a single table named {@code results}.
 */
public class SqliteWriter {
    static final String TABLE_NAME = "results";

    public void write(ResultTable table, Path path) throws IOException {
        List<String> names = table.columnNames();
        String columns = names.stream().map(SqliteWriter::quote).collect(Collectors.joining(", "));
        String placeholders = names.stream().map(n -> "?").collect(Collectors.joining(", "));
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + path.toAbsolutePath())) {
            conn.setAutoCommit(false);
            try (Statement st = conn.createStatement()) {
                st.execute("CREATE TABLE " + TABLE_NAME + " (" + columns + ")");
            }
            try (PreparedStatement insert = conn.prepareStatement(
                    "INSERT INTO " + TABLE_NAME + " (" + columns + ") VALUES (" + placeholders + ")")) {
                for (Map<String, Object> row : table.getRows()) {
                    for (int i = 0; i < names.size(); i++) {
                        Object value = row.get(names.get(i));
                        if (value == null || value instanceof Number || value instanceof Boolean
                                || value instanceof String) {
                            insert.setObject(i + 1, value);
                        } else {
                            insert.setString(i + 1, JdbcValues.toText(value));
                        }
                    }
                    insert.addBatch();
                }
                insert.executeBatch();
            }
            conn.commit();
        } catch (SQLException e) {
            throw new IOException("Writing SQLite results to " + path + " failed: " + e.getMessage(), e);
        }
    }

    static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
