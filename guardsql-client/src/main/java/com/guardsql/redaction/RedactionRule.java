package com.guardsql.redaction;

import com.guardsql.api.ExecuteResponse;
import com.guardsql.error.InputException;
import lombok.Value;

/**
 * A {@code schema.table.column} to hide from output.
 */
@Value
public class RedactionRule {
    String schema;
    String table;
    String column;

    public static RedactionRule parse(String text) {
        String[] parts = text.trim().split("\\.");
        if (parts.length != 3 || parts[0].isEmpty() || parts[1].isEmpty() || parts[2].isEmpty()) {
            throw InputException.badArgument(text, "schema.table.column");
        }
        return new RedactionRule(parts[0], parts[1], parts[2]);
    }

    /**
     * Match a result column. Table and schema are compared only when the driver reported them.
     *
     * @param column result column
     * @return true if the column is covered by this rule
     */
    public boolean matches(ExecuteResponse.ColumnDefinition column) {
        if (!column.getName().equalsIgnoreCase(this.column)) {
            return false;
        }
        if (column.getTableName() != null && !column.getTableName().equalsIgnoreCase(table)) {
            return false;
        }
        return column.getSchemaName() == null || column.getSchemaName().equalsIgnoreCase(schema);
    }

    @Override
    public String toString() {
        return schema + "." + table + "." + column;
    }
}
