package com.guardsql.render;

import com.guardsql.api.ExecuteResponse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds small result tables for tests.
 */
public final class Tables {

    private Tables() {
    }

    public static ExecuteResponse.ColumnDefinition column(String name, String schema, String table) {
        ExecuteResponse.ColumnDefinition col = new ExecuteResponse.ColumnDefinition();
        col.setName(name);
        col.setType("text");
        col.setSchemaName(schema);
        col.setTableName(table);
        return col;
    }

    /**
     * Table whose rows are given as values in column order.
     *
     * @param names column names
     * @param rows row values
     * @return table
     */
    public static ResultTable of(List<String> names, Object[]... rows) {
        List<ExecuteResponse.ColumnDefinition> columns = new ArrayList<>();
        for (String name : names) {
            columns.add(column(name, null, null));
        }
        return withColumns(columns, rows);
    }

    public static ResultTable withColumns(List<ExecuteResponse.ColumnDefinition> columns, Object[]... rows) {
        List<Map<String, Object>> data = new ArrayList<>();
        for (Object[] values : rows) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i).getName(), values[i]);
            }
            data.add(row);
        }
        return new ResultTable(columns, data);
    }
}
