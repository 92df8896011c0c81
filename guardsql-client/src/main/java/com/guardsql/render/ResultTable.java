package com.guardsql.render;

import com.guardsql.api.ExecuteResponse;
import com.guardsql.error.InputException;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Columns plus ordered rows, as handed to the writers.
 */
@Value
public class ResultTable {
    List<ExecuteResponse.ColumnDefinition> columns;
    List<Map<String, Object>> rows;

    public static ResultTable of(ExecuteResponse response) {
        ExecuteResponse.DataContent data = response.getData();
        if (data == null || data.getColumns() == null) {
            return new ResultTable(Collections.emptyList(), Collections.emptyList());
        }
        return new ResultTable(data.getColumns(), data.getRows() != null ? data.getRows() : Collections.emptyList());
    }

    public List<String> columnNames() {
        return columns.stream().map(ExecuteResponse.ColumnDefinition::getName).collect(Collectors.toList());
    }

    /**
     * Keep only the named columns, in the order given.
     *
     * @param names column names; empty keeps all
     * @return projected table
     */
    public ResultTable project(List<String> names) {
        if (names == null || names.isEmpty()) {
            return this;
        }
        List<ExecuteResponse.ColumnDefinition> kept = new ArrayList<>();
        for (String name : names) {
            ExecuteResponse.ColumnDefinition found = columns.stream()
                    .filter(c -> c.getName().equals(name))
                    .findFirst()
                    .orElseThrow(() -> InputException.badArgument(name, "one of " + String.join(", ", columnNames())));
            kept.add(found);
        }
        List<Map<String, Object>> projected = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (ExecuteResponse.ColumnDefinition col : kept) {
                out.put(col.getName(), row.get(col.getName()));
            }
            projected.add(out);
        }
        return new ResultTable(kept, projected);
    }

    /**
     * Select a window of rows.
     *
     * @param offset rows to skip
     * @param limit maximum rows, 0 for all remaining
     * @return sliced table
     */
    public ResultTable slice(int offset, int limit) {
        int from = Math.min(Math.max(offset, 0), rows.size());
        int to = limit > 0 ? Math.min(rows.size(), from + limit) : rows.size();
        return new ResultTable(columns, rows.subList(from, to));
    }
}
