package com.guardsql.history;

import com.guardsql.api.ExecuteResponse;
import com.guardsql.render.ResultTable;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One past query result kept in memory.
 */
@Value
public class StoredResult {
    /** Fixed overhead per row object. */
    static final long ROW_OVERHEAD = 48;
    /** Fixed overhead per cell entry. */
    static final long CELL_OVERHEAD = 32;

    String query;
    List<ExecuteResponse.ColumnDefinition> columns;
    List<Map<String, Object>> rows;
    Instant timestamp;
    Duration duration;
    long estimatedSize;

    public static StoredResult of(String query, ResultTable table, Duration duration) {
        return new StoredResult(query, table.getColumns(), table.getRows(), Instant.now(), duration,
                estimateSize(table));
    }

    public ResultTable toTable() {
        return new ResultTable(columns, rows);
    }

    /**
     * Estimate the in-memory size of a result: two bytes per character of every value and column
     * name, eight bytes per number, plus fixed row and cell overheads.
     *
     * @param table result
     * @return estimated size in bytes
     */
    static long estimateSize(ResultTable table) {
        long size = 0;
        for (ExecuteResponse.ColumnDefinition col : table.getColumns()) {
            size += 2L * col.getName().length();
        }
        for (Map<String, Object> row : table.getRows()) {
            size += ROW_OVERHEAD;
            for (Map.Entry<String, Object> cell : row.entrySet()) {
                size += CELL_OVERHEAD + valueSize(cell.getValue());
            }
        }
        return size;
    }

    private static long valueSize(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof CharSequence) {
            return 2L * ((CharSequence) value).length();
        }
        if (value instanceof Boolean) {
            return 1;
        }
        if (value instanceof Number) {
            return 8;
        }
        if (value instanceof List<?>) {
            long size = 0;
            for (Object elem : (List<?>) value) {
                size += 8 + valueSize(elem);
            }
            return size;
        }
        return 2L * value.toString().length();
    }
}
