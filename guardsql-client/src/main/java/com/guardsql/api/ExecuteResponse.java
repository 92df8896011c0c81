package com.guardsql.api;

import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class ExecuteResponse {
    private String type; // tabular | text
    private DataContent data;
    private Metadata metadata;

    @Data
    public static class DataContent {
        private List<ColumnDefinition> columns;
        /** Column name to value, in column order. */
        private List<Map<String, Object>> rows;
        private String textContent;
    }

    @Data
    public static class ColumnDefinition {
        private String name;
        private String type;
        private String schemaName;
        private String tableName;
    }

    @Data
    public static class Metadata {
        private boolean truncated;
        private long rowsAffected;
        private long durationMicros;
    }

    public boolean isTabular() {
        return "tabular".equals(type);
    }

    public int rowCount() {
        return data != null && data.getRows() != null ? data.getRows().size() : 0;
    }

    public int columnCount() {
        return data != null && data.getColumns() != null ? data.getColumns().size() : 0;
    }
}
