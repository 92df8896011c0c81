package com.guardsql.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.guardsql.api.ExecuteResponse;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * JSON output: either one compact object per row and line, or one pretty-printed array.
 * Values of {@code json} and {@code jsonb} columns are embedded as JSON, not as strings.
 */
public class JsonWriter implements ResultWriter {
    private final ObjectMapper objectMapper;
    private final boolean array;

    public JsonWriter(ObjectMapper objectMapper, boolean array) {
        this.objectMapper = objectMapper;
        this.array = array;
    }

    @Override
    public void write(ResultTable table, OutputStream out) throws IOException {
        if (array) {
            ArrayNode nodes = objectMapper.createArrayNode();
            for (Map<String, Object> row : table.getRows()) {
                nodes.add(toNode(table, row));
            }
            out.write(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(nodes));
            out.write('\n');
        } else {
            for (Map<String, Object> row : table.getRows()) {
                out.write(objectMapper.writeValueAsBytes(toNode(table, row)));
                out.write('\n');
            }
        }
        out.flush();
    }

    ObjectNode toNode(ResultTable table, Map<String, Object> row) {
        ObjectNode node = objectMapper.createObjectNode();
        for (ExecuteResponse.ColumnDefinition col : table.getColumns()) {
            Object value = row.get(col.getName());
            if (value instanceof String && isJsonType(col.getType())) {
                node.set(col.getName(), parseOrText((String) value));
            } else {
                node.set(col.getName(), objectMapper.valueToTree(value));
            }
        }
        return node;
    }

    private JsonNode parseOrText(String value) {
        try {
            return objectMapper.readTree(value.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            return objectMapper.getNodeFactory().textNode(value);
        }
    }

    private static boolean isJsonType(String type) {
        if (type == null) {
            return false;
        }
        String t = type.toLowerCase(Locale.ROOT);
        return "json".equals(t) || "jsonb".equals(t);
    }
}
