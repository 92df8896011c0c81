package com.guardsql.util;

import lombok.extern.slf4j.Slf4j;
import org.postgresql.util.PGobject;

import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.sql.Struct;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Converts JDBC driver values into plain Java values (String, Number, Boolean, List) that every
 * renderer and the result history can handle without driver classes.
 */
@Slf4j
public final class JdbcValues {
    private static final int MAX_LOB_CHARS = 1_000_000;
    private static final int MAX_BLOB_BYTES = 1_000_000;
    private static final int MAX_NESTED_DEPTH = 3;
    static final String UNREADABLE_PLACEHOLDER = "(unreadable)";

    private JdbcValues() {
    }

    /**
     * Reads a column value and returns a plain equivalent.
     *
     * @param rs result set
     * @param columnIndex 1-based column index
     * @return plain value, or null for SQL NULL
     * @throws SQLException if the row cannot be read at all
     */
    public static Object read(ResultSet rs, int columnIndex) throws SQLException {
        Object v = rs.getObject(columnIndex);
        try {
            return toPlain(v, 0);
        } catch (SQLException | RuntimeException e) {
            log.debug("Value conversion failed: column={}, type={}, error={}", columnIndex,
                    v == null ? "null" : v.getClass().getName(), e.getMessage());
            return UNREADABLE_PLACEHOLDER;
        }
    }

    static Object toPlain(Object v, int depth) throws SQLException {
        if (v == null) {
            return null;
        }
        if (depth > MAX_NESTED_DEPTH) {
            return String.valueOf(v);
        }
        if (v instanceof Number || v instanceof Boolean || v instanceof String) {
            return v;
        }
        if (v instanceof PGobject pg) {
            return pg.getValue();
        }
        if (v instanceof Clob clob) {
            long length = clob.length();
            return length <= 0 ? "" : clob.getSubString(1, (int) Math.min(length, MAX_LOB_CHARS));
        }
        if (v instanceof Blob blob) {
            long length = blob.length();
            return length <= 0 ? "\\x" : hex(blob.getBytes(1, (int) Math.min(length, MAX_BLOB_BYTES)));
        }
        if (v instanceof byte[] bytes) {
            return hex(bytes);
        }
        if (v instanceof SQLXML xml) {
            return xml.getString();
        }
        if (v instanceof java.sql.Array arr) {
            Object arrayValue = arr.getArray();
            if (arrayValue instanceof Object[] objectArray) {
                List<Object> out = new ArrayList<>(objectArray.length);
                for (Object elem : objectArray) {
                    out.add(toPlain(elem, depth + 1));
                }
                return out;
            }
            return String.valueOf(arrayValue);
        }
        if (v instanceof Struct struct) {
            Object[] attrs = struct.getAttributes();
            List<Object> out = new ArrayList<>();
            if (attrs != null) {
                for (Object attr : attrs) {
                    out.add(toPlain(attr, depth + 1));
                }
            }
            return out;
        }
        // Dates, times, UUIDs, intervals, and anything else driver-specific.
        return v.toString();
    }

    private static String hex(byte[] bytes) {
        return "\\x" + HexFormat.of().formatHex(bytes);
    }

    /**
     * Render a plain value as display text; SQL NULL becomes {@code NULL}.
     *
     * @param value plain value
     * @return text
     */
    public static String toText(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof List<?> list) {
            StringBuilder sb = new StringBuilder("{");
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                sb.append(toText(list.get(i)));
            }
            return sb.append('}').toString();
        }
        return value.toString();
    }
}
