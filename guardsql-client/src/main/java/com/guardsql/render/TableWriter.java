package com.guardsql.render;

import com.guardsql.util.JdbcValues;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Aligned text table with a header rule, one line per row.
 */
public class TableWriter implements ResultWriter {

    @Override
    public void write(ResultTable table, OutputStream out) throws IOException {
        PrintWriter writer = new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        List<String> names = table.columnNames();
        int[] widths = new int[names.size()];
        for (int i = 0; i < names.size(); i++) {
            widths[i] = names.get(i).length();
        }
        for (Map<String, Object> row : table.getRows()) {
            for (int i = 0; i < names.size(); i++) {
                widths[i] = Math.max(widths[i], cell(row.get(names.get(i))).length());
            }
        }

        StringBuilder header = new StringBuilder();
        StringBuilder rule = new StringBuilder();
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) {
                header.append('|');
                rule.append('+');
            }
            header.append(' ').append(center(names.get(i), widths[i])).append(' ');
            rule.append("-".repeat(widths[i] + 2));
        }
        writer.println(header.toString().stripTrailing());
        writer.println(rule);

        for (Map<String, Object> row : table.getRows()) {
            StringBuilder line = new StringBuilder();
            for (int i = 0; i < names.size(); i++) {
                if (i > 0) {
                    line.append('|');
                }
                Object value = row.get(names.get(i));
                String text = cell(value);
                String padded = value instanceof Number
                        ? String.format("%" + widths[i] + "s", text)
                        : String.format("%-" + widths[i] + "s", text);
                line.append(' ').append(padded).append(' ');
            }
            writer.println(line.toString().stripTrailing());
        }
        writer.flush();
    }

    static String cell(Object value) {
        return JdbcValues.toText(value).replace("\n", "\\n");
    }

    private static String center(String text, int width) {
        int left = (width - text.length()) / 2;
        return " ".repeat(left) + text + " ".repeat(width - text.length() - left);
    }
}
