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
 * One block per record, one {@code column | value} line per column.
 */
public class ExpandedWriter implements ResultWriter {

    @Override
    public void write(ResultTable table, OutputStream out) throws IOException {
        PrintWriter writer = new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        List<String> names = table.columnNames();
        int width = names.stream().mapToInt(String::length).max().orElse(0);
        int record = 1;
        for (Map<String, Object> row : table.getRows()) {
            writer.println("-[ RECORD " + record++ + " ]" + "-".repeat(Math.max(4, width)));
            for (String name : names) {
                writer.println(String.format("%-" + Math.max(width, 1) + "s | %s", name,
                        JdbcValues.toText(row.get(name))));
            }
        }
        writer.flush();
    }
}
