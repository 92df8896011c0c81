package com.guardsql.render;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.guardsql.util.JdbcValues;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * RFC 4180 CSV with a header row. SQL NULL is written as an empty field.
 */
public class CsvWriter implements ResultWriter {
    private final CsvMapper csvMapper = new CsvMapper();

    @Override
    public void write(ResultTable table, OutputStream out) throws IOException {
        List<String> names = table.columnNames();
        CsvSchema schema = CsvSchema.emptySchema().withoutHeader();
        try (SequenceWriter writer = csvMapper.writer(schema).writeValues(new NonClosingOutputStream(out))) {
            writer.write(names);
            for (Map<String, Object> row : table.getRows()) {
                List<String> values = new ArrayList<>(names.size());
                for (String name : names) {
                    Object value = row.get(name);
                    values.add(value == null ? "" : JdbcValues.toText(value));
                }
                writer.write(values);
            }
        }
        out.flush();
    }

    /**
     * Keeps the terminal stream open when the CSV generator closes.
     */
    private static final class NonClosingOutputStream extends FilterOutputStream {
        NonClosingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
        }

        @Override
        public void close() throws IOException {
            flush();
        }
    }
}
