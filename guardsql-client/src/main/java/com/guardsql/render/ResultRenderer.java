package com.guardsql.render;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guardsql.error.InputException;
import com.guardsql.error.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Renders results in the requested format, to the terminal or to a new file.
 */
@Slf4j
@Component
public class ResultRenderer {

    public static final String TRUNCATION_NOTICE = "[output truncated, use \\re show limit=N to print more]";

    private final ObjectMapper objectMapper;

    public ResultRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Write a result to a stream in a text or binary format that needs no file path.
     *
     * @param table result
     * @param format format; SQLite is rejected
     * @param out destination
     * @throws IOException on write failures
     */
    public void render(ResultTable table, OutputFormat format, OutputStream out) throws IOException {
        if (format == OutputFormat.SQLITE) {
            throw new InputException("format sqlite requires to=PATH");
        }
        writerFor(format).write(table, out);
    }

    /**
     * Write a result to the terminal, truncating long results.
     *
     * @param table result
     * @param format text format
     * @param out terminal stream
     * @param rowLimit results with more rows than this are truncated
     * @param truncatedRows rows shown when truncating
     * @return true if the output was truncated
     * @throws IOException on write failures
     */
    public boolean renderToTerminal(ResultTable table, OutputFormat format, PrintStream out, int rowLimit,
                                    int truncatedRows) throws IOException {
        if (format.isFileOnly()) {
            throw new InputException("format " + format.displayName() + " requires to=PATH");
        }
        boolean truncated = table.getRows().size() > rowLimit;
        render(truncated ? table.slice(0, truncatedRows) : table, format, out);
        if (truncated) {
            out.println(TRUNCATION_NOTICE);
        }
        return truncated;
    }

    /**
     * Write a result to a file that must not exist yet.
     *
     * @param table result
     * @param format format
     * @param path destination
     */
    public void renderToFile(ResultTable table, OutputFormat format, Path path) {
        checkTarget(path);
        try {
            if (format == OutputFormat.SQLITE) {
                new SqliteWriter().write(table, path);
            } else {
                try (OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE_NEW,
                        StandardOpenOption.WRITE)) {
                    writerFor(format).write(table, out);
                }
            }
            log.info("Result written: path={}, format={}, rows={}", path, format.displayName(), table.getRows().size());
        } catch (IOException e) {
            throw new PersistenceException("Cannot write " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Refuse to overwrite an existing file.
     *
     * @param path destination
     */
    public static void checkTarget(Path path) {
        if (Files.exists(path)) {
            throw new InputException("Output file '" + path + "' already exists");
        }
    }

    ResultWriter writerFor(OutputFormat format) {
        switch (format) {
            case EXPANDED:
                return new ExpandedWriter();
            case JSON_LINE:
                return new JsonWriter(objectMapper, false);
            case JSON_ARRAY:
                return new JsonWriter(objectMapper, true);
            case CSV:
                return new CsvWriter();
            case EXCEL:
                return new ExcelWriter();
            case TABLE:
            default:
                return new TableWriter();
        }
    }
}
