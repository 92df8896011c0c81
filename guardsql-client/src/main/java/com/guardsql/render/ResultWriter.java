package com.guardsql.render;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes a result in one output format.
 */
public interface ResultWriter {
    void write(ResultTable table, OutputStream out) throws IOException;
}
