package com.guardsql.repl;

import com.guardsql.config.GuardsqlProperties;
import com.guardsql.error.InputException;
import com.guardsql.error.PersistenceException;
import com.guardsql.render.OutputFormat;
import com.guardsql.render.ResultRenderer;
import com.guardsql.render.ResultTable;
import com.guardsql.util.Formats;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Duration;

/**
 * Prints results and command output to the terminal or the {@code \o} target.
 */
@Component
public class ResultDisplay {
    private final ResultRenderer renderer;
    private final OutputRedirect redirect;
    private final GuardsqlProperties properties;

    public ResultDisplay(ResultRenderer renderer, OutputRedirect redirect, GuardsqlProperties properties) {
        this.renderer = renderer;
        this.redirect = redirect;
        this.properties = properties;
    }

    /**
     * Print a result. Long results are truncated on the terminal, never in a redirect file.
     *
     * @param table result
     * @param format text format
     * @param console console
     * @param truncate apply the display row limit
     * @param status status line, or null
     */
    public void show(ResultTable table, OutputFormat format, SessionConsole console, boolean truncate,
                     String status) {
        if (format.isFileOnly()) {
            throw new InputException("format " + format.displayName() + " requires to=PATH");
        }
        PrintStream out = redirect.resolve(console.out());
        try {
            if (truncate && !redirect.isRedirected()) {
                GuardsqlProperties.Execute execute = properties.getExecute();
                renderer.renderToTerminal(table, format, out, execute.getDisplayRowLimit(),
                        execute.getDisplayTruncatedRows());
            } else {
                renderer.render(table, format, out);
            }
        } catch (IOException e) {
            throw new PersistenceException("Cannot write output: " + e.getMessage(), e);
        }
        if (status != null && (format == OutputFormat.TABLE || format == OutputFormat.EXPANDED)) {
            out.println(status);
        }
        out.flush();
    }

    /**
     * Print plain command output such as {@code UPDATE 3}.
     *
     * @param text text
     * @param console console
     */
    public void text(String text, SessionConsole console) {
        PrintStream out = redirect.resolve(console.out());
        out.print(text.endsWith("\n") ? text : text + "\n");
        out.flush();
    }

    public static String status(int rows, Duration took) {
        return "(" + rows + (rows == 1 ? " row" : " rows") + ", took " + Formats.duration(took) + ")";
    }
}
