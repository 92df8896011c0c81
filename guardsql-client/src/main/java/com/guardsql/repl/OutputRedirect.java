package com.guardsql.repl;

import com.guardsql.error.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Holds the {@code \o} target. Query results and listings go there; prompts, banners and errors
 * stay on the terminal.
 */
@Slf4j
@Component
public class OutputRedirect implements AutoCloseable {
    private PrintStream stream;
    private Path path;

    public synchronized PrintStream resolve(PrintStream terminal) {
        return stream != null ? stream : terminal;
    }

    public synchronized boolean isRedirected() {
        return stream != null;
    }

    public synchronized Path getPath() {
        return path;
    }

    /**
     * Send result output to a file, replacing its contents.
     *
     * @param target file
     */
    public synchronized void redirectTo(Path target) {
        PrintStream opened;
        try {
            opened = new PrintStream(Files.newOutputStream(target, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE), true, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PersistenceException("Cannot open " + target + ": " + e.getMessage(), e);
        }
        reset();
        stream = opened;
        path = target;
        log.info("Output redirected: path={}", target);
    }

    public synchronized void reset() {
        if (stream != null) {
            stream.close();
            log.info("Output reset to terminal: path={}", path);
        }
        stream = null;
        path = null;
    }

    @Override
    public void close() {
        reset();
    }
}
