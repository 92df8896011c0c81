package com.guardsql.repl;

import com.guardsql.error.InputException;
import com.guardsql.error.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs {@code $VISUAL} or {@code $EDITOR} on the query buffer or a file.
 */
@Slf4j
@Component
public class ExternalEditor {
    static final String DEFAULT_EDITOR = "vi";

    /**
     * Edit text in a temporary file.
     *
     * @param initial current buffer
     * @return edited text
     */
    public String editText(String initial) {
        Path tmp = null;
        try {
            tmp = Files.createTempFile("guardsql-edit-", ".sql");
            Files.writeString(tmp, initial == null ? "" : initial, StandardCharsets.UTF_8);
            launch(tmp);
            return Files.readString(tmp, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PersistenceException("Cannot edit buffer: " + e.getMessage(), e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Temporary edit file not removed: path={}, error={}", tmp, e.getMessage());
                }
            }
        }
    }

    /**
     * Edit a file in place.
     *
     * @param file file to edit
     * @return file contents after editing
     */
    public String editFile(Path file) {
        try {
            launch(file);
            return Files.exists(file) ? Files.readString(file, StandardCharsets.UTF_8) : "";
        } catch (IOException e) {
            throw new PersistenceException("Cannot edit " + file + ": " + e.getMessage(), e);
        }
    }

    static List<String> command(String editor, Path file) {
        String value = editor == null || editor.isBlank() ? DEFAULT_EDITOR : editor.trim();
        List<String> cmd = new ArrayList<>(Arrays.asList(value.split("\\s+")));
        cmd.add(file.toString());
        return cmd;
    }

    private void launch(Path file) throws IOException {
        String editor = System.getenv("VISUAL");
        if (editor == null || editor.isBlank()) {
            editor = System.getenv("EDITOR");
        }
        List<String> cmd = command(editor, file);
        log.info("Launching editor: command={}", cmd);
        Process process = new ProcessBuilder(cmd).inheritIO().start();
        try {
            int status = process.waitFor();
            if (status != 0) {
                throw new InputException("Editor exited with status " + status + "; buffer unchanged");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new InputException("Editor interrupted; buffer unchanged");
        }
    }
}
