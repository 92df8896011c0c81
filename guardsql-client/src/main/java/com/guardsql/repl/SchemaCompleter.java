package com.guardsql.repl;

import com.guardsql.schema.SchemaCache;
import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.LineReader;
import org.jline.reader.ParsedLine;

import java.util.List;

/**
 * Completes metacommand names and, when the schema cache is enabled, catalog names. Reads the
 * current snapshot only; a stale snapshot triggers a background refresh.
 */
public class SchemaCompleter implements Completer {
    private final SchemaCache schemaCache;

    public SchemaCompleter(SchemaCache schemaCache) {
        this.schemaCache = schemaCache;
    }

    @Override
    public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
        String word = line.word();
        if (word.startsWith("\\")) {
            for (String command : HelpText.COMMANDS) {
                candidates.add(new Candidate(command));
            }
            return;
        }
        if (!schemaCache.isEnabled()) {
            return;
        }
        for (String name : schemaCache.current().words()) {
            candidates.add(new Candidate(name));
        }
    }
}
