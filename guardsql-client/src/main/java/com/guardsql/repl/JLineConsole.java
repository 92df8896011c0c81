package com.guardsql.repl;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Console backed by a JLine terminal. Ctrl-C during a query only flags the cancellation token;
 * the line reader is never re-entered from the signal handler.
 */
public class JLineConsole implements SessionConsole {
    private final Terminal terminal;
    private final PrintStream out;
    private final PrintStream err;

    public JLineConsole(Terminal terminal) {
        this.terminal = terminal;
        this.out = new PrintStream(terminal.output(), true, StandardCharsets.UTF_8);
        this.err = System.err;
    }

    @Override
    public PrintStream out() {
        return out;
    }

    @Override
    public PrintStream err() {
        return err;
    }

    @Override
    public String readLine(String prompt, List<String> recall) {
        LineReader reader = LineReaderBuilder.builder()
                .terminal(terminal)
                .history(new DefaultHistory())
                .option(LineReader.Option.DISABLE_EVENT_EXPANSION, true)
                .build();
        // Up-arrow walks from the most recent answer backwards.
        for (int i = recall.size() - 1; i >= 0; i--) {
            reader.getHistory().add(recall.get(i));
        }
        try {
            return reader.readLine(prompt);
        } catch (UserInterruptException | EndOfFileException e) {
            return null;
        }
    }

    @Override
    public InterruptScope trapInterrupt(Runnable handler) {
        Terminal.SignalHandler previous = terminal.handle(Terminal.Signal.INT, signal -> handler.run());
        return () -> terminal.handle(Terminal.Signal.INT, previous);
    }
}
