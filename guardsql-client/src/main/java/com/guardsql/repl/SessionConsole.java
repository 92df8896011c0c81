package com.guardsql.repl;

import java.io.PrintStream;
import java.util.List;

/**
 * The operator's side of a session: where output goes and how follow-up questions are asked.
 */
public interface SessionConsole {

    PrintStream out();

    PrintStream err();

    /**
     * Ask for one line of input.
     *
     * @param prompt prompt text
     * @param recall earlier answers offered for recall, most recent first
     * @return the answer, or null if the operator aborted
     */
    String readLine(String prompt, List<String> recall);

    /**
     * Route Ctrl-C to the given handler until the returned scope is closed.
     *
     * @param handler called from the signal thread; must only flag the request
     * @return scope restoring the previous handling
     */
    default InterruptScope trapInterrupt(Runnable handler) {
        return () -> {
        };
    }

    /**
     * Restores interrupt handling when closed.
     */
    interface InterruptScope extends AutoCloseable {
        @Override
        void close();
    }
}
