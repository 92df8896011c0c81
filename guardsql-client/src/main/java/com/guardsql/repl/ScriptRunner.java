package com.guardsql.repl;

/**
 * Runs a block of input text as if it had been typed.
 */
@FunctionalInterface
public interface ScriptRunner {

    /**
     * @param text input text
     * @param source name of the file or snippet, for messages
     * @param console operator console
     * @return true if the script asked to quit
     */
    boolean run(String text, String source, SessionConsole console);
}
