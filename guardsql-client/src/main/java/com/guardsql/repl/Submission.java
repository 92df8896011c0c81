package com.guardsql.repl;

import lombok.Value;

/**
 * What is left after processing one submission.
 */
@Value
public class Submission {
    /** Unterminated text that stays buffered. */
    String remainder;
    boolean quit;

    public static Submission quit() {
        return new Submission("", true);
    }
}
