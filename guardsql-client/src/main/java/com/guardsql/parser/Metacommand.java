package com.guardsql.parser;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A parsed backslash command. {@link #kind} selects which of the optional fields are meaningful.
 */
@Value
@Builder
public class Metacommand {

    public enum Kind {
        QUIT,
        HELP,
        EXPANDED_TOGGLE,
        WRITE_TOGGLE,
        REDACT_TOGGLE,
        EDIT,
        INCLUDE,
        OUTPUT,
        DEBUG,
        SET,
        DEFAULT,
        UNSET,
        GET,
        VARS,
        SNIPPET_SAVE,
        SNIPPET_RUN,
        DESCRIBE,
        LIST,
        RESULT_LIST,
        RESULT_SHOW,
        COPY
    }

    public enum ListKind {
        TABLE, INDEX, FUNCTION, VIEW, SCHEMA, SEQUENCE
    }

    Kind kind;

    /** Exact input line, as audited. */
    String text;

    /** Variable, snippet or object name. */
    String name;

    /** Variable value for SET and DEFAULT. */
    String value;

    /** Glob pattern for LIST and VARS. */
    String pattern;

    ListKind listKind;

    /** {@code +} suffix. */
    boolean detail;

    /** {@code !} suffix: run on the session connection. */
    boolean sameConnection;

    /** File argument for INCLUDE, OUTPUT and EDIT. */
    String path;

    /** {@code k=v} bindings for INCLUDE and SNIPPET_RUN, in the order given. */
    @Singular
    Map<String, String> bindings;

    /** Row limit for RESULT_LIST. */
    Integer limit;

    ResultShowOptions show;

    /** Argument of DEBUG, or null. */
    String debugWhat;

    /**
     * Options of {@code \re show}.
     */
    @Value
    @Builder
    public static class ResultShowOptions {
        /** History index; null selects the most recent result. */
        Integer index;
        /** Format name; null means the session default. */
        String format;
        /** Destination path; null prints to the current output. */
        String to;
        /** Projected columns, empty for all. */
        @Singular
        List<String> columns;
        Integer limit;
        Integer offset;
    }
}
